package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Sign;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Naming convention: test_<scenario>_<expectedBehaviour>
 */
public class VargaServiceTest {

    private static int sign(Sign base, double degree, int division) {
        return VargaService.resultSign(base.index(), degree, VargaCatalog.byDivision(division));
    }

    // =========================================================================
    // divisionIndex()
    // =========================================================================

    @Test
    public void test_everyBucketMidpoint_mapsToItsOwnIndex() {
        for (VargaDefinition def : VargaCatalog.all()) {
            int n = def.getDivisionCount();
            double width = 30.0 / n;
            for (int i = 0; i < n; i++) {
                assertEquals(i, VargaService.divisionIndex((i + 0.5) * width, n), def.getCode() + " bucket " + i);
            }
        }
    }

    @Test
    public void test_degreeJustBelowEdge_settlesIntoLaterDivision() {
        assertEquals(1, VargaService.divisionIndex(2.5 - 1e-12, 12));
        assertEquals(1, VargaService.divisionIndex(10.0, 3));
        assertEquals(0, VargaService.divisionIndex(2.5 - 1e-6, 12));
    }

    @Test
    public void test_endOfSign_clampedToLastDivision() {
        assertEquals(11, VargaService.divisionIndex(29.9999999999, 12));
        assertEquals(59, VargaService.divisionIndex(29.99999999999, 60));
    }

    // =========================================================================
    // resultSign() per family
    // =========================================================================

    @Test
    public void test_d12ScorpioEarlyDegree_staysInScorpio() {
        assertEquals(Sign.SCORPIO.index(), sign(Sign.SCORPIO, 2.28, 12));
        assertEquals(Sign.SAGITTARIUS.index(), sign(Sign.SCORPIO, 2.6, 12));
    }

    @Test
    public void test_d30_evenIndexedForwardOddIndexedReverse() {
        assertEquals(Sign.CANCER.index(), sign(Sign.ARIES, 15.0, 30));
        assertEquals(Sign.AQUARIUS.index(), sign(Sign.TAURUS, 15.0, 30));
    }

    @Test
    public void test_d9_anchorsByElement() {
        assertEquals(Sign.ARIES.index(), sign(Sign.ARIES, 1.0, 9));
        assertEquals(Sign.CAPRICORN.index(), sign(Sign.TAURUS, 1.0, 9));
        assertEquals(Sign.LIBRA.index(), sign(Sign.GEMINI, 1.0, 9));
        assertEquals(Sign.PISCES.index(), sign(Sign.CANCER, 29.0, 9));
    }

    @Test
    public void test_d2_horaOfSunAndMoon() {
        assertEquals(Sign.LEO.index(), sign(Sign.ARIES, 5.0, 2));
        assertEquals(Sign.CANCER.index(), sign(Sign.ARIES, 20.0, 2));
        assertEquals(Sign.CANCER.index(), sign(Sign.TAURUS, 5.0, 2));
        assertEquals(Sign.LEO.index(), sign(Sign.TAURUS, 20.0, 2));
    }

    @Test
    public void test_d3_oddIndexedSignsCountBackwards() {
        assertEquals(Sign.LEO.index(), sign(Sign.ARIES, 12.0, 3));
        assertEquals(Sign.SAGITTARIUS.index(), sign(Sign.ARIES, 25.0, 3));
        assertEquals(Sign.CAPRICORN.index(), sign(Sign.TAURUS, 12.0, 3));
    }

    @Test
    public void test_d10_fixedSignStartsFromNinth() {
        assertEquals(Sign.ARIES.index(), sign(Sign.ARIES, 1.0, 10));
        assertEquals(Sign.CAPRICORN.index(), sign(Sign.TAURUS, 1.0, 10));
    }

    @Test
    public void test_d16_absoluteAnchorByNature() {
        assertEquals(Sign.ARIES.index(), sign(Sign.CANCER, 0.5, 16));
        assertEquals(Sign.LEO.index(), sign(Sign.TAURUS, 0.5, 16));
        assertEquals(Sign.SAGITTARIUS.index(), sign(Sign.GEMINI, 0.5, 16));
    }

    @Test
    public void test_d27_continuesAcrossSigns() {
        // (1 * 27 + 0) mod 12
        assertEquals(3, sign(Sign.TAURUS, 0.1, 27));
    }

    @Test
    public void test_d60_relativeToBaseSign() {
        assertEquals(Sign.TAURUS.index(), sign(Sign.ARIES, 0.6, 60));
        assertEquals(Sign.PISCES.index(), sign(Sign.PISCES, 0.1, 60));
    }

    @Test
    public void test_fromFullLongitude_matchesSignAndDegreeForm() {
        assertEquals(sign(Sign.SCORPIO, 2.28, 12), VargaService.resultSign(212.28, VargaCatalog.byDivision(12)));
    }

    // =========================================================================
    // Input checks
    // =========================================================================

    @Test
    public void test_degreeOutsideSign_rejected() {
        VargaDefinition d9 = VargaCatalog.byDivision(9);
        assertThrows(InputDomainException.class, () -> VargaService.resultSign(0, 30.0, d9));
        assertThrows(InputDomainException.class, () -> VargaService.resultSign(0, -0.1, d9));
        assertThrows(InputDomainException.class, () -> VargaService.resultSign(12, 1.0, d9));
        assertThrows(InputDomainException.class, () -> VargaService.resultSign(0, Double.NaN, d9));
    }
}
