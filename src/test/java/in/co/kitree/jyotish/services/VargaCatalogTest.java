package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Sign;
import in.co.kitree.jyotish.pojos.VargaFamily;
import in.co.kitree.jyotish.services.VargaRule.AnchorMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class VargaCatalogTest {

    @Test
    public void test_catalog_listsSixteenChartsInOrder() {
        List<String> codes = VargaCatalog.all().stream().map(VargaDefinition::getCode).collect(Collectors.toList());
        assertEquals(List.of("D1", "D2", "D3", "D4", "D7", "D9", "D10", "D12", "D16", "D20", "D24", "D27",
                "D30", "D40", "D45", "D60"), codes);
    }

    @Test
    public void test_everyRule_yieldsSignIndexForEveryCell() {
        for (VargaDefinition def : VargaCatalog.all()) {
            for (int base = 0; base < 12; base++) {
                for (int i = 0; i < def.getDivisionCount(); i++) {
                    int sign = def.getRule().resultSign(base, i);
                    assertTrue(sign >= 0 && sign < 12, def.getCode() + " base " + base + " index " + i);
                }
            }
        }
    }

    @Test
    public void test_uniformCharts_useDocumentedSteps() {
        assertEquals(1, ((UniformOffsetRule) VargaCatalog.byDivision(1).getRule()).getStep());
        assertEquals(3, ((UniformOffsetRule) VargaCatalog.byDivision(4).getRule()).getStep());
        assertEquals(1, ((UniformOffsetRule) VargaCatalog.byDivision(12).getRule()).getStep());
    }

    @Test
    public void test_elementCharts_useDocumentedAnchors() {
        ElementBasedRule d9 = (ElementBasedRule) VargaCatalog.byDivision(9).getRule();
        assertEquals(Sign.ARIES.index(), d9.anchorFor(Sign.Element.FIRE));
        assertEquals(Sign.CAPRICORN.index(), d9.anchorFor(Sign.Element.EARTH));
        assertEquals(Sign.LIBRA.index(), d9.anchorFor(Sign.Element.AIR));
        assertEquals(Sign.CANCER.index(), d9.anchorFor(Sign.Element.WATER));

        for (int n : new int[] {24, 45}) {
            ElementBasedRule rule = (ElementBasedRule) VargaCatalog.byDivision(n).getRule();
            assertEquals(Sign.ARIES.index(), rule.anchorFor(Sign.Element.FIRE), "D" + n);
            assertEquals(Sign.TAURUS.index(), rule.anchorFor(Sign.Element.EARTH), "D" + n);
            assertEquals(Sign.GEMINI.index(), rule.anchorFor(Sign.Element.AIR), "D" + n);
            assertEquals(Sign.CANCER.index(), rule.anchorFor(Sign.Element.WATER), "D" + n);
        }
    }

    @Test
    public void test_natureParityCharts_onlyD16D20D40AnchorAbsolutely() {
        assertEquals(AnchorMode.RELATIVE, natureParity(10).getMode());
        assertEquals(AnchorMode.ABSOLUTE, natureParity(16).getMode());
        assertEquals(AnchorMode.ABSOLUTE, natureParity(20).getMode());
        assertEquals(AnchorMode.ABSOLUTE, natureParity(40).getMode());
        assertEquals(AnchorMode.RELATIVE, natureParity(60).getMode());

        // D40: Aries for even-indexed signs, Libra for odd-indexed, whatever the nature
        NatureParityRule d40 = natureParity(40);
        assertEquals(Sign.ARIES.index(), d40.offsetFor(Sign.LEO));
        assertEquals(Sign.LIBRA.index(), d40.offsetFor(Sign.TAURUS));
        assertEquals(Sign.LIBRA.index(), d40.resultSign(Sign.PISCES.index(), 0));
        // D10: odd-indexed signs start from the 9th
        assertEquals(8, natureParity(10).offsetFor(Sign.TAURUS));
    }

    private static NatureParityRule natureParity(int divisions) {
        return (NatureParityRule) VargaCatalog.byDivision(divisions).getRule();
    }

    @Test
    public void test_byCode_acceptsPrefixedAndBareNumbers() {
        assertEquals(9, VargaCatalog.byCode("D9").getDivisionCount());
        assertEquals(9, VargaCatalog.byCode("d9").getDivisionCount());
        assertEquals(60, VargaCatalog.byCode(" 60 ").getDivisionCount());
        assertEquals("Navamsa", VargaCatalog.byCode("D9").getName());
    }

    @Test
    public void test_unknownDivision_unsupported() {
        UnsupportedVargaException e = assertThrows(UnsupportedVargaException.class, () -> VargaCatalog.byDivision(5));
        assertEquals(UnsupportedVargaException.CODE, e.getErrorCode());
        assertThrows(UnsupportedVargaException.class, () -> VargaCatalog.byCode("Dx"));
        assertThrows(UnsupportedVargaException.class, () -> VargaCatalog.byCode(null));
    }

    @Test
    public void test_familyMismatch_rejectedAtConstruction() {
        assertThrows(UnsupportedVargaException.class, () -> new VargaDefinition("Bad", 9,
                VargaFamily.UNIFORM_OFFSET, new ElementBasedRule(0, 9, 6, 3)));
    }

    @Test
    public void test_nakshatraAlignedRule_onlyFitsTwentySeven() {
        assertThrows(UnsupportedVargaException.class, () -> new VargaDefinition("Bad", 9,
                VargaFamily.NAKSHATRA_ALIGNED, new NakshatraAlignedRule()));
    }

    @Test
    public void test_anchorOutsideZodiac_rejected() {
        assertThrows(UnsupportedVargaException.class, () -> new VargaDefinition("Bad", 9,
                VargaFamily.ELEMENT_BASED, new ElementBasedRule(0, 9, 6, 12)));
    }
}
