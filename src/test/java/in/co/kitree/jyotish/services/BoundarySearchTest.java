package in.co.kitree.jyotish.services;

import org.junit.jupiter.api.Test;

import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Naming convention: test_<scenario>_<expectedBehaviour>
 */
public class BoundarySearchTest {

    private static final double TOLERANCE_DAYS = 1e-5;

    // 10° per day, crossing 0° at t = 0.5
    private static final DoubleUnaryOperator WRAPPING = t -> SignUtils.normalize(355.0 + 10.0 * t);

    private final BoundarySearch search = new BoundarySearch(60, TOLERANCE_DAYS, 0.25);

    @Test
    public void test_signedDelta_foldsIntoHalfOpenRange() {
        assertEquals(10.0, BoundarySearch.signedDelta(5.0, 355.0), 1e-9);
        assertEquals(-10.0, BoundarySearch.signedDelta(355.0, 5.0), 1e-9);
        assertEquals(-180.0, BoundarySearch.signedDelta(180.0, 0.0), 1e-9);
        assertEquals(0.0, BoundarySearch.signedDelta(42.0, 42.0), 1e-9);
    }

    @Test
    public void test_bisect_crossingThroughZeroDegrees() {
        double t = search.bisect(WRAPPING, 0.0, 0.0, 1.0);
        assertEquals(0.5, t, TOLERANCE_DAYS);
        assertTrue(Math.abs(BoundarySearch.signedDelta(WRAPPING.applyAsDouble(t), 0.0)) < 1e-4);
    }

    @Test
    public void test_bisect_invalidBracketRejected() {
        assertThrows(BoundaryNotFoundException.class, () -> search.bisect(WRAPPING, 0.0, 0.6, 1.0));
        BoundaryNotFoundException e = assertThrows(BoundaryNotFoundException.class,
                () -> search.bisect(WRAPPING, 0.0, 0.0, 0.4));
        assertEquals(BoundaryNotFoundException.CODE, e.getErrorCode());
    }

    @Test
    public void test_bisect_stopsAtIterationCap() {
        BoundarySearch capped = new BoundarySearch(3, 1e-12, 0.25);
        assertEquals(0.4375, capped.bisect(WRAPPING, 0.0, 0.0, 1.0), 1e-12);
    }

    @Test
    public void test_findNext_scansForwardToCrossing() {
        assertEquals(0.5, search.findNext(WRAPPING, 0.0, -1.2, 3.0), TOLERANCE_DAYS);
        assertEquals(2.0, search.findNext(WRAPPING, 15.0, 0.6, 3.0), TOLERANCE_DAYS);
    }

    @Test
    public void test_findPrevious_scansBackwardToCrossing() {
        assertEquals(0.5, search.findPrevious(WRAPPING, 0.0, 2.9, 3.0), TOLERANCE_DAYS);
    }

    @Test
    public void test_findNext_scanEndpointsNotEvaluatedTwice() {
        int[] evaluations = {0};
        DoubleUnaryOperator counted = t -> {
            evaluations[0]++;
            return WRAPPING.applyAsDouble(t);
        };
        assertEquals(0.5, search.findNext(counted, 0.0, -1.2, 3.0), TOLERANCE_DAYS);
        // eight scan points from -1.2 to 0.55, then fifteen halvings of a quarter day
        assertEquals(8 + 15, evaluations[0]);
    }

    @Test
    public void test_findNext_coarseStepTakesFewerScanPoints() {
        int[] evaluations = {0};
        DoubleUnaryOperator counted = t -> {
            evaluations[0]++;
            return WRAPPING.applyAsDouble(t);
        };
        assertEquals(0.5, search.findNext(counted, 0.0, -1.2, 3.0, 1.0), TOLERANCE_DAYS);
        // -1.2, -0.2, 0.8, then seventeen halvings of one day
        assertEquals(3 + 17, evaluations[0]);
        assertEquals(0.5, search.findPrevious(WRAPPING, 0.0, 2.9, 3.0, 2.0), TOLERANCE_DAYS);
    }

    @Test
    public void test_crossingOutsideWindow_notFound() {
        assertThrows(BoundaryNotFoundException.class, () -> search.findNext(WRAPPING, 0.0, 0.6, 3.0));
        assertThrows(BoundaryNotFoundException.class, () -> search.findPrevious(WRAPPING, 0.0, 0.4, 3.0));
    }
}
