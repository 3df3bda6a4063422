package in.co.kitree.jyotish.services;

import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Locates the instant an increasing angular function of time crosses a target angle.
 *
 * <p>Angles are compared through {@link #signedDelta}, so a crossing of 0°/360° is handled like any other.
 * A bracket {@code [lo, hi]} is valid when {@code delta(lo) < 0 <= delta(hi)}; bisection keeps that
 * property and stops after the iteration budget or once the bracket is narrower than the tolerance.</p>
 */
public class BoundarySearch {

    private final int maxIterations;
    private final double toleranceDays;
    private final double scanStepDays;

    public BoundarySearch(EngineSettings settings) {
        this(settings.getSearchIterations(), settings.getSearchToleranceDays(), settings.getScanStepDays());
    }

    BoundarySearch(int maxIterations, double toleranceDays, double scanStepDays) {
        this.maxIterations = maxIterations;
        this.toleranceDays = toleranceDays;
        this.scanStepDays = scanStepDays;
    }

    /**
     * Angle from {@code target} to {@code value} folded into [-180, 180).
     */
    public static double signedDelta(double value, double target) {
        return SignUtils.normalize(value - target + 540.0) - 180.0;
    }

    /**
     * @return midpoint of the final bracket
     * @throws BoundaryNotFoundException if {@code [lo, hi]} does not bracket the crossing
     */
    public double bisect(DoubleUnaryOperator f, double target, double lo, double hi) {
        double deltaLo = signedDelta(f.applyAsDouble(lo), target);
        double deltaHi = signedDelta(f.applyAsDouble(hi), target);
        if (!(deltaLo < 0 && deltaHi >= 0)) {
            LoggingService.warn("boundary_bracket_invalid", Map.of(
                    "target", target, "lo", lo, "hi", hi, "deltaLo", deltaLo, "deltaHi", deltaHi));
            throw new BoundaryNotFoundException(String.format(
                    "No crossing of %.6f° between JD %.6f and %.6f", target, lo, hi));
        }
        return narrow(f, target, lo, hi);
    }

    /**
     * Halve a bracket already known to be valid. Costs one evaluation per iteration.
     */
    private double narrow(DoubleUnaryOperator f, double target, double lo, double hi) {
        for (int i = 0; i < maxIterations && hi - lo >= toleranceDays; i++) {
            double mid = (lo + hi) / 2.0;
            if (signedDelta(f.applyAsDouble(mid), target) < 0) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return (lo + hi) / 2.0;
    }

    /**
     * First crossing after {@code fromJd}, scanning forward at most {@code windowDays}.
     */
    public double findNext(DoubleUnaryOperator f, double target, double fromJd, double windowDays) {
        return findNext(f, target, fromJd, windowDays, scanStepDays);
    }

    /**
     * As {@link #findNext(DoubleUnaryOperator, double, double, double)} with an explicit scan step, which
     * must be short enough that {@code f} moves less than 180° per step.
     */
    public double findNext(DoubleUnaryOperator f, double target, double fromJd, double windowDays, double stepDays) {
        double limit = fromJd + windowDays;
        double t = fromJd;
        double delta = signedDelta(f.applyAsDouble(t), target);
        while (t < limit) {
            double tNext = Math.min(t + stepDays, limit);
            double deltaNext = signedDelta(f.applyAsDouble(tNext), target);
            if (delta < 0 && deltaNext >= 0) {
                return narrow(f, target, t, tNext);
            }
            t = tNext;
            delta = deltaNext;
        }
        throw notFound(target, fromJd, windowDays, "after");
    }

    /**
     * Latest crossing at or before {@code fromJd}, scanning backward at most {@code windowDays}.
     */
    public double findPrevious(DoubleUnaryOperator f, double target, double fromJd, double windowDays) {
        return findPrevious(f, target, fromJd, windowDays, scanStepDays);
    }

    public double findPrevious(DoubleUnaryOperator f, double target, double fromJd, double windowDays,
                               double stepDays) {
        double limit = fromJd - windowDays;
        double t = fromJd;
        double delta = signedDelta(f.applyAsDouble(t), target);
        while (t > limit) {
            double tPrev = Math.max(t - stepDays, limit);
            double deltaPrev = signedDelta(f.applyAsDouble(tPrev), target);
            if (deltaPrev < 0 && delta >= 0) {
                return narrow(f, target, tPrev, t);
            }
            t = tPrev;
            delta = deltaPrev;
        }
        throw notFound(target, fromJd, windowDays, "before");
    }

    public double getToleranceDays() {
        return toleranceDays;
    }

    private static BoundaryNotFoundException notFound(double target, double fromJd, double windowDays,
                                                      String direction) {
        LoggingService.warn("boundary_not_found", Map.of(
                "target", target, "fromJd", fromJd, "windowDays", windowDays, "direction", direction));
        return new BoundaryNotFoundException(String.format(
                "No crossing of %.6f° within %.2f days %s JD %.6f", target, windowDays, direction, fromJd));
    }
}
