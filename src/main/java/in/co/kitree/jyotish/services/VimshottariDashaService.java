package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.DashaInterval;
import in.co.kitree.jyotish.pojos.DashaLevel;
import in.co.kitree.jyotish.pojos.DashaTimeline;
import in.co.kitree.jyotish.pojos.Nakshatra;
import in.co.kitree.jyotish.pojos.NakshatraPlacement;
import in.co.kitree.jyotish.pojos.Planet;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Vimshottari dasha tree from the Moon's birth longitude.
 *
 * <h2>Rules</h2>
 * <pre>
 *   fraction      = degrees into birth nakshatra / 13°20'
 *   first balance = (1 - fraction) × period(lord of birth nakshatra)
 *   sub-period    = parent duration × period(sub-lord) / 120, lords cycling from the parent's lord
 * </pre>
 *
 * <p>The root spans the full cycle from birth. Its Mahadashas run in cycle order; the last one returns to the
 * starting lord for the {@code fraction} it had already consumed, so the root is exactly 120 years long.
 * Time is handled in integer nanoseconds and every subdivision is computed from cumulative boundaries, so
 * children always tile their parent with no gap or overlap.</p>
 */
public class VimshottariDashaService {

    /**
     * How the first (and last, partial) Mahadasha is subdivided.
     */
    public enum BalanceMode {
        /** The balance itself is split proportionally, starting with the Mahadasha lord. */
        PROPORTIONAL,
        /** Sub-periods are laid over the full theoretical Mahadasha, which began before birth, then clipped. */
        ELAPSED
    }

    private static final BigDecimal NANOS_PER_DAY = BigDecimal.valueOf(86_400_000_000_000L);

    private final EngineSettings settings;
    private final List<Planet> cycle = Planet.VIMSHOTTARI_CYCLE;

    public VimshottariDashaService(EngineSettings settings) {
        this.settings = settings;
    }

    public DashaTimeline generate(Instant birth, double moonLongitude, int depth) {
        return generate(birth, moonLongitude, depth, null, BalanceMode.PROPORTIONAL);
    }

    /**
     * @param horizon optional cut-off; the tree is clipped there when it falls inside the cycle
     */
    public DashaTimeline generate(Instant birth, double moonLongitude, int depth, Instant horizon, BalanceMode mode) {
        double moon = SignUtils.requireLongitude("Moon", moonLongitude);
        if (depth < JyotishConfig.MIN_DASHA_DEPTH || depth > DashaLevel.MAX_DEPTH) {
            throw new InputDomainException("Dasha depth must be between " + JyotishConfig.MIN_DASHA_DEPTH
                    + " and " + DashaLevel.MAX_DEPTH + ", got " + depth);
        }
        if (horizon != null && !horizon.isAfter(birth)) {
            throw new InputDomainException("Dasha horizon " + horizon + " is not after birth " + birth);
        }

        NakshatraPlacement placement = SignUtils.nakshatraOf(moon);
        Nakshatra nakshatra = placement.asNakshatra();
        Planet startingLord = nakshatra.lord();
        double fraction = placement.fraction;
        double balanceYears = (1.0 - fraction) * settings.dashaYears(startingLord);

        long cycleNanos = yearsToNanos(settings.totalDashaYears());
        Instant cycleEnd = birth.plusNanos(cycleNanos);
        List<DashaInterval> mahadashas = mode == BalanceMode.ELAPSED
                ? elapsedMahadashas(birth, cycleEnd, startingLord, fraction, depth)
                : proportionalMahadashas(birth, cycleEnd, startingLord, balanceYears, depth);
        DashaInterval root = DashaInterval.of(startingLord, DashaLevel.CYCLE, birth, cycleEnd, mahadashas);

        if (horizon != null && horizon.isBefore(cycleEnd)) {
            root = clip(root, birth, horizon);
        }

        LoggingService.debug("dasha_timeline_generated", Map.of(
                "nakshatra", nakshatra.name(), "startingLord", startingLord.name(),
                "fraction", fraction, "balanceYears", balanceYears, "depth", depth, "mode", mode.name()));
        return DashaTimeline.of(birth, nakshatra, startingLord, fraction, balanceYears, depth, root);
    }

    /**
     * Chain of periods running at {@code instant}, Mahadasha first. Empty outside the timeline.
     */
    public List<DashaInterval> activeAt(DashaTimeline timeline, Instant instant) {
        if (!timeline.root.contains(instant)) {
            return Collections.emptyList();
        }
        List<DashaInterval> path = new ArrayList<>();
        DashaInterval node = timeline.root;
        while (!node.children.isEmpty()) {
            DashaInterval next = null;
            for (DashaInterval child : node.children) {
                if (child.contains(instant)) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                break;
            }
            path.add(next);
            node = next;
        }
        return path;
    }

    // -------------------------------------------------------------------------
    // Mahadasha layout
    // -------------------------------------------------------------------------

    private List<DashaInterval> proportionalMahadashas(Instant birth, Instant cycleEnd, Planet startingLord,
                                                       double balanceYears, int depth) {
        List<DashaInterval> result = new ArrayList<>();
        double cumulativeYears = 0.0;
        Instant start = birth;
        for (int i = 0; i <= cycle.size(); i++) {
            Planet lord = lordAfter(startingLord, i);
            double years = i == 0 ? balanceYears : settings.dashaYears(lord);
            cumulativeYears += years;
            Instant end = i == cycle.size() ? cycleEnd : birth.plusNanos(yearsToNanos(cumulativeYears));
            if (end.isAfter(start)) {
                result.add(subdivide(lord, DashaLevel.MAHA, start, end, depth));
            }
            start = end;
        }
        return result;
    }

    private List<DashaInterval> elapsedMahadashas(Instant birth, Instant cycleEnd, Planet startingLord,
                                                  double fraction, int depth) {
        long firstNanos = yearsToNanos(settings.dashaYears(startingLord));
        Instant theoreticalStart = birth.minusNanos(
                BigDecimal.valueOf(firstNanos).multiply(BigDecimal.valueOf(fraction))
                        .setScale(0, RoundingMode.HALF_EVEN).longValueExact());

        List<DashaInterval> result = new ArrayList<>();
        Instant start = theoreticalStart;
        for (int i = 0; i <= cycle.size() && start.isBefore(cycleEnd); i++) {
            Planet lord = lordAfter(startingLord, i);
            Instant end = start.plusNanos(yearsToNanos(settings.dashaYears(lord)));
            DashaInterval clipped = clip(subdivide(lord, DashaLevel.MAHA, start, end, depth), birth, cycleEnd);
            if (clipped != null) {
                result.add(clipped);
            }
            start = end;
        }
        return result;
    }

    // -------------------------------------------------------------------------
    // Recursive proportional partition
    // -------------------------------------------------------------------------

    private DashaInterval subdivide(Planet lord, DashaLevel level, Instant start, Instant end, int depth) {
        if (level.ordinal() >= depth) {
            return DashaInterval.of(lord, level, start, end, Collections.emptyList());
        }
        DashaLevel childLevel = DashaLevel.ofDepth(level.ordinal() + 1);
        BigInteger span = BigInteger.valueOf(end.getEpochSecond() - start.getEpochSecond())
                .multiply(BigInteger.valueOf(1_000_000_000L))
                .add(BigInteger.valueOf(end.getNano() - start.getNano()));
        BigInteger total = BigInteger.valueOf(Math.round(settings.totalDashaYears() * 1_000_000));

        List<DashaInterval> children = new ArrayList<>(cycle.size());
        BigInteger cumulative = BigInteger.ZERO;
        Instant childStart = start;
        for (int i = 0; i < cycle.size(); i++) {
            Planet childLord = lordAfter(lord, i);
            cumulative = cumulative.add(BigInteger.valueOf(Math.round(settings.dashaYears(childLord) * 1_000_000)));
            Instant childEnd = i == cycle.size() - 1
                    ? end
                    : start.plusNanos(span.multiply(cumulative).divide(total).longValueExact());
            children.add(subdivide(childLord, childLevel, childStart, childEnd, depth));
            childStart = childEnd;
        }
        return DashaInterval.of(lord, level, start, end, children);
    }

    /**
     * Restrict a subtree to {@code [from, to)}; null when nothing remains.
     */
    static DashaInterval clip(DashaInterval node, Instant from, Instant to) {
        if (!node.end.isAfter(from) || !node.start.isBefore(to)) {
            return null;
        }
        Instant start = node.start.isBefore(from) ? from : node.start;
        Instant end = node.end.isAfter(to) ? to : node.end;
        List<DashaInterval> children = new ArrayList<>();
        for (DashaInterval child : node.children) {
            DashaInterval clipped = clip(child, from, to);
            if (clipped != null) {
                children.add(clipped);
            }
        }
        return DashaInterval.of(node.lord, node.level, start, end, children);
    }

    private Planet lordAfter(Planet lord, int steps) {
        return cycle.get((cycle.indexOf(lord) + steps) % cycle.size());
    }

    private long yearsToNanos(double years) {
        return BigDecimal.valueOf(years)
                .multiply(BigDecimal.valueOf(settings.getDaysPerYear()))
                .multiply(NANOS_PER_DAY)
                .setScale(0, RoundingMode.HALF_EVEN)
                .longValueExact();
    }
}
