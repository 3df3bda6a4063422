package in.co.kitree.jyotish.pojos;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One node of the Vimshottari tree covering {@code [start, end)}.
 * Children, when present, tile the parent span in lord-cycle order starting from the parent's lord.
 */
public final class DashaInterval {

    public final Planet lord;
    public final DashaLevel level;
    public final Instant start;
    public final Instant end;
    public final List<DashaInterval> children;

    private DashaInterval(Planet lord, DashaLevel level, Instant start, Instant end, List<DashaInterval> children) {
        this.lord = lord;
        this.level = level;
        this.start = start;
        this.end = end;
        this.children = List.copyOf(children);
    }

    public static DashaInterval of(Planet lord, DashaLevel level, Instant start, Instant end,
                                   List<DashaInterval> children) {
        return new DashaInterval(lord, level, start, end, children);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public String toString() {
        return level + "{" + lord + " " + start + " -> " + end + ", children=" + children.size() + "}";
    }
}
