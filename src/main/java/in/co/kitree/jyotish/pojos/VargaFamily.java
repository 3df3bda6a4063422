package in.co.kitree.jyotish.pojos;

/**
 * Rule families used to map a sign into a divisional chart.
 * LOOKUP_TABLE is reserved for mappings with no known closed form.
 */
public enum VargaFamily {
    UNIFORM_OFFSET,
    NATURE_PARITY,
    ELEMENT_BASED,
    NAKSHATRA_ALIGNED,
    ODD_EVEN_REVERSAL,
    LOOKUP_TABLE
}
