package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.VargaFamily;

/**
 * One divisional chart: its division count, declared rule family, and the rule carrying that family's parameters.
 * Construction fails fast when the pieces do not agree.
 */
public final class VargaDefinition {

    private final String code;
    private final String name;
    private final int divisionCount;
    private final VargaFamily family;
    private final VargaRule rule;

    public VargaDefinition(String name, int divisionCount, VargaFamily family, VargaRule rule) {
        if (divisionCount < 1) {
            throw new UnsupportedVargaException("Division count must be positive, got " + divisionCount);
        }
        if (rule == null || rule.family() != family) {
            throw new UnsupportedVargaException("D" + divisionCount + " declares " + family + " but its rule is "
                    + (rule == null ? "missing" : rule.family()));
        }
        rule.validate(divisionCount);
        this.code = "D" + divisionCount;
        this.name = name;
        this.divisionCount = divisionCount;
        this.family = family;
        this.rule = rule;
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public int getDivisionCount() {
        return divisionCount;
    }

    public VargaFamily getFamily() {
        return family;
    }

    public VargaRule getRule() {
        return rule;
    }

    @Override
    public String toString() {
        return code + " " + name + " (" + family + ")";
    }
}
