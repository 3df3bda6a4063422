package in.co.kitree.jyotish.pojos;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class Chart {

    /** Short code such as "D1" or "D9". */
    public final String code;
    public final String name;
    public final int divisionCount;
    public final ChartPosition ascendant;
    public final Map<Planet, ChartPosition> positions;

    private Chart(String code, String name, int divisionCount, ChartPosition ascendant,
                  Map<Planet, ChartPosition> positions) {
        this.code = code;
        this.name = name;
        this.divisionCount = divisionCount;
        this.ascendant = ascendant;
        this.positions = Collections.unmodifiableMap(new EnumMap<>(positions));
    }

    public static Chart of(String code, String name, int divisionCount, ChartPosition ascendant,
                           Map<Planet, ChartPosition> positions) {
        return new Chart(code, name, divisionCount, ascendant, positions);
    }

    public ChartPosition get(Planet planet) {
        return positions.get(planet);
    }
}
