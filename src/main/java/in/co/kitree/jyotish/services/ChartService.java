package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Chart;
import in.co.kitree.jyotish.pojos.ChartPosition;
import in.co.kitree.jyotish.pojos.NatalPositions;
import in.co.kitree.jyotish.pojos.Planet;
import in.co.kitree.jyotish.pojos.SiderealPosition;
import in.co.kitree.jyotish.pojos.Sign;
import in.co.kitree.jyotish.pojos.SignPlacement;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the rasi chart and any divisional chart from one set of natal positions.
 */
public class ChartService {

    private final EphemerisAdapter ephemeris;

    public ChartService(EphemerisAdapter ephemeris) {
        this.ephemeris = ephemeris;
    }

    /**
     * Read the ascendant and all nine bodies for one instant and place.
     */
    public NatalPositions natalPositions(double julianDay, double latitude, double longitude) {
        SignUtils.requireGeoLocation(latitude, longitude);
        double ascendant = SignUtils.requireLongitude("Ascendant",
                ephemeris.siderealAscendant(julianDay, latitude, longitude));
        Map<Planet, SiderealPosition> bodies = new EnumMap<>(Planet.class);
        for (Planet planet : Planet.values()) {
            SiderealPosition raw = ephemeris.bodyPosition(planet, julianDay);
            double lon = SignUtils.requireLongitude(planet.getDisplayName(), raw.longitude);
            bodies.put(planet, SiderealPosition.of(lon, raw.speed));
        }
        LoggingService.debug("natal_positions_read", Map.of("julianDay", julianDay, "ascendant", ascendant));
        return NatalPositions.of(julianDay, ascendant, bodies);
    }

    public Chart buildChart(NatalPositions natal, VargaDefinition definition) {
        SignPlacement ascendantD1 = SignUtils.signOf(natal.ascendantLongitude);
        int ascendantSign = VargaService.resultSign(ascendantD1.sign, ascendantD1.degreeInSign, definition);
        ChartPosition ascendant = place(natal.ascendantLongitude, false, definition, ascendantSign);
        HouseAssignment.verifyAscendantHouse(definition.getCode(), ascendant.house);

        Map<Planet, ChartPosition> positions = new EnumMap<>(Planet.class);
        for (Map.Entry<Planet, SiderealPosition> entry : natal.bodies.entrySet()) {
            SiderealPosition body = entry.getValue();
            positions.put(entry.getKey(), place(body.longitude, body.isRetrograde(), definition, ascendantSign));
        }
        return Chart.of(definition.getCode(), definition.getName(), definition.getDivisionCount(), ascendant, positions);
    }

    public Chart buildChart(NatalPositions natal, int divisionCount) {
        return buildChart(natal, VargaCatalog.byDivision(divisionCount));
    }

    /**
     * All requested charts; every division count is checked before any chart is built.
     */
    public List<Chart> buildCharts(NatalPositions natal, List<Integer> divisionCounts) {
        List<VargaDefinition> definitions = new ArrayList<>();
        for (Integer count : divisionCounts) {
            if (count == null) {
                throw new UnsupportedVargaException("Divisional chart number is missing");
            }
            definitions.add(VargaCatalog.byDivision(count));
        }
        List<Chart> charts = new ArrayList<>();
        for (VargaDefinition definition : definitions) {
            charts.add(buildChart(natal, definition));
        }
        return charts;
    }

    /**
     * @param ascendantSign this chart's ascendant sign, houses are counted from it
     */
    private static ChartPosition place(double longitude, boolean retrograde, VargaDefinition definition,
                                       int ascendantSign) {
        SignPlacement d1 = SignUtils.signOf(longitude);
        int sign = VargaService.resultSign(d1.sign, d1.degreeInSign, definition);
        int division = VargaService.divisionIndex(d1.degreeInSign, definition.getDivisionCount()) + 1;
        int house = HouseAssignment.houseOf(sign, ascendantSign);
        return ChartPosition.of(Sign.of(sign), d1.degreeInSign, house, division, retrograde);
    }
}
