package in.co.kitree.jyotish.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.co.kitree.jyotish.pojos.Planet;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable engine configuration, handed to every engine at construction.
 *
 * <p>{@link #load()} reads {@code engine-settings.json} from the classpath with Jackson. Any key the
 * file omits keeps its built-in default, and a missing file yields {@link #defaults()}.</p>
 */
public final class EngineSettings {

    static final Map<Planet, Double> DEFAULT_DASHA_YEARS;
    static final List<String> DEFAULT_MONTH_NAMES = List.of(
            "Chaitra", "Vaishakha", "Jyeshtha", "Ashadha", "Shravana", "Bhadrapada",
            "Ashvina", "Kartika", "Margashirsha", "Pausha", "Magha", "Phalguna");
    static final List<String> DEFAULT_KARANA_MOVABLE = List.of(
            "Bava", "Balava", "Kaulava", "Taitila", "Garaja", "Vanija", "Vishti");
    static final List<String> DEFAULT_KARANA_FIXED = List.of(
            "Kimstughna", "Shakuni", "Chatushpada", "Naga");

    static {
        Map<Planet, Double> years = new EnumMap<>(Planet.class);
        years.put(Planet.KETU, 7.0);
        years.put(Planet.VENUS, 20.0);
        years.put(Planet.SUN, 6.0);
        years.put(Planet.MOON, 10.0);
        years.put(Planet.MARS, 7.0);
        years.put(Planet.RAHU, 18.0);
        years.put(Planet.JUPITER, 16.0);
        years.put(Planet.SATURN, 19.0);
        years.put(Planet.MERCURY, 17.0);
        DEFAULT_DASHA_YEARS = Collections.unmodifiableMap(years);
    }

    static final double MAX_SYZYGY_SCAN_STEP_DAYS = 10.0;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String ayanamsa;
    private final String observationPoint;
    private final Map<Planet, Double> dashaYears;
    private final double daysPerYear;
    private final List<String> monthNames;
    private final List<String> karanaMovableNames;
    private final List<String> karanaFixedNames;
    private final int searchIterations;
    private final double searchToleranceDays;
    private final double boundaryBracketDays;
    private final double syzygySearchDays;
    private final double scanStepDays;
    private final double syzygyScanStepDays;

    EngineSettings(String ayanamsa, String observationPoint, Map<Planet, Double> dashaYears, double daysPerYear,
                   List<String> monthNames, List<String> karanaMovableNames, List<String> karanaFixedNames,
                   int searchIterations, double searchToleranceDays, double boundaryBracketDays,
                   double syzygySearchDays, double scanStepDays, double syzygyScanStepDays) {
        if (dashaYears.size() != 9 || dashaYears.values().stream().anyMatch(y -> y == null || y <= 0)) {
            throw new IllegalStateException("Dasha periods must list all nine lords with positive years: " + dashaYears);
        }
        if (monthNames.size() != 12) {
            throw new IllegalStateException("Expected 12 lunar month names, got " + monthNames.size());
        }
        if (karanaMovableNames.size() != 7 || karanaFixedNames.size() != 4) {
            throw new IllegalStateException("Expected 7 movable and 4 fixed karana names");
        }
        if (searchIterations <= 0 || searchToleranceDays <= 0 || scanStepDays <= 0
                || boundaryBracketDays < scanStepDays || syzygySearchDays < scanStepDays || daysPerYear <= 0) {
            throw new IllegalStateException("Search settings must be positive and windows wider than the scan step");
        }
        // elongation gains under 16° a day; a scan step must stay well short of half a turn
        if (syzygyScanStepDays <= 0 || syzygyScanStepDays > MAX_SYZYGY_SCAN_STEP_DAYS
                || syzygySearchDays < syzygyScanStepDays) {
            throw new IllegalStateException("Syzygy scan step must be in (0, " + MAX_SYZYGY_SCAN_STEP_DAYS
                    + "] days and inside the syzygy window, got " + syzygyScanStepDays);
        }
        this.ayanamsa = ayanamsa;
        this.observationPoint = observationPoint;
        this.dashaYears = Collections.unmodifiableMap(new EnumMap<>(dashaYears));
        this.daysPerYear = daysPerYear;
        this.monthNames = List.copyOf(monthNames);
        this.karanaMovableNames = List.copyOf(karanaMovableNames);
        this.karanaFixedNames = List.copyOf(karanaFixedNames);
        this.searchIterations = searchIterations;
        this.searchToleranceDays = searchToleranceDays;
        this.boundaryBracketDays = boundaryBracketDays;
        this.syzygySearchDays = syzygySearchDays;
        this.scanStepDays = scanStepDays;
        this.syzygyScanStepDays = syzygyScanStepDays;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(JyotishConfig.AYANAMSHA, JyotishConfig.OBSERVATION_POINT,
                DEFAULT_DASHA_YEARS, 365.25, DEFAULT_MONTH_NAMES, DEFAULT_KARANA_MOVABLE, DEFAULT_KARANA_FIXED,
                60, 1e-5, 3.0, 32.0, 0.25, 3.0);
    }

    /**
     * Settings from the classpath resource, or defaults when it is absent.
     */
    public static EngineSettings load() {
        try (InputStream in = EngineSettings.class.getClassLoader()
                .getResourceAsStream(JyotishConfig.ENGINE_SETTINGS_RESOURCE)) {
            if (in == null) {
                LoggingService.warn("engine_settings_missing",
                        Map.of("resource", JyotishConfig.ENGINE_SETTINGS_RESOURCE));
                return defaults();
            }
            return fromJson(in);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + JyotishConfig.ENGINE_SETTINGS_RESOURCE, e);
        }
    }

    public static EngineSettings fromJson(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        EngineSettings d = defaults();

        Map<Planet, Double> years = new EnumMap<>(d.dashaYears);
        JsonNode yearsNode = root.path("dashaYears");
        for (Planet planet : Planet.values()) {
            JsonNode value = yearsNode.path(planet.name());
            if (value.isNumber()) {
                years.put(planet, value.asDouble());
            }
        }

        return new EngineSettings(
                root.path("ayanamsa").asText(d.ayanamsa),
                root.path("observationPoint").asText(d.observationPoint),
                years,
                root.path("daysPerYear").asDouble(d.daysPerYear),
                readList(root.path("monthNames"), d.monthNames),
                readList(root.path("karanaMovableNames"), d.karanaMovableNames),
                readList(root.path("karanaFixedNames"), d.karanaFixedNames),
                root.path("searchIterations").asInt(d.searchIterations),
                root.path("searchToleranceDays").asDouble(d.searchToleranceDays),
                root.path("boundaryBracketDays").asDouble(d.boundaryBracketDays),
                root.path("syzygySearchDays").asDouble(d.syzygySearchDays),
                root.path("scanStepDays").asDouble(d.scanStepDays),
                root.path("syzygyScanStepDays").asDouble(d.syzygyScanStepDays));
    }

    private static List<String> readList(JsonNode node, List<String> fallback) {
        if (!node.isArray()) {
            return fallback;
        }
        List<String> values = new ArrayList<>();
        node.forEach(n -> values.add(n.asText()));
        return values;
    }

    public String getAyanamsa() {
        return ayanamsa;
    }

    public String getObservationPoint() {
        return observationPoint;
    }

    public Map<Planet, Double> getDashaYears() {
        return dashaYears;
    }

    public double dashaYears(Planet lord) {
        return dashaYears.get(lord);
    }

    /** Sum of all nine periods; 120 with the classical table. */
    public double totalDashaYears() {
        return dashaYears.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double getDaysPerYear() {
        return daysPerYear;
    }

    public List<String> getMonthNames() {
        return monthNames;
    }

    public List<String> getKaranaMovableNames() {
        return karanaMovableNames;
    }

    public List<String> getKaranaFixedNames() {
        return karanaFixedNames;
    }

    public int getSearchIterations() {
        return searchIterations;
    }

    public double getSearchToleranceDays() {
        return searchToleranceDays;
    }

    public double getBoundaryBracketDays() {
        return boundaryBracketDays;
    }

    public double getSyzygySearchDays() {
        return syzygySearchDays;
    }

    public double getScanStepDays() {
        return scanStepDays;
    }

    /** Coarser bracket scan for new and full moons, which are a fortnight apart. */
    public double getSyzygyScanStepDays() {
        return syzygyScanStepDays;
    }
}
