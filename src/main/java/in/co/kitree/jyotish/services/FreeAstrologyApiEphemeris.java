package in.co.kitree.jyotish.services;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import in.co.kitree.jyotish.pojos.GeoLocation;
import in.co.kitree.jyotish.pojos.Planet;
import in.co.kitree.jyotish.pojos.SiderealPosition;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ephemeris backed by the Free Astrology API planets endpoint.
 *
 * <p>One request returns the ascendant and every body for an instant, so responses are kept per
 * (instant, place). The endpoint takes whole seconds, so instants are rounded to the nearest second before
 * the lookup. Planet positions are read for the configured observer location. The endpoint does not
 * report speed; {@link #position} estimates it from a second reading one hour later, while
 * {@link #longitude(Planet, double)} needs only one.</p>
 */
public class FreeAstrologyApiEphemeris implements EphemerisAdapter {

    static final String ASCENDANT_KEY = "Ascendant";

    private final HttpClient httpClient;
    private final Gson gson;
    private final String apiKey;
    private final GeoLocation observer;
    private final EngineSettings settings;
    private final Map<String, Map<String, Double>> snapshots = new ConcurrentHashMap<>();

    public FreeAstrologyApiEphemeris(GeoLocation observer, EngineSettings settings) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(JyotishConfig.HTTP_TIMEOUT_SECONDS))
                        .build(),
                SecretsProvider.getString(JyotishConfig.ASTROLOGY_API_KEY_SECRET),
                observer, settings);
    }

    FreeAstrologyApiEphemeris(HttpClient httpClient, String apiKey, GeoLocation observer, EngineSettings settings) {
        this.httpClient = httpClient;
        this.gson = new GsonBuilder().create();
        this.apiKey = apiKey;
        this.observer = observer;
        this.settings = settings;
    }

    @Override
    public SiderealPosition position(Planet planet, double julianDay) {
        if (planet.isDerived()) {
            return bodyPosition(planet, julianDay);
        }
        double now = longitude(planet, julianDay);
        double later = longitude(planet, julianDay + JyotishConfig.SPEED_SAMPLE_DAYS);
        double speed = BoundarySearch.signedDelta(later, now) / JyotishConfig.SPEED_SAMPLE_DAYS;
        return SiderealPosition.of(now, speed);
    }

    @Override
    public double longitude(Planet planet, double julianDay) {
        if (planet.isDerived()) {
            return SignUtils.normalize(longitude(Planet.RAHU, julianDay) + 180.0);
        }
        return snapshotLongitude(planet.getDisplayName(), julianDay, observer.latitude, observer.longitude);
    }

    @Override
    public double siderealAscendant(double julianDay, double latitude, double longitude) {
        return snapshotLongitude(ASCENDANT_KEY, julianDay, latitude, longitude);
    }

    private double snapshotLongitude(String name, double julianDay, double latitude, double longitude) {
        Instant instant = toWholeSecond(julianDay);
        String key = instant.getEpochSecond() + "|" + latitude + "|" + longitude;
        Map<String, Double> snapshot = snapshots.get(key);
        if (snapshot == null) {
            // fetched outside the map so a slow call holds no lock
            Map<String, Double> fetched = fetch(instant, latitude, longitude);
            snapshot = snapshots.putIfAbsent(key, fetched);
            if (snapshot == null) {
                snapshot = fetched;
            }
        }
        Double value = snapshot.get(name);
        if (value == null) {
            throw new EphemerisException("Free Astrology API response has no entry for " + name);
        }
        return SignUtils.normalize(value);
    }

    static Instant toWholeSecond(double julianDay) {
        return JulianDay.toInstant(julianDay).plusMillis(500).truncatedTo(ChronoUnit.SECONDS);
    }

    private Map<String, Double> fetch(Instant instant, double latitude, double longitude) {
        if (apiKey == null || apiKey.isEmpty()) {
            throw new EphemerisException(JyotishConfig.ASTROLOGY_API_KEY_SECRET + " not found in environment or "
                    + SecretsProvider.SECRETS_FILE);
        }
        String payload = gson.toJson(requestPayload(instant, latitude, longitude));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(JyotishConfig.FREE_ASTROLOGY_API_PLANETS_URL))
                .timeout(Duration.ofSeconds(JyotishConfig.HTTP_TIMEOUT_SECONDS))
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();

        HttpResponse<String> httpResponse;
        try {
            httpResponse = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EphemerisException("Free Astrology API request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EphemerisException("Free Astrology API request interrupted", e);
        }

        if (httpResponse.statusCode() < 200 || httpResponse.statusCode() >= 300) {
            LoggingService.warn("ephemeris_http_error", Map.of(
                    "statusCode", httpResponse.statusCode(), "instant", instant.toString()));
            throw new EphemerisException("Free Astrology API request failed with status code: "
                    + httpResponse.statusCode());
        }
        LoggingService.debug("ephemeris_fetched", Map.of("instant", instant.toString()));
        return parseLongitudes(httpResponse.body(), gson);
    }

    Map<String, Object> requestPayload(Instant instant, double latitude, double longitude) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        Map<String, String> apiSettings = new LinkedHashMap<>();
        apiSettings.put("observation_point", settings.getObservationPoint());
        apiSettings.put("ayanamsha", settings.getAyanamsa());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("year", utc.getYear());
        payload.put("month", utc.getMonthValue());
        payload.put("date", utc.getDayOfMonth());
        payload.put("hours", utc.getHour());
        payload.put("minutes", utc.getMinute());
        payload.put("seconds", utc.getSecond());
        payload.put("latitude", latitude);
        payload.put("longitude", longitude);
        payload.put("timezone", 0.0);
        payload.put("settings", apiSettings);
        return payload;
    }

    /**
     * Pull {@code fullDegree} per name out of the second element of {@code output}.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Double> parseLongitudes(String body, Gson gson) {
        Map<String, Object> responseMap;
        try {
            responseMap = gson.fromJson(body, Map.class);
        } catch (RuntimeException e) {
            throw new EphemerisException("Invalid response format: not a JSON object", e);
        }
        if (responseMap == null) {
            throw new EphemerisException("Invalid response format: empty body");
        }
        Object outputObj = responseMap.get("output");
        if (!(outputObj instanceof List) || ((List<Object>) outputObj).size() < 2) {
            throw new EphemerisException("Invalid response format: output is not an array of two elements");
        }
        Object namedObj = ((List<Object>) outputObj).get(1);
        if (!(namedObj instanceof Map)) {
            throw new EphemerisException("Invalid response format: second output element is not a map");
        }

        Map<String, Double> longitudes = new HashMap<>();
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) namedObj).entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            Object fullDegree = ((Map<String, Object>) entry.getValue()).get("fullDegree");
            if (fullDegree instanceof Number) {
                longitudes.put(entry.getKey(), ((Number) fullDegree).doubleValue());
            }
        }
        return longitudes;
    }
}
