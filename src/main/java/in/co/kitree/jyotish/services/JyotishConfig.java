package in.co.kitree.jyotish.services;

/**
 * Configuration constants for the engines and the remote ephemeris adapter.
 * Tunable numeric settings live in {@link EngineSettings}.
 */
public class JyotishConfig {

    // Free Astrology API URLs
    private static final String FREE_ASTROLOGY_API_BASE_URL = "https://json.freeastrologyapi.com";
    public static final String FREE_ASTROLOGY_API_PLANETS_URL = FREE_ASTROLOGY_API_BASE_URL + "/planets";

    // secrets.json key holding the Free Astrology API key
    public static final String ASTROLOGY_API_KEY_SECRET = "ASTROLOGY_API_KEY";

    // Free Astrology API settings
    public static final String OBSERVATION_POINT = "topocentric";
    public static final String AYANAMSHA = "lahiri";

    // Timeout settings
    public static final int HTTP_TIMEOUT_SECONDS = 10;

    // Classpath resource read by EngineSettings.load()
    public static final String ENGINE_SETTINGS_RESOURCE = "engine-settings.json";

    // Step used to estimate daily motion from two remote readings
    public static final double SPEED_SAMPLE_DAYS = 1.0 / 24.0;

    public static final int MIN_DASHA_DEPTH = 1;
    public static final int DEFAULT_DASHA_DEPTH = 3;
}
