package in.co.kitree.jyotish.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Cached access to secrets. An environment variable of the same name wins over secrets.json,
 * which is read once on first access (double-checked locking).
 *
 * Package-private; only used within the services package.
 */
class SecretsProvider {

    static final String SECRETS_FILE = "secrets.json";

    private static volatile Map<String, String> cache;

    private SecretsProvider() {}

    /**
     * Returns empty string if the key is set nowhere.
     */
    static String getString(String key) {
        String fromEnv = System.getenv(key);
        if (fromEnv != null && !fromEnv.isEmpty()) {
            return fromEnv;
        }
        if (cache == null) {
            synchronized (SecretsProvider.class) {
                if (cache == null) {
                    cache = loadSecrets(new File(SECRETS_FILE));
                }
            }
        }
        return cache.getOrDefault(key, "");
    }

    static Map<String, String> loadSecrets(File file) {
        Map<String, String> map = new HashMap<>();
        if (!file.exists()) {
            LoggingService.warn("secrets_file_missing", Map.of("path", file.getAbsolutePath()));
            return map;
        }
        try {
            JsonNode rootNode = new ObjectMapper().readTree(file);
            Iterator<Map.Entry<String, JsonNode>> fields = rootNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                map.put(entry.getKey(), entry.getValue().asText(""));
            }
        } catch (Exception e) {
            LoggingService.error("secrets_provider_load_failed", e, Map.of("path", file.getAbsolutePath()));
        }
        return map;
    }
}
