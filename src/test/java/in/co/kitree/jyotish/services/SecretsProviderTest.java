package in.co.kitree.jyotish.services;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SecretsProviderTest {

    @TempDir
    Path tempDir;

    @Test
    public void testLoadSecretsReadsTopLevelStrings() throws Exception {
        Path file = tempDir.resolve("secrets.json");
        Files.writeString(file, "{\"ASTROLOGY_API_KEY\": \"abc123\", \"OTHER\": \"x\"}", StandardCharsets.UTF_8);
        Map<String, String> secrets = SecretsProvider.loadSecrets(file.toFile());
        assertEquals("abc123", secrets.get("ASTROLOGY_API_KEY"));
        assertEquals(2, secrets.size());
    }

    @Test
    public void testMissingFileGivesEmptyMap() {
        assertTrue(SecretsProvider.loadSecrets(new File(tempDir.toFile(), "absent.json")).isEmpty());
    }

    @Test
    public void testMalformedFileGivesEmptyMap() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);
        assertTrue(SecretsProvider.loadSecrets(file.toFile()).isEmpty());
    }
}
