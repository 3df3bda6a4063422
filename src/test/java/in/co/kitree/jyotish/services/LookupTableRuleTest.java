package in.co.kitree.jyotish.services;

import in.co.kitree.jyotish.pojos.Sign;
import in.co.kitree.jyotish.pojos.VargaFamily;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Naming convention: test_<scenario>_<expectedBehaviour>
 */
public class LookupTableRuleTest {

    private static LookupTableRule loadFixture() throws Exception {
        try (Reader reader = new InputStreamReader(
                LookupTableRuleTest.class.getResourceAsStream("/varga/d24-lookup.json"), StandardCharsets.UTF_8)) {
            return LookupTableRule.fromJson(reader);
        }
    }

    private static int[][] uniformTable(int divisions, int value) {
        int[][] table = new int[12][divisions];
        for (int[] row : table) {
            Arrays.fill(row, value);
        }
        return table;
    }

    @Test
    public void test_fixtureTable_servesAsChartDefinition() throws Exception {
        LookupTableRule rule = loadFixture();
        VargaDefinition def = new VargaDefinition("Chaturvimsamsa", 24, VargaFamily.LOOKUP_TABLE, rule);

        assertEquals(Sign.LEO.index(), VargaService.resultSign(Sign.ARIES.index(), 0.5, def));
        assertEquals(Sign.LEO.index(), VargaService.resultSign(Sign.TAURUS.index(), 1.3, def));
        assertEquals(Sign.CANCER.index(), VargaService.resultSign(Sign.TAURUS.index(), 0.1, def));
        assertFalse(rule.getProvenance().isBlank());
    }

    @Test
    public void test_missingProvenance_rejected() {
        String json = "{\"divisions\": 1, \"table\": {"
                + "\"0\":[0],\"1\":[1],\"2\":[2],\"3\":[3],\"4\":[4],\"5\":[5],"
                + "\"6\":[6],\"7\":[7],\"8\":[8],\"9\":[9],\"10\":[10],\"11\":[11]}}";
        assertThrows(UnsupportedVargaException.class, () -> LookupTableRule.fromJson(new StringReader(json)));
        assertThrows(UnsupportedVargaException.class, () -> new LookupTableRule(uniformTable(1, 0), " "));
    }

    @Test
    public void test_rowLengthDisagreesWithDivisions_rejected() {
        LookupTableRule rule = new LookupTableRule(uniformTable(3, 0), "test table");
        assertDoesNotThrow(() -> rule.validate(3));
        assertThrows(UnsupportedVargaException.class, () -> rule.validate(4));
    }

    @Test
    public void test_entryOutsideZodiac_rejected() {
        LookupTableRule rule = new LookupTableRule(uniformTable(2, 12), "test table");
        assertThrows(UnsupportedVargaException.class, () -> rule.validate(2));
    }

    @Test
    public void test_missingBaseSign_rejected() {
        String json = "{\"provenance\": \"x\", \"table\": {\"0\": [0]}}";
        assertThrows(UnsupportedVargaException.class, () -> LookupTableRule.fromJson(new StringReader(json)));
    }

    @Test
    public void test_malformedJson_reportedAsUnsupported() {
        assertThrows(UnsupportedVargaException.class, () -> LookupTableRule.fromJson(new StringReader("[1, 2]")));
        assertThrows(UnsupportedVargaException.class,
                () -> LookupTableRule.fromJson(new StringReader("{\"provenance\": \"x\", \"table\": {\"0\": [\"a\"]}}")));
    }
}
