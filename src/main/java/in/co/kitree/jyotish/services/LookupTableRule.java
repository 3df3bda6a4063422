package in.co.kitree.jyotish.services;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import in.co.kitree.jyotish.pojos.VargaFamily;

import java.io.Reader;

/**
 * Explicit sign table for a divisional chart that has no accepted closed-form rule.
 *
 * <p>{@code table[baseSign][divisionIndex]} is the result sign. Every table must say where it came from;
 * the provenance is carried with the rule and reported alongside charts built from it.</p>
 *
 * <p>JSON form, keyed by base sign:</p>
 * <pre>
 * {
 *   "provenance": "Reference ephemeris export, 2024-03",
 *   "divisions": 24,
 *   "table": { "0": [4, 5, ...], "1": [3, 4, ...], ... "11": [...] }
 * }
 * </pre>
 */
public final class LookupTableRule implements VargaRule {

    private final int[][] table;
    private final String provenance;

    public LookupTableRule(int[][] table, String provenance) {
        if (provenance == null || provenance.isBlank()) {
            throw new UnsupportedVargaException("Lookup table rule requires a provenance");
        }
        this.table = new int[table.length][];
        for (int i = 0; i < table.length; i++) {
            this.table[i] = table[i].clone();
        }
        this.provenance = provenance;
    }

    public static LookupTableRule fromJson(Reader reader) {
        try {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
            JsonObject tableNode = root.getAsJsonObject("table");
            if (tableNode == null) {
                throw new UnsupportedVargaException("Lookup table JSON has no \"table\" object");
            }
            int[][] table = new int[12][];
            for (int sign = 0; sign < 12; sign++) {
                JsonElement row = tableNode.get(String.valueOf(sign));
                if (row == null || !row.isJsonArray()) {
                    throw new UnsupportedVargaException("Lookup table is missing base sign " + sign);
                }
                int[] values = new int[row.getAsJsonArray().size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = row.getAsJsonArray().get(i).getAsInt();
                }
                table[sign] = values;
            }
            JsonElement provenance = root.get("provenance");
            LookupTableRule rule = new LookupTableRule(table, provenance == null ? null : provenance.getAsString());
            JsonElement divisions = root.get("divisions");
            if (divisions != null) {
                rule.validate(divisions.getAsInt());
            }
            return rule;
        } catch (JsonParseException | IllegalStateException | ClassCastException
                 | UnsupportedOperationException | NumberFormatException e) {
            throw new UnsupportedVargaException("Malformed lookup table JSON: " + e.getMessage());
        }
    }

    @Override
    public VargaFamily family() {
        return VargaFamily.LOOKUP_TABLE;
    }

    @Override
    public int resultSign(int baseSign, int divisionIndex) {
        return table[baseSign][divisionIndex];
    }

    @Override
    public void validate(int divisionCount) {
        if (table.length != 12) {
            throw new UnsupportedVargaException("Lookup table needs 12 rows, got " + table.length);
        }
        for (int sign = 0; sign < 12; sign++) {
            if (table[sign].length != divisionCount) {
                throw new UnsupportedVargaException("Lookup table row " + sign + " has " + table[sign].length
                        + " entries, expected " + divisionCount);
            }
            for (int value : table[sign]) {
                VargaRule.requireSignOffset("Lookup table entry", value);
            }
        }
    }

    public String getProvenance() {
        return provenance;
    }
}
