package app.herbaria.provenance.aggregate;

import java.util.Locale;

/**
 * Comparison key for extracted values. Never used for the stored value.
 */
public final class ValueNormalizer {

    private ValueNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static boolean sameValue(String left, String right) {
        String l = normalize(left);
        return l != null && l.equals(normalize(right));
    }
}
