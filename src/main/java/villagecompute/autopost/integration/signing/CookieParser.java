package villagecompute.autopost.integration.signing;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits a {@code Cookie} header string into name/value pairs.
 */
public final class CookieParser {

    private CookieParser() {
    }

    public static Map<String, String> parse(String cookie) {
        Map<String, String> values = new LinkedHashMap<>();
        if (cookie == null || cookie.isBlank()) {
            return values;
        }
        for (String part : cookie.split(";")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = part.substring(0, eq).trim();
            if (!name.isEmpty()) {
                values.put(name, part.substring(eq + 1).trim());
            }
        }
        return values;
    }
}
