package warehouse.bridge.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders user-supplied names and values into SQL text.
 * Plain identifiers pass through unchanged (and stay case-insensitive); anything else is
 * double-quoted with embedded quotes doubled.
 */
public final class SqlIdentifiers {

    private static final Pattern PLAIN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_$]*$");
    private static final Pattern QUOTED = Pattern.compile("^\"(?:[^\"]|\"\")+\"$");

    private SqlIdentifiers() {
    }

    public static String identifier(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw ToolInvocationException.validation("Identifier must not be empty");
        }
        String trimmed = name.trim();
        if (PLAIN.matcher(trimmed).matches() || QUOTED.matcher(trimmed).matches()) {
            return trimmed;
        }
        return "\"" + trimmed.replace("\"", "\"\"") + "\"";
    }

    /**
     * Join the non-null parts into a dotted name, each part rendered by {@link #identifier}.
     */
    public static String qualified(String... parts) {
        List<String> rendered = new ArrayList<>();
        for (String part : parts) {
            if (part != null && !part.trim().isEmpty()) {
                rendered.add(identifier(part));
            }
        }
        if (rendered.isEmpty()) {
            throw ToolInvocationException.validation("Object name must not be empty");
        }
        return String.join(".", rendered);
    }

    /**
     * Single-quoted string literal. Backslashes are escape characters in Snowflake literals.
     */
    public static String literal(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }

    public static boolean isPlainIdentifier(String name) {
        return name != null && PLAIN.matcher(name).matches();
    }
}
