package warehouse.bridge.policy;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Assigns a {@link StatementCategory} to raw statement text from its leading keyword(s).
 *
 * <p>Leading whitespace, comments (<code>--</code>, <code>//</code>, <code>/* *&#47;</code>) and
 * opening parentheses are skipped and keywords are matched case-insensitively. A
 * <code>WITH</code> clause is resolved by the statement that follows the CTE list. Anything that
 * does not start with a known keyword is {@link StatementCategory#UNKNOWN}.</p>
 *
 * <p>Stateless; one instance can be shared by any number of threads.</p>
 */
public class StatementClassifier {

    private static final Map<String, StatementCategory> LEADING_KEYWORDS = new HashMap<>();

    // Statements that may follow a CTE list
    private static final Set<String> CTE_BODIES = Set.of(
        "SELECT", "VALUES", "INSERT", "UPDATE", "DELETE", "MERGE");

    static {
        LEADING_KEYWORDS.put("SELECT", StatementCategory.SELECT);
        LEADING_KEYWORDS.put("VALUES", StatementCategory.SELECT);
        LEADING_KEYWORDS.put("DESCRIBE", StatementCategory.DESCRIBE);
        LEADING_KEYWORDS.put("DESC", StatementCategory.DESCRIBE);
        LEADING_KEYWORDS.put("INSERT", StatementCategory.INSERT);
        LEADING_KEYWORDS.put("UPDATE", StatementCategory.UPDATE);
        LEADING_KEYWORDS.put("DELETE", StatementCategory.DELETE);
        LEADING_KEYWORDS.put("MERGE", StatementCategory.MERGE);
        LEADING_KEYWORDS.put("TRUNCATE", StatementCategory.TRUNCATE_TABLE);
        LEADING_KEYWORDS.put("CREATE", StatementCategory.CREATE);
        LEADING_KEYWORDS.put("ALTER", StatementCategory.ALTER);
        LEADING_KEYWORDS.put("DROP", StatementCategory.DROP);
        LEADING_KEYWORDS.put("COMMIT", StatementCategory.COMMIT);
        LEADING_KEYWORDS.put("ROLLBACK", StatementCategory.ROLLBACK);
        LEADING_KEYWORDS.put("USE", StatementCategory.USE);
        LEADING_KEYWORDS.put("COMMENT", StatementCategory.COMMENT);
        for (String command : new String[] {
                "SHOW", "LIST", "LS", "PUT", "GET", "CALL", "GRANT", "REVOKE", "EXPLAIN",
                "UNDROP", "REMOVE", "RM", "COPY", "EXECUTE", "SET", "UNSET"}) {
            LEADING_KEYWORDS.put(command, StatementCategory.COMMAND);
        }
    }

    /**
     * Classify a single statement. Never throws; null, blank and unrecognized input yield
     * {@link StatementCategory#UNKNOWN}.
     */
    public StatementCategory classify(String statement) {
        if (statement == null) {
            return StatementCategory.UNKNOWN;
        }
        Cursor cursor = new Cursor(statement);
        cursor.skipTrivia(true);
        String keyword = cursor.readWord();
        if (keyword.isEmpty()) {
            return StatementCategory.UNKNOWN;
        }

        switch (keyword) {
            case "WITH":
                return classifyCteBody(cursor);
            case "BEGIN":
                return classifyBegin(cursor);
            case "START":
                cursor.skipTrivia(false);
                return "TRANSACTION".equals(cursor.readWord())
                    ? StatementCategory.TRANSACTION
                    : StatementCategory.UNKNOWN;
            default:
                return LEADING_KEYWORDS.getOrDefault(keyword, StatementCategory.UNKNOWN);
        }
    }

    /**
     * Split a script into its statements on top-level semicolons. Semicolons inside quoted
     * strings, quoted identifiers, dollar-quoted blocks and comments do not split. Pieces that
     * contain only whitespace or comments are dropped.
     */
    public List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        if (script == null) {
            return statements;
        }
        Cursor cursor = new Cursor(script);
        int start = 0;
        while (!cursor.atEnd()) {
            if (cursor.peek() == ';') {
                addStatement(statements, script.substring(start, cursor.pos));
                cursor.pos++;
                start = cursor.pos;
            } else if (!cursor.skipQuotedOrComment()) {
                cursor.pos++;
            }
        }
        addStatement(statements, script.substring(start));
        return statements;
    }

    private void addStatement(List<String> statements, String piece) {
        Cursor check = new Cursor(piece);
        check.skipTrivia(false);
        if (!check.atEnd()) {
            statements.add(piece.trim());
        }
    }

    private StatementCategory classifyCteBody(Cursor cursor) {
        while (true) {
            cursor.skipTrivia(false);
            if (cursor.atEnd()) {
                return StatementCategory.UNKNOWN;
            }
            char c = cursor.peek();
            if (c == '(') {
                cursor.skipBalancedGroup();
            } else if (cursor.skipQuotedOrComment()) {
                // quoted CTE name
            } else if (isWordChar(c)) {
                String word = cursor.readWord();
                if (CTE_BODIES.contains(word)) {
                    return LEADING_KEYWORDS.get(word);
                }
            } else {
                cursor.pos++;
            }
        }
    }

    // BEGIN [TRANSACTION | WORK] [NAME n] starts a transaction; BEGIN ... END is a scripting block
    private StatementCategory classifyBegin(Cursor cursor) {
        cursor.skipTrivia(false);
        if (cursor.atEnd() || cursor.peek() == ';') {
            return StatementCategory.TRANSACTION;
        }
        String next = cursor.readWord();
        if ("TRANSACTION".equals(next) || "WORK".equals(next) || "NAME".equals(next)) {
            return StatementCategory.TRANSACTION;
        }
        return StatementCategory.UNKNOWN;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    /**
     * Position-tracking scanner over statement text.
     */
    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        private boolean startsWith(String token) {
            return text.startsWith(token, pos);
        }

        void skipTrivia(boolean skipOpenParens) {
            while (!atEnd()) {
                char c = peek();
                if (Character.isWhitespace(c) || (skipOpenParens && c == '(')) {
                    pos++;
                } else if (startsWith("--") || startsWith("//") || startsWith("/*")) {
                    skipQuotedOrComment();
                } else {
                    return;
                }
            }
        }

        String readWord() {
            int start = pos;
            while (!atEnd() && isWordChar(peek())) {
                pos++;
            }
            return text.substring(start, pos).toUpperCase(Locale.ROOT);
        }

        /**
         * Skip one quoted literal, quoted identifier, dollar-quoted block or comment starting
         * at the cursor.
         * @return false if the cursor is not on one of them
         */
        boolean skipQuotedOrComment() {
            if (startsWith("--") || startsWith("//")) {
                int eol = text.indexOf('\n', pos);
                pos = eol < 0 ? text.length() : eol + 1;
                return true;
            }
            if (startsWith("/*")) {
                int close = text.indexOf("*/", pos + 2);
                pos = close < 0 ? text.length() : close + 2;
                return true;
            }
            if (startsWith("$$")) {
                int close = text.indexOf("$$", pos + 2);
                pos = close < 0 ? text.length() : close + 2;
                return true;
            }
            char c = peek();
            if (c == '\'' || c == '"') {
                pos++;
                while (!atEnd()) {
                    char current = peek();
                    if (current == '\\' && c == '\'') {
                        pos += 2;
                        continue;
                    }
                    pos++;
                    if (current == c) {
                        // doubled quote is an escaped quote
                        if (!atEnd() && peek() == c) {
                            pos++;
                            continue;
                        }
                        break;
                    }
                }
                pos = Math.min(pos, text.length());
                return true;
            }
            return false;
        }

        void skipBalancedGroup() {
            int depth = 0;
            while (!atEnd()) {
                char c = peek();
                if (skipQuotedOrComment()) {
                    continue;
                }
                pos++;
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth == 0) {
                        return;
                    }
                }
            }
        }
    }
}
