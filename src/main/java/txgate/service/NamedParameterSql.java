package txgate.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * SQL text with {@code :name} placeholders rewritten to JDBC {@code ?} markers.
 *
 * Rules:
 * - A placeholder is ':' followed by a letter or '_', then letters, digits or '_'.
 * - '::' is a cast, not a placeholder.
 * - Nothing inside '...' literals, "..." identifiers, $$...$$ strings or comments is a placeholder.
 * - The same name may occur several times; every occurrence becomes its own marker.
 *
 * The first keyword of every ';'-separated statement is recorded as well, so callers can tell
 * which statements the engine runs outside the enclosing transaction.
 */
public final class NamedParameterSql {

    private final String originalSql;
    private final String jdbcSql;
    private final List<String> parameterNames;
    private final Set<String> distinctNames;
    private final List<String> statementKeywords;

    private NamedParameterSql(String originalSql, String jdbcSql, List<String> parameterNames,
                              List<String> statementKeywords) {
        this.originalSql = originalSql;
        this.jdbcSql = jdbcSql;
        this.parameterNames = Collections.unmodifiableList(parameterNames);
        this.distinctNames = Collections.unmodifiableSet(new LinkedHashSet<>(parameterNames));
        this.statementKeywords = Collections.unmodifiableList(statementKeywords);
    }

    public static NamedParameterSql parse(String sql) {
        StringBuilder out = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();
        List<String> keywords = new ArrayList<>();
        boolean statementStart = true;

        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);

            if (c == ';') {
                statementStart = true;
                out.append(c);
                i++;
                continue;
            }

            if (statementStart && Character.isLetter(c)) {
                int end = i + 1;
                while (end < length && isNamePart(sql.charAt(end))) {
                    end++;
                }
                keywords.add(sql.substring(i, end).toUpperCase(Locale.ROOT));
                statementStart = false;
                out.append(sql, i, end);
                i = end;
                continue;
            }

            if (c == '\'' || c == '"') {
                statementStart = false;
                int end = skipQuoted(sql, i, c);
                out.append(sql, i, end);
                i = end;
                continue;
            }

            if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? length : end + 1;
                out.append(sql, i, end);
                i = end;
                continue;
            }

            if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                out.append(sql, i, end);
                i = end;
                continue;
            }

            if (c == '$' && i + 1 < length && sql.charAt(i + 1) == '$') {
                statementStart = false;
                int end = sql.indexOf("$$", i + 2);
                end = end < 0 ? length : end + 2;
                out.append(sql, i, end);
                i = end;
                continue;
            }

            if (c == ':') {
                statementStart = false;
                if (i + 1 < length && sql.charAt(i + 1) == ':') {
                    out.append("::");
                    i += 2;
                    continue;
                }
                if (i + 1 < length && isNameStart(sql.charAt(i + 1))) {
                    int end = i + 2;
                    while (end < length && isNamePart(sql.charAt(end))) {
                        end++;
                    }
                    names.add(sql.substring(i + 1, end));
                    out.append('?');
                    i = end;
                    continue;
                }
            }

            if (!Character.isWhitespace(c)) {
                statementStart = false;
            }
            out.append(c);
            i++;
        }

        return new NamedParameterSql(sql, out.toString(), names, keywords);
    }

    // Returns the index just past the closing quote; a doubled quote is an escaped quote.
    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    public String getOriginalSql() {
        return originalSql;
    }

    /**
     * Returns the SQL with every placeholder replaced by '?'.
     */
    public String getJdbcSql() {
        return jdbcSql;
    }

    /**
     * Returns placeholder names in order of occurrence, one entry per marker.
     */
    public List<String> getParameterNames() {
        return parameterNames;
    }

    public Set<String> getDistinctNames() {
        return distinctNames;
    }

    /**
     * Returns the upper-cased first keyword of each statement in the text, in order.
     * Empty statements between consecutive ';' are not counted.
     */
    public List<String> getStatementKeywords() {
        return statementKeywords;
    }

    public boolean hasParameters() {
        return !parameterNames.isEmpty();
    }

    @Override
    public String toString() {
        return jdbcSql;
    }
}
