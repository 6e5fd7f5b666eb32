package io.github.cyfko.boolexpr.core.parsing;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical atoms of the expression language.
 * <p>
 * Every atom skips leading whitespace, then either returns the matched text and moves the cursor
 * past it, or returns {@code null} and leaves the cursor where it was.
 * </p>
 *
 * <table border="1">
 * <caption>Atoms</caption>
 * <tr><th>Atom</th><th>Shape</th></tr>
 * <tr><td>name</td><td>{@code [A-Za-z._][A-Za-z0-9._]*}</td></tr>
 * <tr><td>number</td><td>{@code [+-~]?\d+(\.\d*)?([eE][+-]?\d+)?}</td></tr>
 * <tr><td>value</td><td>quoted string, bare word {@code [A-Za-z0-9-_.*]+} or number</td></tr>
 * <tr><td>operator</td><td>{@code == <= >= != < > = & |}</td></tr>
 * <tr><td>keyword</td><td>{@code and or not between}, any case</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class Lexicon {

    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";
    public static final String BETWEEN = "between";

    /** Reserved words, never accepted as a bare word clause. */
    public static final Set<String> KEYWORDS = Set.of(AND, OR, NOT, BETWEEN);

    /** Two-character operators come first so that {@code <} never shadows {@code <=}. */
    public static final List<String> OPERATORS = List.of("==", "<=", ">=", "!=", "<", ">", "=", "&", "|");

    private static final Pattern NAME = Pattern.compile("[A-Za-z._][A-Za-z0-9._]*");
    private static final Pattern NUMBER = Pattern.compile("[+\\-~]?\\d+(\\.\\d*)?([eE][+\\-]?\\d+)?");
    private static final Pattern BARE_WORD = Pattern.compile("[A-Za-z0-9\\-_.*]+");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"");

    private Lexicon() {
    }

    public static String name(InputCursor cursor) {
        return match(cursor, NAME);
    }

    public static String number(InputCursor cursor) {
        return match(cursor, NUMBER);
    }

    /**
     * Matches a literal value. A quoted string yields its content without the quotes; otherwise
     * the longer of the bare word and number matches wins.
     */
    public static String value(InputCursor cursor) {
        int mark = cursor.position();
        cursor.skipWhitespace();

        Matcher quoted = region(cursor, QUOTED);
        if (quoted.lookingAt()) {
            cursor.advance(quoted.end() - quoted.regionStart());
            return quoted.group(1);
        }

        int bare = matchLength(region(cursor, BARE_WORD));
        int number = matchLength(region(cursor, NUMBER));
        int length = Math.max(bare, number);
        if (length == 0) {
            cursor.fail();
            cursor.reset(mark);
            return null;
        }
        int start = cursor.position();
        cursor.advance(length);
        return cursor.text().substring(start, start + length);
    }

    public static String operator(InputCursor cursor) {
        int mark = cursor.position();
        cursor.skipWhitespace();
        for (String operator : OPERATORS) {
            if (cursor.text().startsWith(operator, cursor.position())) {
                cursor.advance(operator.length());
                return operator;
            }
        }
        cursor.fail();
        cursor.reset(mark);
        return null;
    }

    /**
     * Matches {@code keyword} ignoring case. The keyword must not be followed by a name
     * character, so {@code android} is never read as {@code and}.
     *
     * @return {@code true} if the keyword was consumed
     */
    public static boolean keyword(InputCursor cursor, String keyword) {
        int mark = cursor.position();
        cursor.skipWhitespace();

        String text = cursor.text();
        int start = cursor.position();
        int end = start + keyword.length();
        if (text.regionMatches(true, start, keyword, 0, keyword.length())
                && (end == text.length() || !isNameChar(text.charAt(end)))) {
            cursor.advance(keyword.length());
            return true;
        }
        cursor.fail();
        cursor.reset(mark);
        return false;
    }

    public static boolean isKeyword(String candidate) {
        return candidate != null && KEYWORDS.contains(candidate.toLowerCase(Locale.ROOT));
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '.' || c == '_';
    }

    private static String match(InputCursor cursor, Pattern pattern) {
        int mark = cursor.position();
        cursor.skipWhitespace();
        Matcher matcher = region(cursor, pattern);
        if (!matcher.lookingAt()) {
            cursor.fail();
            cursor.reset(mark);
            return null;
        }
        cursor.advance(matcher.end() - matcher.regionStart());
        return matcher.group();
    }

    private static Matcher region(InputCursor cursor, Pattern pattern) {
        Matcher matcher = pattern.matcher(cursor.text());
        matcher.region(cursor.position(), cursor.text().length());
        return matcher;
    }

    private static int matchLength(Matcher matcher) {
        return matcher.lookingAt() ? matcher.end() - matcher.regionStart() : 0;
    }
}
