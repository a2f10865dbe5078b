package com.dendrol.codec;

import com.dendrol.pattern.LiteralDecoder;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * When a string must be quoted so that it reads back as the same string, and
 * how it is quoted.
 */
final class Scalars {
    private static final YAMLFactory FACTORY = new YAMLFactory();

    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{1,2}-\\d{1,2}");

    private Scalars() {
    }

    /**
     * A string can be written plain when YAML reads it back, unquoted, as the
     * same string. Dates, timestamps and a bare {@code =} are quoted too, since
     * YAML 1.1 readers give them other types.
     *
     * @param flow whether the scalar sits inside {@code [...]} or {@code {...}}
     */
    static boolean canBePlain(String s, boolean flow) {
        if (s.isEmpty() || s.equals("=") || DATE.matcher(s).matches() || LiteralDecoder.looksLikeTimestamp(s)) {
            return false;
        }
        if (reachedBySubscriptQuoting(s)) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!isPrintable(c) || c == '\t' || Character.isSurrogate(c)) {
                return false;
            }
        }
        return flow ? readsBackInFlow(s) : readsBack(s);
    }

    /**
     * Plain text that {@link CanonicalReader#quoteSubscripts} could mistake
     * for a subscript or the start of a quoted scalar.
     */
    private static boolean reachedBySubscriptQuoting(String s) {
        boolean quotes = s.indexOf('\'') >= 0 || s.indexOf('"') >= 0;
        return s.indexOf('[') >= 0 || (quotes && (s.indexOf(',') >= 0 || s.indexOf('{') >= 0));
    }

    private static boolean readsBack(String s) {
        try (YAMLParser parser = FACTORY.createParser(s)) {
            return isSameString(parser, parser.nextToken(), s) && parser.nextToken() == null;
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean readsBackInFlow(String s) {
        try (YAMLParser parser = FACTORY.createParser("[" + s + "]")) {
            return parser.nextToken() == JsonToken.START_ARRAY
                && isSameString(parser, parser.nextToken(), s)
                && parser.nextToken() == JsonToken.END_ARRAY
                && parser.nextToken() == null;
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean isSameString(YAMLParser parser, JsonToken token, String s) throws IOException {
        return token == JsonToken.VALUE_STRING
            && !parser.isCurrentAlias()
            && parser.getObjectId() == null
            && parser.getTypeId() == null
            && s.equals(parser.getText());
    }

    static boolean isPrintable(char c) {
        return !Character.isISOControl(c)
            && c != '\u2028'
            && c != '\u2029'
            && c != '\uFEFF'
            && c != '\uFFFE'
            && c != '\uFFFF';
    }

    /**
     * Renders {@code s} plain where that reads back as the same string,
     * otherwise single-quoted, or double-quoted with escapes when it holds
     * characters a single-quoted scalar cannot carry.
     */
    static String render(String s, boolean flow) {
        if (canBePlain(s, flow)) {
            return s;
        }
        if (s.codePoints().allMatch(Scalars::isPrintableCodePoint)) {
            return "'" + s.replace("'", "''") + "'";
        }
        return doubleQuoted(s);
    }

    private static boolean isPrintableCodePoint(int codePoint) {
        return Character.isSupplementaryCodePoint(codePoint)
            || (isPrintable((char) codePoint) && !Character.isSurrogate((char) codePoint));
    }

    private static String doubleQuoted(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 16).append('"');
        s.codePoints().forEach(c -> {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\0' -> sb.append("\\0");
                default -> {
                    if (isPrintableCodePoint(c)) {
                        sb.appendCodePoint(c);
                    } else if (c <= 0xFF) {
                        sb.append(String.format("\\x%02X", c));
                    } else {
                        sb.append(String.format("\\u%04X", c));
                    }
                }
            }
        });
        return sb.append('"').toString();
    }
}
