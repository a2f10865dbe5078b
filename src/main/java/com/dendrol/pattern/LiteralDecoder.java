package com.dendrol.pattern;

import com.dendrol.exceptions.LiteralException;
import com.dendrol.exceptions.LiteralException.Reason;
import com.dendrol.tree.Literal;
import com.dendrol.tree.PathComponent;
import org.jetbrains.annotations.Nullable;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw literal lexemes into typed values.
 * <p>
 * Shared by the {@link TreeBuilder}, which sees lexemes exactly as the STIX
 * grammar produced them, and the canonical text parser, which sees bare
 * timestamps and subscripts.
 */
public final class LiteralDecoder {
    public enum TokenKind {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        TIMESTAMP,
        BINARY,
        HEX,
    }

    private static final Pattern TIMESTAMP = Pattern.compile(
        "(\\d{4}-\\d{2}-\\d{2})([Tt ])(\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?)\\s*(Z|z|[+-]\\d{2}(?::?\\d{2})?)?");


    private LiteralDecoder() {
    }

    public static Literal decode(String lexeme, TokenKind kind) {
        return switch (kind) {
            case STRING -> Literal.of(decodeString(lexeme));
            case INTEGER -> Literal.of(decodeInteger(lexeme));
            case FLOAT -> Literal.of(decodeFloat(lexeme));
            case BOOLEAN -> Literal.of(decodeBoolean(lexeme));
            case TIMESTAMP -> Literal.of(decodeTimestampLiteral(lexeme));
            case BINARY -> decodeBinary(lexeme);
            case HEX -> decodeHex(lexeme);
        };
    }

    /**
     * Strips the quotes of {@code 'it\'s'} and resolves its escapes. The only
     * escapes are {@code \'} and {@code \\}.
     */
    public static String decodeString(String lexeme) {
        String body = unwrap(lexeme, "'", Reason.MALFORMED_STRING);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\') {
                if (i + 1 >= body.length()) {
                    throw new LiteralException(Reason.BAD_ESCAPE, lexeme);
                }
                char escaped = body.charAt(++i);
                if (escaped != '\'' && escaped != '\\') {
                    throw new LiteralException(Reason.BAD_ESCAPE, lexeme);
                }
                sb.append(escaped);
            } else if (c == '\'') {
                throw new LiteralException(Reason.UNESCAPED_QUOTE, lexeme);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static long decodeInteger(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new LiteralException(Reason.MALFORMED_NUMBER, text, e);
        }
    }

    public static double decodeFloat(String text) {
        double value;
        try {
            value = Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new LiteralException(Reason.MALFORMED_NUMBER, text, e);
        }
        if (!Double.isFinite(value)) {
            throw new LiteralException(Reason.MALFORMED_NUMBER, text);
        }
        return value;
    }

    public static boolean decodeBoolean(String lexeme) {
        return switch (lexeme) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new LiteralException(Reason.MALFORMED_BOOLEAN, lexeme);
        };
    }

    /**
     * Decodes {@code t'2017-06-29T00:00:00Z'}.
     */
    public static Instant decodeTimestampLiteral(String lexeme) {
        if (!lexeme.startsWith("t")) {
            throw new LiteralException(Reason.MALFORMED_TIMESTAMP, lexeme);
        }
        String body = unwrap(lexeme.substring(1), "'", Reason.MALFORMED_TIMESTAMP);
        return parseTimestamp(body, lexeme, true);
    }

    /**
     * Decodes an RFC 3339 timestamp as written in canonical text. A missing
     * offset is taken to be UTC.
     */
    public static Instant decodeTimestamp(String text) {
        return parseTimestamp(text.trim(), text, false);
    }

    public static boolean looksLikeTimestamp(String text) {
        return TIMESTAMP.matcher(text).matches();
    }

    public static Literal.BinaryValue decodeBinary(String lexeme) {
        if (!lexeme.startsWith("b")) {
            throw new LiteralException(Reason.MALFORMED_BINARY, lexeme);
        }
        return decodeBase64(unwrap(lexeme.substring(1), "'", Reason.MALFORMED_BINARY));
    }

    public static Literal.BinaryValue decodeBase64(String text) {
        try {
            return Literal.BinaryValue.of(Base64.getDecoder().decode(text.strip()));
        } catch (IllegalArgumentException e) {
            throw new LiteralException(Reason.MALFORMED_BINARY, text, e);
        }
    }

    public static Literal.BinaryValue decodeHex(String lexeme) {
        if (!lexeme.startsWith("h")) {
            throw new LiteralException(Reason.MALFORMED_HEX, lexeme);
        }
        String digits = unwrap(lexeme.substring(1), "'", Reason.MALFORMED_HEX);
        if (digits.length() % 2 != 0) {
            throw new LiteralException(Reason.ODD_LENGTH_HEX, lexeme);
        }
        try {
            return Literal.BinaryValue.of(HexFormat.of().parseHex(digits));
        } catch (IllegalArgumentException e) {
            throw new LiteralException(Reason.MALFORMED_HEX, lexeme, e);
        }
    }

    /**
     * Decodes the inside of a subscript: {@code 1}, {@code *}, or a slice
     * {@code start:stop:step} whose parts are each optional. Only the stop may
     * be the {@code *} wildcard.
     */
    public static PathComponent.Index decodeIndex(String text) {
        String[] parts = text.split(":", -1);
        if (parts.length > 3) {
            throw new LiteralException(Reason.MALFORMED_INDEX, text);
        }
        if (parts.length == 1) {
            return new PathComponent.Index(null, stop(parts[0], text), null);
        }
        return new PathComponent.Index(
            position(parts[0], text),
            stop(parts[1], text),
            (parts.length == 3) ? position(parts[2], text) : null);
    }

    private static @Nullable PathComponent.Stop stop(String part, String text) {
        if (part.strip().equals("*")) {
            return PathComponent.Wildcard.ANY;
        }
        Integer position = position(part, text);
        return (position == null) ? null : new PathComponent.Position(position);
    }

    private static @Nullable Integer position(String part, String text) {
        String trimmed = part.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new LiteralException(Reason.MALFORMED_INDEX, text, e);
        }
    }

    /**
     * @param strict require the STIX form: upper-case {@code T} and an explicit
     *               UTC designator
     */
    private static Instant parseTimestamp(String body, String original, boolean strict) {
        Matcher matcher = TIMESTAMP.matcher(body);
        if (!matcher.matches()) {
            throw new LiteralException(Reason.MALFORMED_TIMESTAMP, original);
        }
        String separator = matcher.group(2);
        String zone = matcher.group(4);
        if (strict && (!separator.equals("T") || zone == null || zone.equals("z"))) {
            throw new LiteralException(
                (zone != null && !zone.equalsIgnoreCase("z")) ? Reason.NON_UTC_TIMESTAMP : Reason.MALFORMED_TIMESTAMP,
                original);
        }
        ZoneOffset offset;
        try {
            offset = (zone == null || zone.equalsIgnoreCase("z")) ? ZoneOffset.UTC : ZoneOffset.of(zone);
        } catch (DateTimeException e) {
            throw new LiteralException(Reason.MALFORMED_TIMESTAMP, original, e);
        }
        if (offset.getTotalSeconds() != 0) {
            throw new LiteralException(Reason.NON_UTC_TIMESTAMP, original);
        }
        try {
            return LocalDateTime.parse(matcher.group(1) + "T" + matcher.group(3)).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new LiteralException(Reason.MALFORMED_TIMESTAMP, original, e);
        }
    }

    private static String unwrap(String lexeme, String quote, Reason reason) {
        if (lexeme.length() < 2 * quote.length() || !lexeme.startsWith(quote) || !lexeme.endsWith(quote)) {
            throw new LiteralException(reason, lexeme);
        }
        return lexeme.substring(quote.length(), lexeme.length() - quote.length());
    }
}
