package com.dendrol.pattern;

import com.dendrol.exceptions.LiteralException;
import com.dendrol.exceptions.LiteralException.Reason;
import com.dendrol.pattern.LiteralDecoder.TokenKind;
import com.dendrol.tree.Literal;
import com.dendrol.tree.PathComponent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class LiteralDecoderTest {

    @Test
    public void testStringEscapes() {
        assertEquals("it's", LiteralDecoder.decodeString("'it\\'s'"));
        assertEquals("C:\\temp", LiteralDecoder.decodeString("'C:\\\\temp'"));
        assertEquals("", LiteralDecoder.decodeString("''"));
    }

    @Test
    public void testStringRejectsUnknownEscape() {
        LiteralException e = assertThrows(LiteralException.class, () -> LiteralDecoder.decodeString("'a\\nb'"));
        assertEquals(Reason.BAD_ESCAPE, e.reason());
        assertEquals("'a\\nb'", e.text());
    }

    @Test
    public void testStringRejectsUnescapedQuote() {
        LiteralException e = assertThrows(LiteralException.class, () -> LiteralDecoder.decodeString("'a'b'"));
        assertEquals(Reason.UNESCAPED_QUOTE, e.reason());
    }

    @Test
    public void testNumbers() {
        assertEquals(Literal.of(12L), LiteralDecoder.decode("12", TokenKind.INTEGER));
        assertEquals(Literal.of(-3L), LiteralDecoder.decode("-3", TokenKind.INTEGER));
        assertEquals(Literal.of(12L), LiteralDecoder.decode("+12", TokenKind.INTEGER));
        assertEquals(Literal.of(7.0), LiteralDecoder.decode("7.0", TokenKind.FLOAT));
        assertEquals(Literal.of(-0.5), LiteralDecoder.decode("-.5", TokenKind.FLOAT));
    }

    @Test
    public void testIntegerOutOfRange() {
        LiteralException e = assertThrows(LiteralException.class,
            () -> LiteralDecoder.decodeInteger("99999999999999999999"));
        assertEquals(Reason.MALFORMED_NUMBER, e.reason());
    }

    @Test
    public void testBooleansAreCaseSensitive() {
        assertEquals(Literal.of(true), LiteralDecoder.decode("true", TokenKind.BOOLEAN));
        assertEquals(Literal.of(false), LiteralDecoder.decode("false", TokenKind.BOOLEAN));
        LiteralException e = assertThrows(LiteralException.class, () -> LiteralDecoder.decodeBoolean("True"));
        assertEquals(Reason.MALFORMED_BOOLEAN, e.reason());
    }

    @Test
    public void testTimestampLiteral() {
        assertEquals(Instant.parse("2017-06-29T00:00:00Z"),
            LiteralDecoder.decodeTimestampLiteral("t'2017-06-29T00:00:00Z'"));
        assertEquals(Instant.parse("2016-01-01T00:00:00.123Z"),
            LiteralDecoder.decodeTimestampLiteral("t'2016-01-01T00:00:00.123Z'"));
    }

    @Test
    public void testTimestampLiteralRejectsOffsets() {
        LiteralException e = assertThrows(LiteralException.class,
            () -> LiteralDecoder.decodeTimestampLiteral("t'2017-06-29T00:00:00+01:00'"));
        assertEquals(Reason.NON_UTC_TIMESTAMP, e.reason());

        e = assertThrows(LiteralException.class,
            () -> LiteralDecoder.decodeTimestampLiteral("t'2017-06-29T00:00:00'"));
        assertEquals(Reason.MALFORMED_TIMESTAMP, e.reason());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "2017-06-29T00:00:00Z",
        "2017-06-29 00:00:00",
        "2017-06-29t00:00:00z",
        "2017-06-29T00:00:00+00:00",
        "2017-06-29 00:00:00 Z",
    })
    public void testCanonicalTimestampForms(String text) {
        assertEquals(Instant.parse("2017-06-29T00:00:00Z"), LiteralDecoder.decodeTimestamp(text));
    }

    @Test
    public void testCanonicalTimestampRejectsNonZeroOffset() {
        LiteralException e = assertThrows(LiteralException.class,
            () -> LiteralDecoder.decodeTimestamp("2017-06-29T00:00:00-05:00"));
        assertEquals(Reason.NON_UTC_TIMESTAMP, e.reason());
    }

    @Test
    public void testCanonicalTimestampRejectsImpossibleDate() {
        LiteralException e = assertThrows(LiteralException.class,
            () -> LiteralDecoder.decodeTimestamp("2017-02-30T00:00:00Z"));
        assertEquals(Reason.MALFORMED_TIMESTAMP, e.reason());
    }

    @Test
    public void testBinaryAndHex() {
        assertEquals(Literal.BinaryValue.of((byte) 'h', (byte) 'e', (byte) 'l', (byte) 'l', (byte) 'o'),
            LiteralDecoder.decode("b'aGVsbG8='", TokenKind.BINARY));
        assertEquals(Literal.BinaryValue.of((byte) 0x0a, (byte) 0xff),
            LiteralDecoder.decode("h'0aff'", TokenKind.HEX));
        assertEquals(Literal.BinaryValue.of(), LiteralDecoder.decode("h''", TokenKind.HEX));
    }

    @Test
    public void testOddLengthHex() {
        LiteralException e = assertThrows(LiteralException.class, () -> LiteralDecoder.decodeHex("h'abc'"));
        assertEquals(Reason.ODD_LENGTH_HEX, e.reason());
    }

    @Test
    public void testMalformedBase64() {
        LiteralException e = assertThrows(LiteralException.class, () -> LiteralDecoder.decodeBase64("a$b"));
        assertEquals(Reason.MALFORMED_BINARY, e.reason());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', nullValues = "-", value = {
        "12     | -  | 12 | -",
        "-1     | -  | -1 | -",
        "1:5    | 1  | 5  | -",
        ":5     | -  | 5  | -",
        "1:     | 1  | -  | -",
        "1:10:2 | 1  | 10 | 2",
        "::-1   | -  | -  | -1",
    })
    public void testIndex(String text, Integer start, Integer stop, Integer step) {
        PathComponent.Index expected = new PathComponent.Index(
            start, (stop == null) ? null : new PathComponent.Position(stop), step);
        assertEquals(expected, LiteralDecoder.decodeIndex(text));
    }

    @Test
    public void testWildcardIndex() {
        assertEquals(PathComponent.Index.any(), LiteralDecoder.decodeIndex("*"));
        assertEquals(new PathComponent.Index(2, PathComponent.Wildcard.ANY, null), LiteralDecoder.decodeIndex("2:*"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"*:1", "a", "1:2:3:4", "1:2:*"})
    public void testMalformedIndex(String text) {
        LiteralException e = assertThrows(LiteralException.class, () -> LiteralDecoder.decodeIndex(text));
        assertEquals(Reason.MALFORMED_INDEX, e.reason());
    }
}
