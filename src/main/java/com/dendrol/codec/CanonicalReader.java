package com.dendrol.codec;

import com.dendrol.exceptions.LiteralException;
import com.dendrol.exceptions.StructuralException;
import com.dendrol.pattern.LiteralDecoder;
import com.dendrol.tree.Literal;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.LoaderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.dendrol.exceptions.StructuralException.atLine;

/**
 * Reads canonical text into {@link TextNode}s with Jackson's streaming YAML
 * parser.
 * <p>
 * Plain scalars are typed the way YAML types them, plus UTC timestamps.
 * Anchors, aliases, tags other than {@code !!binary}, duplicate keys and
 * more than one document are rejected. Nesting is bounded.
 */
public final class CanonicalReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalReader.class);

    // A subscript such as [*], [1:*] or [:5] at the start of a node
    private static final Pattern SUBSCRIPT = Pattern.compile("\\[( *[-+0-9:*][-+0-9:* ]*)]");
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|[\r\n\\u0085\\u2028\\u2029]");

    private final YAMLFactory factory;
    private final int maxNesting;

    public CanonicalReader(int maxNesting) {
        if (maxNesting < 1) {
            throw new IllegalArgumentException("maxNesting must be positive: " + maxNesting);
        }
        this.maxNesting = maxNesting;
        LoaderOptions options = new LoaderOptions();
        options.setCodePointLimit(Integer.MAX_VALUE);
        this.factory = YAMLFactory.builder().loaderOptions(options).build()
            .configure(YAMLParser.Feature.EMPTY_STRING_AS_NULL, false);
    }

    public TextNode read(String text) {
        String source = quoteSubscripts(text);
        try (YAMLParser parser = factory.createParser(source)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new StructuralException("Canonical text is empty");
            }
            Document document = new Document(parser, LINE_BREAK.split(source, -1));
            TextNode root = document.value(token, 1);
            if (parser.nextToken() != null) {
                throw atLine(document.line(), "Only one document is supported");
            }
            LOGGER.trace("Read canonical text of {} characters", text.length());
            return root;
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            int line = (location == null) ? 0 : location.getLineNr();
            throw atLine(line, firstLine(e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new StructuralException("Cannot read canonical text: " + e.getMessage(), e);
        }
    }

    /**
     * YAML reads {@code *} as an alias and a leading {@code :} as a mapping
     * value, so subscripts are double-quoted before parsing. A subscript
     * decodes the same quoted or not.
     */
    static String quoteSubscripts(String text) {
        if (text.indexOf('[') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + 16);
        Matcher subscript = SUBSCRIPT.matcher(text);
        char quote = 0;
        boolean comment = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                comment = false;
            } else if (comment) {
                // copied as is
            } else if (quote == '\'') {
                if (c == '\'' && i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    sb.append("''");
                    i += 2;
                    continue;
                }
                if (c == '\'') {
                    quote = 0;
                }
            } else if (quote == '"') {
                if (c == '\\' && i + 1 < text.length()) {
                    sb.append(c).append(text.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    quote = 0;
                }
            } else if (c == '#' && (i == 0 || Character.isWhitespace(text.charAt(i - 1)))) {
                comment = true;
            } else if ((c == '\'' || c == '"' || c == '[') && startsNode(text, i)) {
                if (c != '[') {
                    quote = c;
                } else if (subscript.region(i, text.length()).lookingAt()) {
                    sb.append("[\"").append(subscript.group(1)).append("\"]");
                    i = subscript.end();
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /**
     * Whether position {@code i} is where a YAML node can begin: the start of
     * a line, after a flow indicator, or after {@code ": "}, {@code "- "} or
     * {@code "? "}.
     */
    private static boolean startsNode(String text, int i) {
        int j = i - 1;
        while (true) {
            int gap = j;
            while (j >= 0 && text.charAt(j) == ' ') {
                j--;
            }
            if (j < 0 || text.charAt(j) == '\n' || text.charAt(j) == '\r') {
                return true;
            }
            char previous = text.charAt(j);
            if (previous == '[' || previous == '{' || previous == ',') {
                return true;
            }
            if (j == gap) {
                return false;
            }
            if (previous == ':') {
                return true;
            }
            if (previous != '-' && previous != '?') {
                return false;
            }
            // the indicator must itself start a node
            j--;
        }
    }

    private static String firstLine(@Nullable String message) {
        if (message == null) {
            return "Malformed canonical text";
        }
        int end = message.indexOf('\n');
        return (end < 0) ? message : message.substring(0, end).strip();
    }

    private final class Document {
        private final YAMLParser parser;
        private final String[] lines;

        Document(YAMLParser parser, String[] lines) {
            this.parser = parser;
            this.lines = lines;
        }

        TextNode value(@Nullable JsonToken token, int nesting) throws IOException {
            int line = line();
            if (token == null) {
                throw atLine(line, "Canonical text ends inside a collection");
            }
            if (nesting > maxNesting) {
                throw atLine(line, "Canonical text nests deeper than " + maxNesting + " levels");
            }
            char first = sourceChar(parser.getTokenLocation(), 0);
            if (parser.isCurrentAlias() || first == '*') {
                throw atLine(line, "Aliases are not supported");
            }
            if (parser.getObjectId() != null || first == '&') {
                throw atLine(line, "Anchors are not supported");
            }
            // Jackson decodes !!binary itself
            if (token == JsonToken.VALUE_EMBEDDED_OBJECT) {
                return new TextNode.Scalar("", Literal.BinaryValue.of(parser.getBinaryValue()), line);
            }
            String tag = parser.getTypeId();
            if (tag != null || first == '!') {
                throw atLine(line, "Unsupported tag: " + ((tag == null) ? "!" : tag));
            }
            return switch (token) {
                case START_OBJECT -> mapping(line, nesting);
                case START_ARRAY -> sequence(line, nesting);
                default -> scalar(token, line);
            };
        }

        private TextNode mapping(int line, int nesting) throws IOException {
            MutableList<TextNode.Entry> entries = Lists.mutable.empty();
            MutableSet<String> keys = Sets.mutable.empty();
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
                if (token == null) {
                    throw atLine(line(), "Canonical text ends inside a mapping");
                }
                String key = parser.currentName();
                int keyLine = line();
                if (!keys.add(key)) {
                    throw atLine(keyLine, "Duplicate key: " + key);
                }
                entries.add(new TextNode.Entry(key, value(parser.nextToken(), nesting + 1), keyLine));
            }
            return new TextNode.Mapping(entries.toImmutable(), line);
        }

        private TextNode sequence(int line, int nesting) throws IOException {
            MutableList<TextNode> items = Lists.mutable.empty();
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                items.add(value(token, nesting + 1));
            }
            return new TextNode.Sequence(items.toImmutable(), line);
        }

        private TextNode scalar(JsonToken token, int line) throws IOException {
            if (token != JsonToken.VALUE_NULL && !isPlain(parser.getTokenLocation(), parser.getText())) {
                String text = parser.getText();
                return new TextNode.Scalar(text, Literal.of(text), line);
            }
            String text = (parser.getText() == null) ? "" : parser.getText();
            Literal value = switch (token) {
                case VALUE_NULL -> null;
                case VALUE_TRUE -> Literal.of(true);
                case VALUE_FALSE -> Literal.of(false);
                case VALUE_NUMBER_INT -> Literal.of(number(text, true).longValue());
                case VALUE_NUMBER_FLOAT -> Literal.of(number(text, false).doubleValue());
                case VALUE_STRING -> {
                    if (text.isEmpty()) {
                        yield null;
                    }
                    yield LiteralDecoder.looksLikeTimestamp(text)
                        ? Literal.of(LiteralDecoder.decodeTimestamp(text))
                        : Literal.of(text);
                }
                default -> throw atLine(line, "Unexpected YAML token: " + token);
            };
            return new TextNode.Scalar(text, value, line);
        }

        private Number number(String text, boolean integer) throws IOException {
            try {
                if (integer) {
                    return parser.getLongValue();
                }
                double value = parser.getDoubleValue();
                if (!Double.isFinite(value)) {
                    throw new LiteralException(LiteralException.Reason.MALFORMED_NUMBER, text);
                }
                return value;
            } catch (JsonProcessingException | NumberFormatException e) {
                throw new LiteralException(LiteralException.Reason.MALFORMED_NUMBER, text, e);
            }
        }

        /**
         * Jackson hands quoted and plain strings back alike, so the style is
         * taken from the first character of the scalar in the source.
         */
        private boolean isPlain(JsonLocation location, String text) {
            char first = sourceChar(location, 0);
            if (first == '|' || first == '>') {
                return false;
            }
            if (first != '\'' && first != '"') {
                return true;
            }
            // An empty plain scalar is marked at the token after it
            return !text.isEmpty() || sourceChar(location, 1) == first;
        }

        /**
         * The character {@code offset} chars after a location, or {@code 0}
         * past the end of its line. Columns count code points.
         */
        private char sourceChar(JsonLocation location, int offset) {
            int line = location.getLineNr();
            int column = location.getColumnNr();
            if (line < 1 || line > lines.length || column < 1) {
                return 0;
            }
            String content = lines[line - 1];
            try {
                int index = content.offsetByCodePoints(0, column - 1) + offset;
                return (index < content.length()) ? content.charAt(index) : 0;
            } catch (IndexOutOfBoundsException e) {
                return 0;
            }
        }

        int line() {
            return parser.getTokenLocation().getLineNr();
        }
    }
}
