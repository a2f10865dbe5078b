package com.dendrol.indicator;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Pulls STIX-language patterns out of a STIX indicator, or out of every
 * indicator in a bundle's {@code objects}.
 */
public final class IndicatorReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(IndicatorReader.class);

    private static final String STIX_PATTERN_TYPE = "stix";

    private final JsonFactory factory = new JsonFactory();

    public record Indicator(String id, String pattern) {}

    /**
     * @return indicators in document order; objects of other types and
     *         patterns in other languages are skipped
     * @throws IOException if the input is not a JSON object, or an indicator
     *         has no pattern
     */
    public ImmutableList<Indicator> read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Expected a JSON object, got " + token);
            }
            MutableList<Indicator> indicators = Lists.mutable.empty();
            readObject(parser, indicators, true);
            if (parser.nextToken() != null) {
                throw new IOException("Unexpected content after the JSON object at " + parser.currentLocation());
            }
            LOGGER.debug("Read {} STIX indicators", indicators.size());
            return indicators.toImmutable();
        }
    }

    /**
     * Reads the fields of the object whose START_OBJECT was just consumed.
     *
     * @param outermost whether a nested {@code objects} array is read as the
     *                  contents of a bundle
     */
    private void readObject(JsonParser parser, MutableList<Indicator> indicators, boolean outermost) throws IOException {
        String type = null;
        String id = null;
        String pattern = null;
        String patternType = null;
        MutableList<Indicator> contents = Lists.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonToken token = parser.nextToken();
            switch (fieldName) {
                case "type" -> type = text(parser, token);
                case "id" -> id = text(parser, token);
                case "pattern" -> pattern = text(parser, token);
                case "pattern_type" -> patternType = text(parser, token);
                case "objects" -> {
                    if (outermost && token == JsonToken.START_ARRAY) {
                        readObjects(parser, contents);
                    } else {
                        parser.skipChildren();
                    }
                }
                default -> parser.skipChildren();
            }
        }

        if ("indicator".equals(type)) {
            if (patternType != null && !STIX_PATTERN_TYPE.equals(patternType)) {
                LOGGER.debug("Skipping indicator {} with pattern type {}", id, patternType);
            } else if (pattern == null) {
                throw new IOException("Indicator " + id + " has no pattern");
            } else {
                indicators.add(new Indicator((id == null) ? "" : id, pattern));
            }
        }
        indicators.addAll(contents);
    }

    private void readObjects(JsonParser parser, MutableList<Indicator> indicators) throws IOException {
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token == JsonToken.START_OBJECT) {
                readObject(parser, indicators, false);
            } else {
                parser.skipChildren();
            }
        }
    }

    private static @Nullable String text(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case VALUE_STRING -> parser.getText();
            case VALUE_NULL -> null;
            default -> throw new IOException(
                "Expected a string for '" + parser.currentName() + "', got " + token + " at " + parser.currentLocation());
        };
    }
}
