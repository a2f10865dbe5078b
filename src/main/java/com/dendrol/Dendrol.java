package com.dendrol;

import com.dendrol.codec.CanonicalEncoder;
import com.dendrol.codec.CanonicalParser;
import com.dendrol.pattern.PatternParser;
import com.dendrol.tree.PatternTree;

import java.util.Objects;

/**
 * Entry point for converting between STIX pattern text, pattern trees and
 * canonical text.
 * <p>
 * The static methods use {@link DendrolConfig#DEFAULT}. Instances are
 * immutable and safe to share between threads.
 */
public final class Dendrol {
    private static final Dendrol DEFAULT = new Dendrol(DendrolConfig.DEFAULT);

    private final DendrolConfig config;
    private final PatternParser patternParser;
    private final CanonicalEncoder encoder;
    private final CanonicalParser canonicalParser;

    private Dendrol(DendrolConfig config) {
        this.config = config;
        this.patternParser = new PatternParser(config);
        this.encoder = new CanonicalEncoder();
        this.canonicalParser = new CanonicalParser(config);
    }

    public static Dendrol withConfig(DendrolConfig config) {
        return new Dendrol(Objects.requireNonNull(config, "config"));
    }

    /**
     * @throws com.dendrol.exceptions.GrammarException if the text is not a STIX pattern
     * @throws com.dendrol.exceptions.LiteralException if a literal can't be decoded
     * @throws com.dendrol.exceptions.StructuralException if the pattern nests too deeply
     */
    public static PatternTree parsePattern(String pattern) {
        return DEFAULT.parse(pattern);
    }

    /**
     * @throws com.dendrol.exceptions.EncodingException if a literal has no canonical form
     */
    public static String encode(PatternTree tree) {
        return DEFAULT.toText(tree);
    }

    /**
     * @throws com.dendrol.exceptions.StructuralException if the text is malformed or breaks a tree invariant
     * @throws com.dendrol.exceptions.LiteralException if a scalar can't be decoded
     */
    public static PatternTree decode(String canonicalText) {
        return DEFAULT.fromText(canonicalText);
    }

    public PatternTree parse(String pattern) {
        return patternParser.parse(pattern);
    }

    public String toText(PatternTree tree) {
        return encoder.encode(Objects.requireNonNull(tree, "tree"));
    }

    public PatternTree fromText(String canonicalText) {
        return canonicalParser.parse(Objects.requireNonNull(canonicalText, "canonicalText"));
    }

    public DendrolConfig config() {
        return config;
    }
}
