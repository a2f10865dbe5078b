package com.dendrol.pattern;

import com.dendrol.DendrolConfig;
import com.dendrol.exceptions.StructuralException;
import com.dendrol.lang.STIXPatternLexer;
import com.dendrol.lang.STIXPatternParser;
import com.dendrol.tree.PatternTree;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Parses STIX pattern text with the generated grammar and hands the resulting
 * syntax tree to a {@link TreeBuilder}.
 */
public final class PatternParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(PatternParser.class);

    private final DendrolConfig config;
    private final TreeBuilder builder;

    public PatternParser() {
        this(DendrolConfig.DEFAULT);
    }

    public PatternParser(DendrolConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.builder = new TreeBuilder(config);
    }

    /**
     * @throws com.dendrol.exceptions.GrammarException at the first grammar error
     * @throws com.dendrol.exceptions.LiteralException if a literal can't be decoded
     * @throws StructuralException if the pattern nests too deeply
     */
    public PatternTree parse(String patternText) {
        Objects.requireNonNull(patternText, "patternText");

        STIXPatternLexer lexer = new STIXPatternLexer(CharStreams.fromString(patternText));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        checkNesting(tokens);

        STIXPatternParser parser = new STIXPatternParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        STIXPatternParser.PatternContext context = parser.pattern();
        LOGGER.trace("Parsed {} tokens of pattern {}", tokens.size(), patternText);
        return builder.build(context);
    }

    /**
     * The generated parser descends recursively into brackets and
     * parentheses, so their depth is bounded before it runs.
     */
    private void checkNesting(CommonTokenStream tokens) {
        int depth = 0;
        for (Token token : tokens.getTokens()) {
            switch (token.getType()) {
                case STIXPatternLexer.LPAREN, STIXPatternLexer.LBRACK -> {
                    if (++depth > config.maxDepth()) {
                        LOGGER.debug("Rejecting pattern nested deeper than {} at {}:{}",
                            config.maxDepth(), token.getLine(), token.getCharPositionInLine());
                        throw new StructuralException(
                            "Pattern nests deeper than the maximum depth of " + config.maxDepth()
                                + " at " + token.getLine() + ":" + token.getCharPositionInLine());
                    }
                }
                case STIXPatternLexer.RPAREN, STIXPatternLexer.RBRACK -> depth--;
                default -> {
                }
            }
        }
    }
}
