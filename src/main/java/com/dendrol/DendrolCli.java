package com.dendrol;

import com.dendrol.exceptions.PatternException;
import com.dendrol.indicator.IndicatorReader;
import com.dendrol.tree.PatternTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "dendrol", mixinStandardHelpOptions = true, version = "1.0",
         description = "Convert STIX2 patterns to and from canonical pattern tree text",
         subcommands = {DendrolCli.Parse.class, DendrolCli.Decode.class, DendrolCli.Indicators.class})
public class DendrolCli implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DendrolCli.class);

    @Option(names = "--max-depth", defaultValue = "" + DendrolConfig.DEFAULT_MAX_DEPTH,
            description = "Deepest pattern nesting accepted (default: ${DEFAULT-VALUE})")
    private int maxDepth;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DendrolCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand");
    }

    private Dendrol dendrol() {
        if (maxDepth < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--max-depth must be at least 1: " + maxDepth);
        }
        return Dendrol.withConfig(DendrolConfig.DEFAULT.withMaxDepth(maxDepth));
    }

    /**
     * Runs one subcommand body, reporting input errors the same way for all.
     */
    private int execute(CommandLine commandLine, Action action) {
        Dendrol dendrol = dendrol();
        PrintWriter out = commandLine.getOut();
        try {
            action.run(dendrol, out);
            out.flush();
            return 0;
        } catch (PatternException | IOException e) {
            LOGGER.debug("Command failed", e);
            commandLine.getErr().println("Error: " + e.getMessage());
            commandLine.getErr().flush();
            return 1;
        }
    }

    private interface Action {
        void run(Dendrol dendrol, PrintWriter out) throws IOException;
    }

    private static String readAll(File file) throws IOException {
        return (file == null)
            ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
            : Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }

    @Command(name = "parse", description = "Print the canonical text of a STIX pattern")
    static class Parse implements Callable<Integer> {
        @ParentCommand
        private DendrolCli parent;

        @Spec
        private CommandLine.Model.CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "The STIX pattern")
        private String pattern;

        @Option(names = {"-f", "--file"}, description = "Read the pattern from a file instead")
        private File patternFile;

        @Override
        public Integer call() {
            if ((pattern == null) == (patternFile == null)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Give either a pattern or --file");
            }
            return parent.execute(spec.commandLine(), (dendrol, out) -> {
                String text = (pattern != null) ? pattern : readAll(patternFile);
                out.print(dendrol.toText(dendrol.parse(text.strip())));
            });
        }
    }

    @Command(name = "decode", description = "Validate canonical text and print its normalized form")
    static class Decode implements Callable<Integer> {
        @ParentCommand
        private DendrolCli parent;

        @Spec
        private CommandLine.Model.CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "Canonical text file (default: stdin)")
        private File inputFile;

        @Override
        public Integer call() {
            return parent.execute(spec.commandLine(), (dendrol, out) -> {
                PatternTree tree = dendrol.fromText(readAll(inputFile));
                out.print(dendrol.toText(tree));
            });
        }
    }

    @Command(name = "indicator", description = "Print the canonical text of each pattern in a STIX indicator or bundle")
    static class Indicators implements Callable<Integer> {
        @ParentCommand
        private DendrolCli parent;

        @Spec
        private CommandLine.Model.CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "Indicator or bundle JSON file (default: stdin)")
        private File inputFile;

        @Override
        public Integer call() {
            return parent.execute(spec.commandLine(), (dendrol, out) -> {
                IndicatorReader reader = new IndicatorReader();
                try (InputStream input = (inputFile != null) ? new FileInputStream(inputFile) : System.in) {
                    for (IndicatorReader.Indicator indicator : reader.read(input)) {
                        out.println("# " + indicator.id());
                        out.print(dendrol.toText(dendrol.parse(indicator.pattern())));
                    }
                }
            });
        }
    }
}
