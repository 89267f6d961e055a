/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cformat;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.google.gson.JsonArray;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The command line formatter.
 *
 * Files named on the command line are formatted to standard output,
 * or rewritten with {@code --in-place}. With no files, standard input
 * is formatted.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final String STDIN = "<stdin>";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out));
    }

    /* What to do with each input. */
    private static enum Action {
        FORMAT, CHECK, DIFF, IN_PLACE, DUMP_TOKENS, DUMP_AST
    }

    private static final class Job {

        private final SourceFormatter formatter;
        private final Action action;
        private final double maxUnparsed;
        @CheckForNull
        private final File output;
        private final PrintStream out;

        private Job(@Nonnull SourceFormatter formatter, @Nonnull Action action, double maxUnparsed,
                @CheckForNull File output, @Nonnull PrintStream out) {
            this.formatter = formatter;
            this.action = action;
            this.maxUnparsed = maxUnparsed;
            this.output = output;
            this.out = out;
        }
    }

    /**
     * Runs the formatter with the given arguments.
     *
     * @return the process exit status: 0 on success, 1 if a check
     * found changes or an input failed, 2 on bad arguments.
     */
    public static int run(@Nonnull String[] args, @Nonnull InputStream in, @Nonnull PrintStream out) {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.acceptsAll(Arrays.asList("help", "h"),
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> versionOption = parser.acceptsAll(Arrays.asList("version", "v"),
                "Displays the product version and exits.");
        OptionSpec<?> debugOption = parser.accepts("debug",
                "Enables debug output.");
        OptionSpec<?> diffOption = parser.acceptsAll(Arrays.asList("diff", "d"),
                "Prints a unified diff of the changes formatting would make.");
        OptionSpec<?> inPlaceOption = parser.acceptsAll(Arrays.asList("in-place", "i"),
                "Rewrites each file in place.");
        OptionSpec<?> checkOption = parser.acceptsAll(Arrays.asList("check", "c"),
                "Lists files which would be reformatted, and fails if there are any.");
        OptionSpec<File> outputOption = parser.acceptsAll(Arrays.asList("output", "o"),
                "Writes the formatted source to the given file.")
                .withRequiredArg().ofType(File.class).describedAs("file");
        OptionSpec<String> typedefOption = parser.acceptsAll(Arrays.asList("typedef", "T"),
                "Treats the given identifier as a type name.")
                .withRequiredArg().ofType(String.class).describedAs("name");
        OptionSpec<?> dumpTokensOption = parser.accepts("dump-tokens",
                "Prints the tokens of each input as JSON.");
        OptionSpec<?> dumpAstOption = parser.accepts("dump-ast",
                "Prints the syntax tree of each input.");
        OptionSpec<Double> maxUnparsedOption = parser.accepts("max-unparsed",
                "Leaves a file unchanged if more than this share of its tokens cannot be parsed.")
                .withRequiredArg().ofType(Double.class).defaultsTo(0.5).describedAs("ratio");
        OptionSpec<?> lineCommentsOption = parser.accepts("line-comments",
                "Keeps // comments instead of rewriting them as /* */ comments.");
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("Files to process.");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            LOG.error(e.getMessage());
            return EXIT_USAGE;
        }

        try {
            if (options.has(helpOption)) {
                parser.printHelpOn(out);
                return EXIT_OK;
            }
            if (options.has(versionOption)) {
                version(out);
                return EXIT_OK;
            }
        } catch (IOException e) {
            LOG.error("Failed to print help", e);
            return EXIT_FAILURE;
        }

        Action action = Action.FORMAT;
        int actions = 0;
        if (options.has(checkOption)) {
            action = Action.CHECK;
            actions++;
        }
        if (options.has(diffOption)) {
            action = Action.DIFF;
            actions++;
        }
        if (options.has(inPlaceOption)) {
            action = Action.IN_PLACE;
            actions++;
        }
        if (options.has(dumpTokensOption)) {
            action = Action.DUMP_TOKENS;
            actions++;
        }
        if (options.has(dumpAstOption)) {
            action = Action.DUMP_AST;
            actions++;
        }
        if (actions > 1) {
            LOG.error("Options --check, --diff, --in-place, --dump-tokens and --dump-ast are mutually exclusive.");
            return EXIT_USAGE;
        }

        List<File> inputs = options.valuesOf(inputsOption);
        File output = options.valueOf(outputOption);
        if (output != null && (action != Action.FORMAT || inputs.size() > 1)) {
            LOG.error("Option --output takes a single input and cannot be combined with other modes.");
            return EXIT_USAGE;
        }
        if (action == Action.IN_PLACE && inputs.isEmpty()) {
            LOG.error("Option --in-place needs at least one file.");
            return EXIT_USAGE;
        }
        double maxUnparsed = options.valueOf(maxUnparsedOption);
        if (maxUnparsed < 0 || maxUnparsed > 1) {
            LOG.error("Option --max-unparsed must lie between 0 and 1, not " + maxUnparsed);
            return EXIT_USAGE;
        }

        SourceFormatter formatter = new SourceFormatter();
        formatter.setListener(new DefaultParseListener());
        if (options.has(debugOption))
            formatter.addFeature(Feature.DEBUG);
        if (options.has(lineCommentsOption))
            formatter.addFeature(Feature.LINECOMMENTS);
        for (String typedef : options.valuesOf(typedefOption))
            formatter.addTypedef(typedef);

        Job job = new Job(formatter, action, maxUnparsed, output, out);
        int status = EXIT_OK;
        if (inputs.isEmpty()) {
            try {
                String source = IOUtils.toString(in, StandardCharsets.UTF_8);
                status = Math.max(status, process(job, STDIN, source, null));
            } catch (IOException e) {
                LOG.error("Failed to read standard input", e);
                status = EXIT_FAILURE;
            }
        } else {
            for (File input : inputs) {
                try {
                    String source = FileUtils.readFileToString(input, StandardCharsets.UTF_8);
                    status = Math.max(status, process(job, input.getPath(), source, input));
                } catch (IOException e) {
                    LOG.error("Failed to process " + input, e);
                    status = EXIT_FAILURE;
                }
            }
        }
        return status;
    }

    private static int process(@Nonnull Job job, @Nonnull String name, @Nonnull String source,
            @CheckForNull File file) throws IOException {
        switch (job.action) {
            case DUMP_TOKENS: {
                JsonArray array = new JsonArray();
                for (Token tok : Lexer.tokenize(source))
                    array.add(tok.toJson());
                Gson gson = new GsonBuilder().setPrettyPrinting().create();
                job.out.println(gson.toJson(array));
                return EXIT_OK;
            }
            case DUMP_AST:
                job.out.print(job.formatter.parse(source, name).dump());
                return EXIT_OK;
            default:
                break;
        }

        FormatResult result = job.formatter.format(source, name);
        String text = result.getText();
        if (result.getUnparsedRatio() > job.maxUnparsed) {
            LOG.warn(name + ": " + Math.round(result.getUnparsedRatio() * 100)
                    + "% of the source could not be parsed; leaving it unchanged");
            text = source;
        }
        boolean changed = !text.equals(source);

        switch (job.action) {
            case CHECK:
                if (!changed)
                    return EXIT_OK;
                job.out.println(name + ": would be reformatted");
                return EXIT_FAILURE;
            case DIFF:
                if (changed)
                    diff(job.out, name, source, text);
                return EXIT_OK;
            case IN_PLACE:
                if (changed && file != null)
                    FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
                return EXIT_OK;
            default:
                if (job.output != null)
                    FileUtils.writeStringToFile(job.output, text, StandardCharsets.UTF_8);
                else
                    job.out.print(text);
                return EXIT_OK;
        }
    }

    private static void diff(@Nonnull PrintStream out, @Nonnull String name,
            @Nonnull String original, @Nonnull String formatted) throws IOException {
        List<String> originalLines = IOUtils.readLines(new StringReader(original));
        List<String> formattedLines = IOUtils.readLines(new StringReader(formatted));
        Patch<String> patch = DiffUtils.diff(originalLines, formattedLines);
        for (String line : UnifiedDiffUtils.generateUnifiedDiff(name + " (original)", name + " (formatted)",
                originalLines, patch, 3))
            out.println(line);
    }

    private static void version(@Nonnull PrintStream out) {
        String version = Main.class.getPackage().getImplementationVersion();
        out.println("Anarres C Formatter version " + (version != null ? version : "(development)"));
        out.println("Copyright (C) 2007-2015 Shevek (http://www.anarres.org/).");
        out.println("This is free software; see the source for copying conditions.  There is NO");
        out.println("warranty; not even for MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.");
    }
}
