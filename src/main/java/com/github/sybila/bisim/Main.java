package com.github.sybila.bisim;

import com.github.sybila.bisim.check.BisimilarityChecker;
import com.github.sybila.bisim.check.BisimilarityResult;
import com.github.sybila.bisim.parser.LtsParseException;
import com.github.sybila.bisim.parser.LtsParser;
import com.github.sybila.bisim.parser.ParsedLts;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: {@code [--partition] model1.lts model2.lts}.
 *
 * Exit status is 0 for bisimilar models, 1 for models which are not bisimilar and 2 when the
 * comparison could not be made. Skipped malformed lines are reported by the parser's logger.
 */
public final class Main {

    public static final int EXIT_BISIMILAR = 0;
    public static final int EXIT_NOT_BISIMILAR = 1;
    public static final int EXIT_ERROR = 2;

    private static final String PARTITION_FLAG = "--partition";

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(@NotNull String[] args, @NotNull PrintStream out, @NotNull PrintStream err) {
        boolean printPartition = false;
        List<String> files = new ArrayList<>(2);
        for (String arg : args) {
            if (PARTITION_FLAG.equals(arg)) {
                printPartition = true;
            } else if (arg.startsWith("--")) {
                err.println("Unknown option: " + arg);
                usage(err);
                return EXIT_ERROR;
            } else {
                files.add(arg);
            }
        }
        if (files.size() != 2) {
            usage(err);
            return EXIT_ERROR;
        }

        ParsedLts first;
        ParsedLts second;
        try {
            first = LtsParser.parse(Paths.get(files.get(0)));
            second = LtsParser.parse(Paths.get(files.get(1)));
        } catch (IOException e) {
            err.println("Cannot read model: " + e.getMessage());
            return EXIT_ERROR;
        } catch (LtsParseException e) {
            err.println("Invalid model: " + e.getMessage());
            return EXIT_ERROR;
        }

        BisimilarityResult<String> result = new BisimilarityChecker().check(first.getSystem(), second.getSystem());
        new ConsoleReporter(out, printPartition).report(result);
        return result.isBisimilar() ? EXIT_BISIMILAR : EXIT_NOT_BISIMILAR;
    }

    private static void usage(@NotNull PrintStream err) {
        err.println("Usage: bisimilarity [" + PARTITION_FLAG + "] model1.lts model2.lts");
    }
}
