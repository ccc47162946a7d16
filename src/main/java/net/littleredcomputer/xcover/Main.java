// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static Joiner spaceJoiner = Joiner.on(' ');

    private static Options options() {
        return new Options()
                .addOption("problem", true, "filename of problem description, or - for standard input")
                .addOption("all", false, "enumerate every solution rather than stopping at the first")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("timeout", true, "give up after this ISO-8601 duration");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT5S"));
    }

    /**
     * Solves the problem named on the command line, printing each solution as
     * one line per option followed by a blank line.
     * @return the number of solutions printed
     */
    static long run(String[] args, PrintStream out) throws ParseException, FileNotFoundException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        ExactCoverProblem p = ExactCoverProblem.parseFrom(problem(cmd));
        ExactCoverMatrix m = p.matrix().setLogInterval(logInterval(cmd));
        if (cmd.hasOption("timeout")) {
            final Duration timeout = Duration.parse(cmd.getOptionValue("timeout"));
            final Stopwatch sw = Stopwatch.createStarted();
            m.setCancellation(() -> sw.elapsed().compareTo(timeout) >= 0);
        }
        Consumer<List<Integer>> print = s -> {
            p.optionsToItems(s).stream().map(spaceJoiner::join).forEach(out::println);
            out.println();
        };
        long count = 0;
        try {
            if (cmd.hasOption("all")) {
                count = m.solveAll(print);
            } else {
                Optional<List<Integer>> first = p.solve();
                first.ifPresent(print);
                count = first.isPresent() ? 1 : 0;
            }
        } catch (SearchCancelledException e) {
            log.warn("%s", e.getMessage());
            count = e.getSolutions();
        }
        log.info("%d solutions", count);
        return count;
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        run(args, System.out);
    }
}
