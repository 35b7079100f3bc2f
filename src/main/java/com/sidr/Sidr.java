package com.sidr;

import com.sidr.report.ReportProducer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Search Index DB Reporter: command-line entry point.
 * <p>
 * Exit status is 0 when the scan completed (whatever individual stores did), 1 for
 * invalid arguments, 2 when the input directory or the output directory is unusable.
 */
@Slf4j
public final class Sidr {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_INPUT = 2;

    private Sidr() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    static int run(String[] args, PrintStream console) {
        CommandLine commandLine;
        try {
            commandLine = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            console.println("error: " + e.getMessage());
            console.println(CommandLine.USAGE);
            return EXIT_USAGE;
        }
        if (commandLine.isHelp()) {
            console.println(CommandLine.USAGE);
            return EXIT_OK;
        }

        var config = SidrConfig.fromSystemProperties();
        try {
            var producer = new ReportProducer(commandLine.getOutputDirectory(), commandLine.getFormat(),
                    commandLine.getOutput());
            new DirectoryScanner(config).scan(commandLine.getInput(), producer);
            return EXIT_OK;
        } catch (IOException e) {
            log.error("{}", e.getMessage());
            return EXIT_INPUT;
        }
    }
}
