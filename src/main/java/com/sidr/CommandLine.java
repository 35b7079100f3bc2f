package com.sidr;

import com.sidr.report.ReportFormat;
import com.sidr.report.ReportOutput;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parsed command-line arguments.
 */
@Value
public class CommandLine {
    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: sidr [OPTIONS] <INPUT>",
            "",
            "Scans INPUT recursively for Windows.edb and Windows.db and writes",
            "File, Activity History and Internet History reports.",
            "",
            "Options:",
            "  -f, --format <json|csv>                  Report format (default: json)",
            "  -r, --report-type <to-file|to-stdout>    Write report files or standard output (default: to-file)",
            "  -o, --outdir <DIR>                       Directory for report files, created if missing",
            "                                           (default: current directory)",
            "  -h, --help                               Print this help",
            "",
            "System properties:",
            "  -D" + SidrConfig.VERIFY_CHECKSUMS_PROPERTY + "=false    Skip ESE page checksum verification",
            "  -D" + SidrConfig.FALLBACK_HOSTNAME_PROPERTY + "=NAME    Host name when the store records none");

    Path input;
    ReportFormat format;
    ReportOutput output;
    Path outputDirectory;
    boolean help;

    /**
     * @throws IllegalArgumentException for unknown options, missing values or a missing input
     */
    public static CommandLine parse(String... args) {
        Path input = null;
        var format = ReportFormat.JSON;
        var output = ReportOutput.TO_FILE;
        Path outputDirectory = Paths.get("").toAbsolutePath();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    return new CommandLine(input, format, output, outputDirectory, true);
                case "-f":
                case "--format":
                    format = ReportFormat.fromName(valueOf(args, ++i, arg));
                    break;
                case "-r":
                case "--report-type":
                    output = ReportOutput.fromName(valueOf(args, ++i, arg));
                    break;
                case "-o":
                case "--outdir":
                    outputDirectory = Paths.get(valueOf(args, ++i, arg));
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (input != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    input = Paths.get(arg);
            }
        }
        if (input == null) {
            throw new IllegalArgumentException("Missing input directory");
        }
        return new CommandLine(input, format, output, outputDirectory, false);
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Option " + option + " needs a value");
        }
        return args[index];
    }
}
