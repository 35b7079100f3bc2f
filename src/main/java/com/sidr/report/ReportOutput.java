package com.sidr.report;

import lombok.Getter;

import java.util.Locale;

/**
 * Where reports go: one file per report, or all reports interleaved on standard output.
 */
@Getter
public enum ReportOutput {
    TO_FILE("to-file"),
    TO_STDOUT("to-stdout");

    private final String optionName;

    ReportOutput(String optionName) {
        this.optionName = optionName;
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static ReportOutput fromName(String name) {
        for (var output : values()) {
            if (output.optionName.equals(name.toLowerCase(Locale.ROOT))) {
                return output;
            }
        }
        throw new IllegalArgumentException("Unknown report type: " + name);
    }
}
