package com.sidr.report;

import lombok.Getter;

import java.util.Locale;

@Getter
public enum ReportFormat {
    JSON("json"),
    CSV("csv");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static ReportFormat fromName(String name) {
        for (var format : values()) {
            if (format.extension.equals(name.toLowerCase(Locale.ROOT))) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + name);
    }
}
