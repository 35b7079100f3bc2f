package com.sidr.mapping;

import lombok.Getter;

/**
 * The three artifact reports.
 */
@Getter
public enum ReportKind {
    FILE("File_Report", "file_report"),
    ACTIVITY_HISTORY("Activity_History_Report", "activity_history"),
    INTERNET_HISTORY("Internet_History_Report", "internet_history");

    /** Part of the report file name. */
    private final String fileSuffix;
    /** Tag written in front of each record when several reports share standard output. */
    private final String streamTag;

    ReportKind(String fileSuffix, String streamTag) {
        this.fileSuffix = fileSuffix;
        this.streamTag = streamTag;
    }
}
