package com.sidr.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsvReport")
class CsvReportTest {

    private final StringWriter out = new StringWriter();

    @Test
    @DisplayName("should write the declared header with the first record")
    void shouldWriteHeader() throws IOException {
        var report = new CsvReport(LineTarget.owned(out), null);
        report.declareField("WorkId");
        report.declareField("FullPath");
        report.declareField("Size");

        assertThat(out.toString()).isEmpty();

        report.beginRecord();
        report.setInteger("WorkId", 7);
        report.setString("FullPath", "C:\\say \"hi\", twice.txt");
        report.endRecord();
        report.close();

        assertThat(out.toString()).isEqualTo("WorkId,FullPath,Size\n"
                + "7,\"C:\\say \"\"hi\"\", twice.txt\",\n");
    }

    @Test
    @DisplayName("should take the header from the first record when nothing is declared")
    void shouldUseFirstRecordFields() throws IOException {
        var report = new CsvReport(LineTarget.owned(out), null);

        report.beginRecord();
        report.setString("A", "1");
        report.setString("B", "2");
        report.endRecord();
        report.beginRecord();
        report.setString("B", "3");
        report.setString("C", "late");
        report.endRecord();

        assertThat(out.toString()).isEqualTo("A,B\n\"1\",\"2\"\n,\"3\"\n");
        assertThat(report.getRecordCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should prefix shared output with the report name")
    void shouldTagSharedOutput() throws IOException {
        var report = new CsvReport(LineTarget.shared(out, this), "internet_history");
        report.declareField("URL");
        report.declareField("Title");

        report.beginRecord();
        report.setString("URL", "https://example.org/");
        report.endRecord();

        assertThat(out.toString()).isEqualTo("Report Suffix,URL,Title\n\"internet_history\",\"https://example.org/\",\n");
    }

    @Test
    @DisplayName("should not write a header for a report without records")
    void shouldStayEmpty() throws IOException {
        var report = new CsvReport(LineTarget.owned(out), null);
        report.declareField("A");
        report.close();

        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("should double embedded quotes")
    void shouldQuote() {
        assertThat(CsvReport.quote("a\"b")).isEqualTo("\"a\"\"b\"");
    }
}
