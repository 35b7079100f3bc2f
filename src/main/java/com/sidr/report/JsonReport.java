package com.sidr.report;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * One JSON object per line. On shared output every object starts with a
 * {@code "report_suffix"} member naming its report.
 */
public final class JsonReport extends AbstractReport {
    static final String SUFFIX_FIELD = "report_suffix";

    private static final JsonFactory FACTORY = new JsonFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    JsonReport(LineTarget target, String streamTag) {
        super(target, streamTag);
    }

    @Override
    public void declareField(String name) {
        // objects name their own fields
    }

    @Override
    protected void writeRecord(Map<String, Object> fields) throws IOException {
        var line = new StringWriter();
        try (var generator = FACTORY.createGenerator(line)) {
            generator.writeStartObject();
            if (streamTag != null) {
                generator.writeStringField(SUFFIX_FIELD, streamTag);
            }
            for (var field : fields.entrySet()) {
                if (field.getValue() instanceof Long) {
                    generator.writeNumberField(field.getKey(), (Long) field.getValue());
                } else {
                    generator.writeStringField(field.getKey(), String.valueOf(field.getValue()));
                }
            }
            generator.writeEndObject();
        }
        target.writeLine(line.toString());
    }
}
