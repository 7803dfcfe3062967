package com.rmatrix.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rmatrix.rule.RuleConversion;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes conversions as a JSON array of {@link ConversionReport}s.
 */
public final class ConversionReportWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ConversionReportWriter() {
    }

    public static void write(List<RuleConversion> conversions, Writer writer) throws IOException {
        writer.write(toJson(conversions));
        writer.write("\n");
        writer.flush();
    }

    public static String toJson(List<RuleConversion> conversions) {
        List<ConversionReport> reports = conversions.stream().map(ConversionReport::from).toList();
        try {
            return objectMapper.writeValueAsString(reports);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversion report: " + e.getMessage(), e);
        }
    }
}
