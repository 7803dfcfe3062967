package com.rmatrix.output;

import com.rmatrix.rule.RuleConversion;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes equations as labelled lines:
 * <pre>
 * b0001_1: -1 NOT_ArcA -1 NOT_Fnr +1 b0001
 * </pre>
 */
public final class EquationListWriter {

    private EquationListWriter() {
    }

    public static void write(List<RuleConversion> conversions, Writer writer) throws IOException {
        for (RuleConversion conversion : conversions) {
            List<String> equations = conversion.formattedEquations();
            for (int i = 0; i < equations.size(); i++) {
                writer.write(conversion.label(i) + ": " + equations.get(i) + "\n");
            }
        }
        writer.flush();
    }
}
