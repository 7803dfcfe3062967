package com.rmatrix.output;

import com.rmatrix.rule.RuleConversion;

import java.util.List;

/**
 * JSON view of one conversion.
 */
public record ConversionReport(
        String target,
        String rule,
        String reformatted,
        String prefix,
        String dnf,
        List<String> equations
) {
    public static ConversionReport from(RuleConversion conversion) {
        return new ConversionReport(
                conversion.target(),
                conversion.rule(),
                conversion.reformatted(),
                conversion.prefix(),
                conversion.dnf().toString(),
                conversion.formattedEquations());
    }
}
