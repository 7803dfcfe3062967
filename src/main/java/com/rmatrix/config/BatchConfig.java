package com.rmatrix.config;

import com.rmatrix.output.OutputFormat;

/**
 * Rules source and output settings.
 *
 * @param rulesPath Rules file, {@code classpath:} prefix supported
 * @param output    Output file path, {@code -} for standard output
 * @param format    Output format
 * @param failFast  Abort on the first rule that fails to convert
 */
public record BatchConfig(
        String rulesPath,
        String output,
        OutputFormat format,
        boolean failFast
) {
    public static final String STANDARD_OUTPUT = "-";

    public static BatchConfig defaults() {
        return new BatchConfig(null, STANDARD_OUTPUT, OutputFormat.EQUATIONS, true);
    }

    public boolean writesToStandardOutput() {
        return output == null || STANDARD_OUTPUT.equals(output);
    }
}
