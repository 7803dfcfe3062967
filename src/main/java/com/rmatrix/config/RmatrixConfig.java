package com.rmatrix.config;

/**
 * Root configuration.
 *
 * @param name    Model name identifier
 * @param version Configuration version
 * @param dnf     DNF evaluation settings
 * @param batch   Rules source and output settings
 * @param matrix  R-matrix assembly settings
 */
public record RmatrixConfig(
        String name,
        String version,
        DnfConfig dnf,
        BatchConfig batch,
        MatrixConfig matrix
) {
    /**
     * Create a default configuration.
     */
    public static RmatrixConfig defaults() {
        return new RmatrixConfig("default-model", "1.0",
                DnfConfig.defaults(), BatchConfig.defaults(), MatrixConfig.defaults());
    }
}
