package com.rmatrix.output;

/**
 * Batch output formats.
 */
public enum OutputFormat {
    /** Labelled equation listing, one {@code <target>_<n>: <equation>} per line. */
    EQUATIONS,

    /** R-matrix as tab-separated values. */
    TSV,

    /** JSON report of every conversion stage. */
    JSON
}
