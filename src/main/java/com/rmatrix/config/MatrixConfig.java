package com.rmatrix.config;

/**
 * R-matrix assembly settings.
 *
 * @param normalizeProteinRows Ensure both pr_X and NOT_pr_X rows exist for every protein base
 * @param exchangeColumns      Add EX_ columns for genes and AV_ columns for proteins
 */
public record MatrixConfig(boolean normalizeProteinRows, boolean exchangeColumns) {

    public static MatrixConfig defaults() {
        return new MatrixConfig(true, true);
    }
}
