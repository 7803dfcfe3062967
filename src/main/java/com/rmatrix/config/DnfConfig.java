package com.rmatrix.config;

import com.rmatrix.dnf.ClauseDeduplication;

/**
 * DNF evaluation settings.
 *
 * @param clauseDeduplication How duplicate clauses are detected during distribution
 */
public record DnfConfig(ClauseDeduplication clauseDeduplication) {

    public static DnfConfig defaults() {
        return new DnfConfig(ClauseDeduplication.TEXTUAL);
    }
}
