package com.rmatrix.dnf;

import java.util.List;
import java.util.TreeSet;

/**
 * How duplicate clauses are detected when an AND is distributed over an OR.
 */
public enum ClauseDeduplication {

    /**
     * Clauses are duplicates when their text is identical.
     * {@code a AND b} and {@code b AND a} are both kept.
     */
    TEXTUAL {
        @Override
        public Object key(List<String> clause) {
            return String.join(DnfExpression.AND_SEPARATOR, clause);
        }
    },

    /**
     * Clauses are duplicates when they hold the same set of literals,
     * regardless of order or repetition.
     */
    CANONICAL {
        @Override
        public Object key(List<String> clause) {
            return new TreeSet<>(clause);
        }
    };

    /**
     * Identity of a clause under this mode.
     */
    public abstract Object key(List<String> clause);
}
