package com.rmatrix.matrix;

import java.util.Map;

/**
 * One column of the R-matrix.
 *
 * @param label        Column label, e.g. {@code b0001_1}, {@code EX_lacZ}, {@code AV_ArcA}
 * @param coefficients Non-zero coefficient per variable
 */
public record MatrixColumn(String label, Map<String, Integer> coefficients) {

    public MatrixColumn {
        coefficients = Map.copyOf(coefficients);
    }

    public int coefficient(String variable) {
        return coefficients.getOrDefault(variable, 0);
    }
}
