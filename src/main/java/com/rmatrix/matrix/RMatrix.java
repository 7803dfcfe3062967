package com.rmatrix.matrix;

import java.util.List;

/**
 * Variable-by-column coefficient matrix built from R-matrix equations.
 *
 * @param variables Row variables, sorted
 * @param columns   Columns in emission order
 */
public record RMatrix(List<String> variables, List<MatrixColumn> columns) {

    public RMatrix {
        variables = List.copyOf(variables);
        columns = List.copyOf(columns);
    }

    public List<String> labels() {
        return columns.stream().map(MatrixColumn::label).toList();
    }

    public MatrixColumn column(String label) {
        return columns.stream()
                .filter(c -> c.label().equals(label))
                .findFirst()
                .orElse(null);
    }
}
