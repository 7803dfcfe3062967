package com.rmatrix.matrix;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes an R-matrix as tab-separated values.
 * <pre>
 * variable  b0001_1  EX_lacZ
 * NOT_ArcA  -1       0
 * b0001     1        0
 * </pre>
 */
public final class TsvMatrixWriter {

    private static final char TAB = '\t';
    private static final String HEADER = "variable";
    private static final String NEWLINE = "\n";

    private TsvMatrixWriter() {
    }

    public static void write(RMatrix matrix, Writer writer) throws IOException {
        writer.write(HEADER + TAB + String.join(String.valueOf(TAB), matrix.labels()));
        writer.write(NEWLINE);

        for (String variable : matrix.variables()) {
            StringBuilder row = new StringBuilder(variable);
            for (MatrixColumn column : matrix.columns()) {
                row.append(TAB).append(column.coefficient(variable));
            }
            writer.write(row.toString());
            writer.write(NEWLINE);
        }
        writer.flush();
    }
}
