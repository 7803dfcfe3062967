package com.rmatrix.output;

import com.rmatrix.batch.BatchResult;
import com.rmatrix.config.BatchConfig;
import com.rmatrix.exception.RuleBatchException;
import com.rmatrix.matrix.RMatrixBuilder;
import com.rmatrix.matrix.TsvMatrixWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a batch result in the configured format to standard output or a file.
 */
public class BatchOutputWriter {

    private static final Logger log = LoggerFactory.getLogger(BatchOutputWriter.class);

    private final BatchConfig config;
    private final RMatrixBuilder matrixBuilder;

    public BatchOutputWriter(BatchConfig config, RMatrixBuilder matrixBuilder) {
        this.config = config;
        this.matrixBuilder = matrixBuilder;
    }

    /**
     * Write to the configured destination.
     */
    public void write(BatchResult result) {
        if (config.writesToStandardOutput()) {
            Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
            write(result, stdout);
            return;
        }

        Path path = Path.of(config.output());
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, writer);
        } catch (IOException e) {
            throw new RuleBatchException("Failed to write output to: " + path, e);
        }
        log.info("Wrote {} output for {} rules to {}", config.format(), result.conversions().size(), path);
    }

    /**
     * Write to the given writer. The writer is flushed, not closed.
     */
    public void write(BatchResult result, Writer writer) {
        try {
            switch (config.format()) {
                case EQUATIONS -> EquationListWriter.write(result.conversions(), writer);
                case TSV -> TsvMatrixWriter.write(matrixBuilder.build(result.conversions()), writer);
                case JSON -> ConversionReportWriter.write(result.conversions(), writer);
            }
        } catch (IOException e) {
            throw new RuleBatchException("Failed to write " + config.format() + " output", e);
        }
    }
}
