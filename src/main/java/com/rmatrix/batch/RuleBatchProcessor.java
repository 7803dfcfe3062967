package com.rmatrix.batch;

import com.rmatrix.config.ResourceResolver;
import com.rmatrix.exception.RmatrixException;
import com.rmatrix.exception.RuleBatchException;
import com.rmatrix.rule.RuleConversion;
import com.rmatrix.rule.RuleConverter;
import com.rmatrix.rule.RuleLine;
import com.rmatrix.rule.RuleLineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts every rule of a rules source.
 * <p>
 * One rule per line; blank lines and lines starting with {@code #} are
 * skipped. In fail-fast mode the first failing line aborts the batch,
 * otherwise failing lines are logged and collected.
 */
public class RuleBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(RuleBatchProcessor.class);

    private static final String COMMENT_PREFIX = "#";

    private final RuleConverter converter;
    private final RuleLineParser lineParser;
    private final boolean failFast;

    public RuleBatchProcessor(RuleConverter converter, boolean failFast) {
        this.converter = converter;
        this.lineParser = new RuleLineParser();
        this.failFast = failFast;
    }

    /**
     * Convert a single rule line such as {@code b0001 (NOT(ArcA OR Fnr))}.
     */
    public RuleConversion convertLine(String line) {
        RuleLine ruleLine = lineParser.parse(line);
        log.debug("Pulled target: {}, rule: {}", ruleLine.target(), ruleLine.rule());
        return converter.convert(ruleLine.target(), ruleLine.rule());
    }

    /**
     * Convert every rule of a rules file.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Rules file path
     * @return Conversions and collected failures
     */
    public BatchResult process(String path) {
        log.info("Processing rules from: {}", path);

        Resource resource = ResourceResolver.resolve(path);
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return process(reader, path);
        } catch (IOException e) {
            throw new RuleBatchException("Failed to read rules from: " + path, e);
        }
    }

    /**
     * Convert every rule read from a reader.
     *
     * @param reader     Rules source, not closed
     * @param sourceName Name used in messages
     */
    public BatchResult process(Reader reader, String sourceName) throws IOException {
        List<RuleConversion> conversions = new ArrayList<>();
        List<RuleFailure> failures = new ArrayList<>();

        BufferedReader lines = new BufferedReader(reader);
        String raw;
        int lineNumber = 0;
        while ((raw = lines.readLine()) != null) {
            lineNumber++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }

            try {
                conversions.add(convertLine(line));
            } catch (RmatrixException e) {
                if (failFast) {
                    throw new RuleBatchException("Rule at " + sourceName + ":" + lineNumber
                            + " failed: " + e.getMessage(), e);
                }
                log.warn("Skipping rule at {}:{}: {}", sourceName, lineNumber, e.getMessage());
                failures.add(new RuleFailure(lineNumber, line, e.getMessage()));
            }
        }

        BatchResult result = new BatchResult(conversions, failures);
        log.info("Converted {} rules into {} equations from {} ({} failed)",
                conversions.size(), result.equationCount(), sourceName, failures.size());
        return result;
    }

    public boolean isFailFast() {
        return failFast;
    }
}
