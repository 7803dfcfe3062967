package com.rmatrix.batch;

import com.rmatrix.exception.RuleBatchException;
import com.rmatrix.rule.RuleConversion;
import com.rmatrix.rule.RuleConverter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleBatchProcessor.
 */
class RuleBatchProcessorTest {

    private final RuleConverter converter = new RuleConverter();

    @Test
    @DisplayName("Should convert every rule and skip comments and blank lines")
    void shouldProcessRulesFile() {
        BatchResult result = new RuleBatchProcessor(converter, true).process("classpath:rules/test-rules.txt");

        assertEquals(3, result.conversions().size());
        assertEquals(5, result.equationCount());
        assertFalse(result.hasFailures());

        List<String> targets = result.conversions().stream().map(RuleConversion::target).toList();
        assertEquals(List.of("b0001", "b0002", "heat_shock"), targets);
        assertEquals("RpoH OR DnaK AND NOT_GrpE", result.conversions().get(2).dnf().toString());
    }

    @Test
    @DisplayName("Should collect failing rules when not failing fast")
    void shouldCollectFailures() {
        RuleBatchProcessor processor = new RuleBatchProcessor(converter, false);
        BatchResult result = processor.process("classpath:rules/mixed-rules.txt");

        assertFalse(processor.isFailFast());
        assertEquals(1, result.conversions().size());
        assertEquals("b0002", result.conversions().get(0).target());

        assertTrue(result.hasFailures());
        List<Integer> lines = result.failures().stream().map(RuleFailure::lineNumber).toList();
        assertEquals(List.of(1, 3, 4), lines);
        assertEquals("lowercase (D)", result.failures().get(1).line());
    }

    @Test
    @DisplayName("Should abort on the first failing rule when failing fast")
    void shouldFailFast() {
        RuleBatchProcessor processor = new RuleBatchProcessor(converter, true);

        RuleBatchException e = assertThrows(RuleBatchException.class,
                () -> processor.process("classpath:rules/mixed-rules.txt"));
        assertTrue(e.getMessage().contains("classpath:rules/mixed-rules.txt:1"));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("Should wrap a missing rules file")
    void shouldFailOnMissingFile() {
        RuleBatchProcessor processor = new RuleBatchProcessor(converter, false);

        assertThrows(RuleBatchException.class, () -> processor.process("classpath:rules/missing.txt"));
    }

    @Test
    @DisplayName("Should convert a single rule line")
    void shouldConvertLine() {
        RuleConversion conversion = new RuleBatchProcessor(converter, true).convertLine("b0001 (NOT(ArcA OR Fnr))");

        assertEquals(List.of("-1 NOT_ArcA -1 NOT_Fnr +1 b0001"), conversion.formattedEquations());
    }
}
