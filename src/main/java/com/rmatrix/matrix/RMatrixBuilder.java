package com.rmatrix.matrix;

import com.rmatrix.config.MatrixConfig;
import com.rmatrix.equation.Equation;
import com.rmatrix.rule.RuleConversion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Assembles converted rules into an R-matrix.
 * <p>
 * Every equation becomes a column labelled {@code <target>_<n>}. Optionally:
 * <ul>
 *   <li>protein rows are normalized: for every protein base {@code B} seen as
 *       {@code pr_B}, {@code NOT_pr_B} or {@code NOT_B}, both {@code pr_B}
 *       and {@code NOT_pr_B} rows exist;</li>
 *   <li>exchange columns are added: {@code EX_g} with -1 on {@code g_AC} for
 *       every gene, and {@code AV_B} with 1 on each of {@code pr_B},
 *       {@code NOT_pr_B} and {@code NOT_B} present.</li>
 * </ul>
 */
public class RMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(RMatrixBuilder.class);

    static final String GENE_SUFFIX = "_AC";
    static final String PROTEIN_PREFIX = "pr_";
    static final String NEGATED_PROTEIN_PREFIX = "NOT_pr_";
    static final String NEGATED_PREFIX = "NOT_";
    static final String EXCHANGE_PREFIX = "EX_";
    static final String AVAILABILITY_PREFIX = "AV_";

    private final MatrixConfig config;

    public RMatrixBuilder(MatrixConfig config) {
        this.config = config;
    }

    /**
     * Build the matrix.
     *
     * @param conversions Converted rules in source order
     * @return Assembled matrix
     */
    public RMatrix build(List<RuleConversion> conversions) {
        Set<String> variables = new LinkedHashSet<>();
        List<MatrixColumn> columns = new ArrayList<>();

        for (RuleConversion conversion : conversions) {
            List<Equation> equations = conversion.equations();
            for (int i = 0; i < equations.size(); i++) {
                Map<String, Integer> coefficients = equations.get(i).coefficients();
                variables.addAll(coefficients.keySet());
                columns.add(new MatrixColumn(conversion.label(i), coefficients));
            }
        }

        if (config.normalizeProteinRows()) {
            for (String base : proteinBases(variables)) {
                variables.add(PROTEIN_PREFIX + base);
                variables.add(NEGATED_PROTEIN_PREFIX + base);
            }
        }

        if (config.exchangeColumns()) {
            columns.addAll(exchangeColumns(variables));
        }

        log.info("Built R-matrix with {} variables and {} columns from {} rules",
                variables.size(), columns.size(), conversions.size());
        return new RMatrix(new ArrayList<>(new TreeSet<>(variables)), columns);
    }

    private List<MatrixColumn> exchangeColumns(Set<String> variables) {
        Set<String> geneBases = new TreeSet<>();
        for (String variable : variables) {
            if (variable.endsWith(GENE_SUFFIX)) {
                geneBases.add(variable.substring(0, variable.length() - GENE_SUFFIX.length()));
            }
        }

        List<MatrixColumn> columns = new ArrayList<>();
        for (String gene : geneBases) {
            columns.add(new MatrixColumn(EXCHANGE_PREFIX + gene, Map.of(gene + GENE_SUFFIX, -1)));
        }

        for (String base : proteinBases(variables)) {
            Map<String, Integer> availability = new LinkedHashMap<>();
            for (String candidate : List.of(PROTEIN_PREFIX + base, NEGATED_PROTEIN_PREFIX + base,
                    NEGATED_PREFIX + base)) {
                if (variables.contains(candidate)) {
                    availability.put(candidate, 1);
                }
            }
            if (!availability.isEmpty()) {
                columns.add(new MatrixColumn(AVAILABILITY_PREFIX + base, availability));
            }
        }
        return columns;
    }

    private static Set<String> proteinBases(Set<String> variables) {
        Set<String> bases = new TreeSet<>();
        for (String variable : variables) {
            String base = proteinBase(variable);
            if (base != null) {
                bases.add(base);
            }
        }
        return bases;
    }

    /**
     * Protein base of a variable, or null for genes ({@code *_AC}) and plain operands.
     */
    static String proteinBase(String variable) {
        if (variable.endsWith(GENE_SUFFIX)) {
            return null;
        }
        if (variable.startsWith(NEGATED_PROTEIN_PREFIX)) {
            return variable.substring(NEGATED_PROTEIN_PREFIX.length());
        }
        if (variable.startsWith(PROTEIN_PREFIX)) {
            return variable.substring(PROTEIN_PREFIX.length());
        }
        if (variable.startsWith(NEGATED_PREFIX)) {
            return variable.substring(NEGATED_PREFIX.length());
        }
        return null;
    }
}
