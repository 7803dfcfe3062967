package com.rmatrix.equation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One R-matrix equation: the literals of a DNF clause, each with a -1
 * coefficient, implying the target with a +1 coefficient.
 * <pre>
 * -1 NOT_ArcA -1 NOT_Fnr +1 b0001
 * </pre>
 *
 * @param target   Target variable (gene or regulator)
 * @param literals Clause literals in clause order, possibly NOT_ prefixed
 */
public record Equation(String target, List<String> literals) {

    public static final int LITERAL_COEFFICIENT = -1;
    public static final int TARGET_COEFFICIENT = 1;

    public Equation {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Equation target cannot be null or blank");
        }
        literals = List.copyOf(literals);
    }

    /**
     * Coefficient per variable, summed when a variable occurs more than once.
     * Variables appear in equation order, the target last.
     */
    public Map<String, Integer> coefficients() {
        Map<String, Integer> coefficients = new LinkedHashMap<>();
        for (String literal : literals) {
            coefficients.merge(literal, LITERAL_COEFFICIENT, Integer::sum);
        }
        coefficients.merge(target, TARGET_COEFFICIENT, Integer::sum);
        return coefficients;
    }

    /**
     * Text form: {@code -1 lit1 -1 lit2 ... +1 target}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (String literal : literals) {
            sb.append(LITERAL_COEFFICIENT).append(' ').append(literal).append(' ');
        }
        return sb.append('+').append(TARGET_COEFFICIENT).append(' ').append(target).toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
