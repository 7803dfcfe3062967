package com.rmatrix.rule;

import com.rmatrix.dnf.DnfExpression;
import com.rmatrix.equation.Equation;

import java.util.List;

/**
 * Every stage of one rule's conversion.
 *
 * @param target      Target variable
 * @param rule        Rule text as given
 * @param reformatted Single-space-delimited token form
 * @param prefix      Prefix notation
 * @param dnf         Fully evaluated rule
 * @param equations   One equation per DNF clause
 */
public record RuleConversion(
        String target,
        String rule,
        String reformatted,
        String prefix,
        DnfExpression dnf,
        List<Equation> equations
) {
    public RuleConversion {
        equations = List.copyOf(equations);
    }

    /**
     * Equation labels: {@code <target>_1}, {@code <target>_2}, ...
     */
    public String label(int index) {
        return target + "_" + (index + 1);
    }

    /**
     * Equations in their text form.
     */
    public List<String> formattedEquations() {
        return equations.stream().map(Equation::format).toList();
    }
}
