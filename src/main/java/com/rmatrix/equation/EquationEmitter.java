package com.rmatrix.equation;

import com.rmatrix.dnf.DnfExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders DNF clauses as R-matrix equations, one equation per clause in
 * clause order. Duplicate clauses yield duplicate equations.
 */
public final class EquationEmitter {

    private EquationEmitter() {
    }

    /**
     * Emit the equations of a DNF expression.
     *
     * @param target Target variable name, already sanitized
     * @param dnf    Fully evaluated rule
     * @return Equations in clause order
     */
    public static List<Equation> emit(String target, DnfExpression dnf) {
        List<Equation> equations = new ArrayList<>(dnf.clauseCount());
        for (List<String> clause : dnf.clauses()) {
            equations.add(new Equation(target, clause));
        }
        return equations;
    }

    /**
     * Emit the equations of DNF text such as {@code a AND b OR c}.
     */
    public static List<Equation> emit(String target, String dnf) {
        return emit(target, DnfExpression.parse(dnf));
    }

    /**
     * Emit equations in their text form.
     */
    public static List<String> format(String target, DnfExpression dnf) {
        return emit(target, dnf).stream().map(Equation::format).toList();
    }
}
