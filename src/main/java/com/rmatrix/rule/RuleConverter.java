package com.rmatrix.rule;

import com.rmatrix.dnf.ClauseDeduplication;
import com.rmatrix.dnf.DnfEvaluator;
import com.rmatrix.dnf.DnfExpression;
import com.rmatrix.equation.Equation;
import com.rmatrix.equation.EquationEmitter;
import com.rmatrix.rule.expression.PrefixConverter;
import com.rmatrix.rule.expression.RuleTokenizer;
import com.rmatrix.rule.expression.RuleValidator;
import com.rmatrix.rule.expression.Token;
import com.rmatrix.rule.tree.ExpressionNode;
import com.rmatrix.rule.tree.ExpressionTreeBuilder;
import com.rmatrix.rule.tree.TreeTraversals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Facade converting boolean rules into DNF and R-matrix equations.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>validate (reserved words, parenthesis counts)</li>
 *   <li>reformat into a space-delimited token stream</li>
 *   <li>convert infix to prefix</li>
 *   <li>build the expression tree</li>
 *   <li>evaluate the tree to DNF</li>
 *   <li>emit one equation per DNF clause</li>
 * </ol>
 * Example:
 * <pre>
 * b0001 + (NOT(ArcA OR Fnr))  ->  -1 NOT_ArcA -1 NOT_Fnr +1 b0001
 * </pre>
 * A converter keeps no per-rule state; one instance can serve many threads.
 */
public class RuleConverter {

    private static final Logger log = LoggerFactory.getLogger(RuleConverter.class);

    private final DnfEvaluator evaluator;

    public RuleConverter() {
        this(ClauseDeduplication.TEXTUAL);
    }

    public RuleConverter(ClauseDeduplication deduplication) {
        this.evaluator = new DnfEvaluator(deduplication);
    }

    /**
     * Validate and reformat a rule into its space-delimited token form.
     */
    public String reformat(String rule) {
        RuleValidator.validate(rule);
        String reformatted = new RuleTokenizer(rule).reformat();
        RuleValidator.checkParentheses(reformatted);
        return reformatted;
    }

    /**
     * Convert a rule into prefix notation.
     *
     * @param rule Raw rule text, target prefix already stripped
     * @return Space-delimited prefix expression
     */
    public String normalize(String rule) {
        return join(toPrefix(rule, reformat(rule)));
    }

    /**
     * Convert a rule into DNF.
     */
    public DnfExpression toDnf(String rule) {
        String reformatted = reformat(rule);
        return evaluate(toPrefix(rule, reformatted));
    }

    /**
     * Convert a rule into R-matrix equations.
     *
     * @param target Target variable name, already sanitized
     * @param rule   Raw rule text, target prefix already stripped
     * @return Equations as {@code -1 lit ... +1 target}, one per DNF clause
     */
    public List<String> toEquations(String target, String rule) {
        return convert(target, rule).formattedEquations();
    }

    /**
     * Run the full pipeline, keeping every intermediate form.
     */
    public RuleConversion convert(String target, String rule) {
        log.debug("Converting rule for {}: {}", target, rule);

        String reformatted = reformat(rule);
        log.debug("Reformatted: {}", reformatted);

        List<Token> prefix = toPrefix(rule, reformatted);
        DnfExpression dnf = evaluate(prefix);
        List<Equation> equations = EquationEmitter.emit(target, dnf);

        log.debug("{} -> {} equation(s)", target, equations.size());
        return new RuleConversion(target, rule, reformatted, join(prefix), dnf, equations);
    }

    public ClauseDeduplication getDeduplication() {
        return evaluator.getDeduplication();
    }

    private List<Token> toPrefix(String rule, String reformatted) {
        List<Token> tokens = new RuleTokenizer(reformatted).tokenize();
        List<Token> prefix = new PrefixConverter(rule, tokens).convert();
        log.debug("Prefix: {}", join(prefix));
        return prefix;
    }

    private DnfExpression evaluate(List<Token> prefix) {
        ExpressionNode root = new ExpressionTreeBuilder(prefix).build();
        if (log.isDebugEnabled()) {
            log.debug("In order: {}", TreeTraversals.inOrder(root));
            log.debug("Pre order: {}", TreeTraversals.preOrder(root));
            log.debug("Post order: {}", TreeTraversals.postOrder(root));
        }

        DnfExpression dnf = evaluator.evaluate(root);
        log.debug("DNF: {}", dnf);
        return dnf;
    }

    private static String join(List<Token> tokens) {
        return tokens.stream().map(Token::text).collect(Collectors.joining(" "));
    }
}
