package com.excelgrid.app.formula;

import com.excelgrid.app.exceptions.FormulaSyntaxException;
import com.excelgrid.app.models.CellRange;

import java.util.List;
import java.util.Optional;

/**
 * Parses and evaluates one formula ("=..." text) to a number:
 * SUM(range) when the whole body is a SUM call, otherwise
 * tokenize -> shunting-yard -> postfix evaluation.
 */
public class FormulaEvaluator {

    private final Tokenizer tokenizer;
    private final ShuntingYardConverter converter;
    private final PostfixEvaluator postfixEvaluator;
    private final SumFunction sumFunction;

    public FormulaEvaluator() {
        this(new Tokenizer(), new ShuntingYardConverter(), new PostfixEvaluator(), new SumFunction());
    }

    public FormulaEvaluator(Tokenizer tokenizer, ShuntingYardConverter converter,
                            PostfixEvaluator postfixEvaluator, SumFunction sumFunction) {
        this.tokenizer = tokenizer;
        this.converter = converter;
        this.postfixEvaluator = postfixEvaluator;
        this.sumFunction = sumFunction;
    }

    public static boolean isFormula(String raw) {
        return raw != null && raw.startsWith("=");
    }

    /**
     * Evaluates 'formula' against a rows x cols grid; SUM ranges are
     * clipped to those bounds.
     *
     * @throws com.excelgrid.app.exceptions.FormulaException on any syntax or evaluation failure
     */
    public double evaluate(String formula, CellResolver resolver, int rows, int cols) {
        if (!isFormula(formula)) {
            throw new FormulaSyntaxException("Formula must start with =");
        }
        String body = formula.substring(1);

        Optional<CellRange> range = sumFunction.matchRange(body);
        if (range.isPresent()) {
            return sumFunction.sum(range.get(), resolver, rows, cols);
        }

        List<Token> postfix = converter.toPostfix(tokenizer.tokens(body));
        return postfixEvaluator.evaluate(postfix, resolver);
    }
}
