package org.hybridnet.model.expr;

/**
 * Raised while evaluating a rate or guard expression: unknown names, bad
 * arity, non finite results.
 */
public class ExpressionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExpressionException(String message) {
        super(message);
    }
}
