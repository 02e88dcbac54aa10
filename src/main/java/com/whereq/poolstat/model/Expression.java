package com.whereq.poolstat.model;

import lombok.Value;

/**
 * An attribute whose value is an expression rather than a literal.
 * The value is what the pool evaluated the expression to, or null when it evaluated to undefined.
 */
@Value
public class Expression {

    /**
     * Expression source text, e.g. {@code "ifThenElse(RequestCpus > 1, RequestCpus, 1)"}
     */
    String text;

    /**
     * Evaluated value (Long, Double, String or Boolean), null if undefined
     */
    Object value;

    public static Expression unevaluated(String text) {
        return new Expression(text, null);
    }

    public boolean isDefined() {
        return value != null;
    }
}
