/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.runtime.predicates;

import io.sase.cep.api.CapturedEvents;
import io.sase.cep.api.EvaluationDiagnostics;
import io.sase.cep.api.PredicateResult;
import io.sase.cep.api.ValueExpression;
import io.sase.cep.api.exceptions.EvaluationException;
import io.sase.cep.api.exceptions.EventNotFoundException;
import io.sase.cep.api.model.Scalar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Compares two value expressions with a single {@link Operator}.
 *
 * <h2>Evaluation</h2>
 * <ol>
 *   <li>Resolve the left operand, then the right one.</li>
 *   <li>An unbound alias on either side yields {@link PredicateResult#UNCERTAIN}: the
 *       candidate is kept and the predicate re-evaluated once more events arrive.</li>
 *   <li>Any other resolution failure is reported and yields {@link PredicateResult#NEGATIVE}.
 *       Such failures do not go away as the sequence grows, and an enclosing
 *       {@link NotPredicate} does not invert them.</li>
 *   <li>{@code ==} and {@code !=} use {@link Scalar#sameValue(Scalar)}; the ordering
 *       operators require two numbers, compared with {@link Scalar#compareNumber(Scalar)},
 *       and report a type mismatch otherwise.</li>
 * </ol>
 *
 * <p>Immutable; safe to evaluate concurrently against independent bindings.
 */
public final class OperatorPredicate implements OutcomePredicate {

    private final ValueExpression left;
    private final Operator operator;
    private final ValueExpression right;
    private final EvaluationDiagnostics diagnostics;

    /**
     * Builds a predicate without validating its parts. Null parts are tolerated so
     * that partially built predicates can still be rendered; evaluating one yields
     * {@link PredicateResult#NEGATIVE}. Prefer {@link #of}.
     */
    public OperatorPredicate(ValueExpression left, Operator operator, ValueExpression right,
                             EvaluationDiagnostics diagnostics) {
        this.left = left;
        this.operator = operator;
        this.right = right;
        this.diagnostics = diagnostics != null ? diagnostics : EvaluationDiagnostics.NOOP;
    }

    public static OperatorPredicate of(ValueExpression left, Operator operator, ValueExpression right,
                                       EvaluationDiagnostics diagnostics) {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        return new OperatorPredicate(left, operator, right, diagnostics);
    }

    public ValueExpression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public ValueExpression right() {
        return right;
    }

    @Override
    public PredicateResult evaluate(CapturedEvents events) {
        return outcome(events).result();
    }

    @Override
    public Outcome outcome(CapturedEvents events) {
        if (left == null || right == null) {
            diagnostics.malformed(this, "Left and right must not be null");
            return Outcome.FAULT;
        }

        Scalar leftVal;
        Scalar rightVal;
        try {
            leftVal = resolve(left, events);
            rightVal = resolve(right, events);
        } catch (EventNotFoundException e) {
            return Outcome.UNCERTAIN;
        } catch (EvaluationException e) {
            diagnostics.evaluationFailed(this, e);
            return Outcome.FAULT; // Terminate this match
        }

        if (operator == null) {
            diagnostics.malformed(this, "Unhandled operator null");
            return Outcome.FAULT;
        }

        switch (operator) {
            case EQ:
                return Outcome.of(PredicateResult.of(leftVal.sameValue(rightVal)));
            case NE:
                return Outcome.of(PredicateResult.of(!leftVal.sameValue(rightVal)));
            case GT:
            case LT:
            case GE:
            case LE:
                return compareNumeric(leftVal, rightVal);
            default:
                diagnostics.malformed(this, "Unhandled operator " + operator);
                return Outcome.FAULT;
        }
    }

    private static Scalar resolve(ValueExpression expression, CapturedEvents events) throws EvaluationException {
        Scalar value;
        try {
            value = expression.value(events);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Unexpected failure resolving " + expression.queryText(), e);
        }
        if (value == null) {
            throw new EvaluationException(expression.queryText() + " resolved to no value");
        }
        return value;
    }

    // >, <, >=, <= only work for numbers
    private Outcome compareNumeric(Scalar leftVal, Scalar rightVal) {
        if (!leftVal.isNumeric() || !rightVal.isNumeric()) {
            diagnostics.typeMismatch(this, operator.symbol(), leftVal, rightVal);
            return Outcome.FAULT; // Terminate this match
        }
        OptionalInt order;
        try {
            order = leftVal.compareNumber(rightVal);
        } catch (EvaluationException e) {
            diagnostics.evaluationFailed(this, e);
            return Outcome.FAULT;
        }
        // every ordering against NaN is false
        if (order.isEmpty()) {
            return Outcome.NEGATIVE;
        }
        int c = order.getAsInt();
        boolean holds = switch (operator) {
            case GT -> c > 0;
            case LT -> c < 0;
            case GE -> c >= 0;
            case LE -> c <= 0;
            default -> false;
        };
        return Outcome.of(PredicateResult.of(holds));
    }

    @Override
    public String queryText() {
        StringBuilder sb = new StringBuilder();
        if (left != null) {
            sb.append(left.queryText());
        }
        sb.append(' ');
        if (operator != null) {
            sb.append(operator.symbol());
        }
        if (right != null) {
            sb.append(' ').append(right.queryText());
        }
        return sb.toString();
    }

    @Override
    public List<String> usedAliases() {
        List<String> result = new ArrayList<>();
        if (left != null) {
            result.addAll(left.usedAliases());
        }
        if (right != null) {
            result.addAll(right.usedAliases());
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "OperatorPredicate[" + queryText() + "]";
    }
}
