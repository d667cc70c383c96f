/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.api.model;

import io.sase.cep.api.exceptions.TypeMismatchException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runtime value produced by a value expression.
 *
 * <p>A closed tagged union: every scalar is a {@link Kind#NUMBER}, a
 * {@link Kind#STRING}, a {@link Kind#BOOLEAN} or {@link Kind#NULL}. Integral
 * numbers ({@code long}, {@code int}, {@code BigInteger}, ...) keep their exact
 * value next to the double approximation, so large identifiers compare exactly.
 * Equality in predicates works over any kind via {@link #sameValue(Scalar)};
 * ordering only over numbers via {@link #compareNumber(Scalar)}.
 */
public final class Scalar {

    public enum Kind {
        NUMBER, STRING, BOOLEAN, NULL
    }

    public static final Scalar NULL = new Scalar(Kind.NULL, 0.0, null, null);
    public static final Scalar TRUE = new Scalar(Kind.BOOLEAN, 0.0, null, Boolean.TRUE);
    public static final Scalar FALSE = new Scalar(Kind.BOOLEAN, 0.0, null, Boolean.FALSE);

    private final Kind kind;
    private final double number;
    // exact value of integral numbers, null for floating-point ones
    private final BigInteger integer;
    private final Object ref;

    private Scalar(Kind kind, double number, BigInteger integer, Object ref) {
        this.kind = kind;
        this.number = number;
        this.integer = integer;
        this.ref = ref;
    }

    public static Scalar number(double value) {
        return new Scalar(Kind.NUMBER, value, null, null);
    }

    public static Scalar integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public static Scalar integer(BigInteger value) {
        Objects.requireNonNull(value, "Integer scalar cannot be null, use Scalar.NULL");
        return new Scalar(Kind.NUMBER, value.doubleValue(), value, null);
    }

    public static Scalar string(String value) {
        Objects.requireNonNull(value, "String scalar cannot be null, use Scalar.NULL");
        return new Scalar(Kind.STRING, 0.0, null, value);
    }

    public static Scalar bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Coerces a raw attribute value into a scalar.
     *
     * @throws TypeMismatchException if the value's Java type has no scalar kind
     */
    public static Scalar of(Object value) throws TypeMismatchException {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Scalar scalar) {
            return scalar;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof AtomicLong || value instanceof AtomicInteger) {
            return integer(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return integer(big);
        }
        if (value instanceof Number n) {
            return number(n.doubleValue());
        }
        if (value instanceof CharSequence cs) {
            return string(cs.toString());
        }
        if (value instanceof Boolean b) {
            return bool(b);
        }
        throw new TypeMismatchException("Unsupported value type: " + value.getClass().getName());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNumeric() {
        return kind == Kind.NUMBER;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * @return whether this is a number held exactly as an integer
     */
    public boolean isIntegral() {
        return integer != null;
    }

    /**
     * Double approximation of a number. Integers beyond 2^53 lose precision.
     *
     * @throws TypeMismatchException if this scalar is not a number
     */
    public double asDouble() throws TypeMismatchException {
        requireNumber();
        return number;
    }

    /**
     * Numeric ordering without precision loss between integers of any size.
     *
     * @return the sign of {@code this - other}, or empty when either side is NaN
     * @throws TypeMismatchException if either scalar is not a number
     */
    public OptionalInt compareNumber(Scalar other) throws TypeMismatchException {
        requireNumber();
        other.requireNumber();
        return compareNumbers(this, other);
    }

    /**
     * Structural equality as used by {@code ==} and {@code !=} predicates.
     *
     * <p>Numbers compare by mathematical value: {@code 5} equals {@code 5.0}, NaN
     * equals nothing and {@code 0.0} equals {@code -0.0}. Values of different kinds
     * are never equal.
     */
    public boolean sameValue(Scalar other) {
        if (other == null || kind != other.kind) {
            return false;
        }
        return switch (kind) {
            case NUMBER -> compareNumbers(this, other).orElse(1) == 0;
            case STRING, BOOLEAN -> ref.equals(other.ref);
            case NULL -> true;
        };
    }

    private void requireNumber() throws TypeMismatchException {
        if (kind != Kind.NUMBER) {
            throw new TypeMismatchException("Expected NUMBER but was " + kind + " (" + queryText() + ")");
        }
    }

    private static OptionalInt compareNumbers(Scalar left, Scalar right) {
        if (Double.isNaN(left.number) || Double.isNaN(right.number)) {
            return OptionalInt.empty();
        }
        if (left.integer != null && right.integer != null) {
            return OptionalInt.of(Integer.signum(left.integer.compareTo(right.integer)));
        }
        boolean leftInfinite = left.integer == null && Double.isInfinite(left.number);
        boolean rightInfinite = right.integer == null && Double.isInfinite(right.number);
        if (leftInfinite && rightInfinite) {
            return OptionalInt.of(Double.compare(left.number, right.number));
        }
        if (leftInfinite) {
            return OptionalInt.of(left.number > 0 ? 1 : -1);
        }
        if (rightInfinite) {
            return OptionalInt.of(right.number > 0 ? -1 : 1);
        }
        return OptionalInt.of(left.exact().compareTo(right.exact()));
    }

    // finite numbers only; -0.0 becomes 0
    private BigDecimal exact() {
        return integer != null ? new BigDecimal(integer) : new BigDecimal(number);
    }

    /**
     * @return the value rendered as query text, e.g. {@code 5}, {@code 2.5}, {@code "ten"}
     */
    public String queryText() {
        return switch (kind) {
            case NUMBER -> integer != null ? integer.toString() : formatNumber(number);
            case STRING -> quote((String) ref);
            case BOOLEAN -> ref.toString();
            case NULL -> "null";
        };
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    /**
     * Value equality. Unlike {@link #sameValue(Scalar)}, NaN equals NaN so that
     * the {@code equals} contract holds.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Scalar that)) return false;
        if (kind != that.kind) return false;
        if (kind == Kind.NUMBER) {
            return Double.isNaN(number) && Double.isNaN(that.number) || sameValue(that);
        }
        return Objects.equals(ref, that.ref);
    }

    @Override
    public int hashCode() {
        if (kind == Kind.NUMBER) {
            // equal numbers share the same double approximation, up to the sign of zero
            return Double.hashCode(number == 0.0 ? 0.0 : number);
        }
        return Objects.hash(kind, ref);
    }

    @Override
    public String toString() {
        return kind + "(" + queryText() + ")";
    }
}
