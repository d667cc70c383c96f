/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.compiler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a predicate tree for deserialization.
 *
 * <p>A node is either a comparison ({@code operator}, {@code left}, {@code right}) or
 * exactly one of {@code and}, {@code or}, {@code not}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PredicateDefinition(
        @JsonProperty("operator") String operator,
        @JsonProperty("left") OperandDefinition left,
        @JsonProperty("right") OperandDefinition right,
        @JsonProperty("and") List<PredicateDefinition> and,
        @JsonProperty("or") List<PredicateDefinition> or,
        @JsonProperty("not") PredicateDefinition not
) {

    public static PredicateDefinition comparison(OperandDefinition left, String operator, OperandDefinition right) {
        return new PredicateDefinition(operator, left, right, null, null, null);
    }

    public static PredicateDefinition allOf(List<PredicateDefinition> operands) {
        return new PredicateDefinition(null, null, null, operands, null, null);
    }

    public static PredicateDefinition anyOf(List<PredicateDefinition> operands) {
        return new PredicateDefinition(null, null, null, null, operands, null);
    }

    public static PredicateDefinition negation(PredicateDefinition operand) {
        return new PredicateDefinition(null, null, null, null, null, operand);
    }

    @JsonIgnore
    public boolean isComparison() {
        return operator != null || left != null || right != null;
    }
}
