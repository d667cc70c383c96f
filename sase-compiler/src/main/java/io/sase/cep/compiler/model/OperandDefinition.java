/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.compiler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * DTO for one side of a comparison: either a field reference ({@code alias} + {@code field})
 * or a {@code literal}. A literal of JSON {@code null} is kept as a null node.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperandDefinition(
        @JsonProperty("alias") String alias,
        @JsonProperty("field") String field,
        @JsonProperty("literal") JsonNode literal
) {

    public static OperandDefinition field(String alias, String field) {
        return new OperandDefinition(alias, field, null);
    }

    public static OperandDefinition literal(double value) {
        return new OperandDefinition(null, null, DoubleNode.valueOf(value));
    }

    public static OperandDefinition literal(String value) {
        return new OperandDefinition(null, null, TextNode.valueOf(value));
    }

    public static OperandDefinition literal(boolean value) {
        return new OperandDefinition(null, null, BooleanNode.valueOf(value));
    }

    @JsonIgnore
    public boolean isFieldReference() {
        return alias != null || field != null;
    }
}
