/*
 * Copyright (c) 2025 SASE CEP Engine
 * Licensed under the Apache License, Version 2.0
 */
package io.sase.cep.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.sase.cep.api.EvaluationDiagnostics;
import io.sase.cep.api.Predicate;
import io.sase.cep.api.ValueExpression;
import io.sase.cep.api.model.Scalar;
import io.sase.cep.compiler.model.OperandDefinition;
import io.sase.cep.compiler.model.PredicateDefinition;
import io.sase.cep.infra.config.EvaluatorConfig;
import io.sase.cep.infra.diagnostics.Slf4jEvaluationDiagnostics;
import io.sase.cep.runtime.predicates.AndPredicate;
import io.sase.cep.runtime.predicates.NotPredicate;
import io.sase.cep.runtime.predicates.Operator;
import io.sase.cep.runtime.predicates.OperatorPredicate;
import io.sase.cep.runtime.predicates.OrPredicate;
import io.sase.cep.runtime.values.FieldExpression;
import io.sase.cep.runtime.values.LiteralExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles JSON predicate definitions into evaluable predicate trees.
 *
 * <pre>{@code
 * { "operator": ">", "left": {"alias": "a", "field": "price"}, "right": {"literal": 100} }
 * { "and": [ {...}, {...} ] }    { "or": [ ... ] }    { "not": {...} }
 * }</pre>
 *
 * <p>Operators are given by symbol ({@code ==}, {@code !=}, {@code >}, {@code <},
 * {@code >=}, {@code <=}) or by name ({@code EQ}, {@code GT}, ...). Every rejected
 * definition raises a {@link CompilationException} whose message starts with the JSON
 * path of the offending node.
 */
public final class PredicateCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PredicateCompiler.class);
    private static final String ROOT = "$";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Tracer tracer;
    private final EvaluationDiagnostics diagnostics;

    public PredicateCompiler(Tracer tracer, EvaluatorConfig config) {
        this(tracer, config.diagnosticsEnabled() ? new Slf4jEvaluationDiagnostics() : EvaluationDiagnostics.NOOP);
    }

    /**
     * @param diagnostics sink handed to every compiled comparison
     */
    public PredicateCompiler(Tracer tracer, EvaluationDiagnostics diagnostics) {
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
    }

    /**
     * Compiles a predicate definition read from a JSON file.
     *
     * @throws IOException if the file cannot be read
     * @throws CompilationException if the definition is invalid
     */
    public Predicate compile(Path definitionPath) throws IOException, CompilationException {
        Span span = tracer.spanBuilder("compile-predicate").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("definitionPath", definitionPath.toString());
            return compile(Files.readString(definitionPath));
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Predicate compile(String json) throws CompilationException {
        if (json == null || json.isBlank()) {
            throw new CompilationException(ROOT + ": predicate definition cannot be empty");
        }
        PredicateDefinition definition;
        try {
            definition = objectMapper.readValue(json, PredicateDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CompilationException(ROOT + ": malformed predicate definition: " + e.getOriginalMessage(), e);
        }
        return compile(definition);
    }

    public Predicate compile(PredicateDefinition definition) throws CompilationException {
        Predicate predicate = build(definition, ROOT);
        logger.debug("Compiled predicate: {}", predicate.queryText());
        return predicate;
    }

    private Predicate build(PredicateDefinition def, String path) throws CompilationException {
        if (def == null) {
            throw new CompilationException(path + ": missing predicate");
        }
        int kinds = (def.isComparison() ? 1 : 0)
                + (def.and() != null ? 1 : 0)
                + (def.or() != null ? 1 : 0)
                + (def.not() != null ? 1 : 0);
        if (kinds == 0) {
            throw new CompilationException(path + ": expected one of operator, and, or, not");
        }
        if (kinds > 1) {
            throw new CompilationException(path + ": ambiguous predicate, combines "
                    + describeKinds(def));
        }

        if (def.and() != null) {
            return new AndPredicate(buildAll(def.and(), path + ".and"));
        }
        if (def.or() != null) {
            return new OrPredicate(buildAll(def.or(), path + ".or"));
        }
        if (def.not() != null) {
            return new NotPredicate(build(def.not(), path + ".not"));
        }
        return buildComparison(def, path);
    }

    private List<Predicate> buildAll(List<PredicateDefinition> defs, String path) throws CompilationException {
        if (defs.isEmpty()) {
            throw new CompilationException(path + ": requires at least one operand");
        }
        List<Predicate> operands = new ArrayList<>(defs.size());
        for (int i = 0; i < defs.size(); i++) {
            operands.add(build(defs.get(i), path + "[" + i + "]"));
        }
        return operands;
    }

    private Predicate buildComparison(PredicateDefinition def, String path) throws CompilationException {
        if (def.operator() == null || def.operator().isBlank()) {
            throw new CompilationException(path + ": missing operator");
        }
        Operator operator = Operator.fromSymbol(def.operator());
        if (operator == null) {
            throw new CompilationException(path + ": unknown operator: " + def.operator());
        }
        ValueExpression left = buildOperand(def.left(), path + ".left");
        ValueExpression right = buildOperand(def.right(), path + ".right");
        return OperatorPredicate.of(left, operator, right, diagnostics);
    }

    private ValueExpression buildOperand(OperandDefinition operand, String path) throws CompilationException {
        if (operand == null) {
            throw new CompilationException(path + ": missing operand");
        }
        JsonNode literal = operand.literal();
        if (operand.isFieldReference()) {
            if (literal != null && !literal.isNull()) {
                throw new CompilationException(path + ": operand cannot be both a field reference and a literal");
            }
            if (operand.alias() == null || operand.alias().isBlank()) {
                throw new CompilationException(path + ": missing alias");
            }
            if (operand.field() == null || operand.field().isBlank()) {
                throw new CompilationException(path + ": missing field");
            }
            return new FieldExpression(operand.alias(), operand.field());
        }
        if (literal == null) {
            throw new CompilationException(path + ": missing operand");
        }
        return new LiteralExpression(toScalar(literal, path));
    }

    private static Scalar toScalar(JsonNode literal, String path) throws CompilationException {
        if (literal.isNull()) {
            return Scalar.NULL;
        }
        if (literal.isIntegralNumber()) {
            return Scalar.integer(literal.bigIntegerValue());
        }
        if (literal.isNumber()) {
            return Scalar.number(literal.doubleValue());
        }
        if (literal.isTextual()) {
            return Scalar.string(literal.textValue());
        }
        if (literal.isBoolean()) {
            return Scalar.bool(literal.booleanValue());
        }
        throw new CompilationException(path + ": unsupported literal type: " + literal.getNodeType());
    }

    private static String describeKinds(PredicateDefinition def) {
        List<String> kinds = new ArrayList<>();
        if (def.isComparison()) kinds.add("operator");
        if (def.and() != null) kinds.add("and");
        if (def.or() != null) kinds.add("or");
        if (def.not() != null) kinds.add("not");
        return String.join(", ", kinds);
    }
}
