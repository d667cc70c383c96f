package io.sase.cep.compiler;

import io.opentelemetry.api.OpenTelemetry;
import io.sase.cep.api.EvaluationDiagnostics;
import io.sase.cep.api.Predicate;
import io.sase.cep.api.PredicateResult;
import io.sase.cep.api.model.Event;
import io.sase.cep.compiler.model.OperandDefinition;
import io.sase.cep.compiler.model.PredicateDefinition;
import io.sase.cep.infra.config.EvaluatorConfig;
import io.sase.cep.runtime.context.ImmutableCapturedEvents;
import io.sase.cep.runtime.predicates.AndPredicate;
import io.sase.cep.runtime.predicates.OperatorPredicate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PredicateCompilerTest {

    private PredicateCompiler compiler;
    private Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        compiler = new PredicateCompiler(OpenTelemetry.noop().getTracer("test"), EvaluationDiagnostics.NOOP);
        tempDir = Files.createTempDirectory("predicate_compiler_test");
    }

    @AfterEach
    void tearDown() throws IOException {
        Files.walk(tempDir)
                .sorted(java.util.Comparator.reverseOrder())
                .map(Path::toFile)
                .forEach(java.io.File::delete);
    }

    private Path writeDefinition(String json) throws IOException {
        Path file = tempDir.resolve("predicate.json");
        Files.writeString(file, json);
        return file;
    }

    private static ImmutableCapturedEvents tick(String alias, String id, Object price) {
        return ImmutableCapturedEvents.of(alias, new Event(id, "TICK", Map.of("price", price)));
    }

    @Nested
    @DisplayName("Valid definitions")
    class ValidDefinitions {

        @Test
        @DisplayName("Should compile a comparison between a field and a literal")
        void compilesComparison() throws Exception {
            Predicate predicate = compiler.compile("""
                    {"operator": ">", "left": {"alias": "a", "field": "price"}, "right": {"literal": 100}}
                    """);

            assertThat(predicate).isInstanceOf(OperatorPredicate.class);
            assertThat(predicate.queryText()).isEqualTo("a.price > 100");
            assertThat(predicate.evaluate(ImmutableCapturedEvents.empty())).isEqualTo(PredicateResult.UNCERTAIN);
            assertThat(predicate.evaluate(tick("a", "e1", 150))).isEqualTo(PredicateResult.POSITIVE);
        }

        @Test
        @DisplayName("Should compile nested logical predicates from a file")
        void compilesNestedFromFile() throws Exception {
            Path file = writeDefinition("""
                    {
                        "and": [
                            {"operator": "==", "left": {"alias": "a", "field": "symbol"}, "right": {"literal": "IBM"}},
                            {"not": {"operator": "lt", "left": {"alias": "b", "field": "price"},
                                     "right": {"alias": "a", "field": "price"}}}
                        ]
                    }
                    """);

            Predicate predicate = compiler.compile(file);

            assertThat(predicate).isInstanceOf(AndPredicate.class);
            assertThat(predicate.queryText())
                    .isEqualTo("(a.symbol == \"IBM\") AND (NOT (b.price < a.price))");
            assertThat(predicate.usedAliases()).containsExactly("a", "b", "a");
        }

        @Test
        @DisplayName("Should compile boolean and null literals")
        void compilesScalarLiterals() throws Exception {
            Predicate isNull = compiler.compile("""
                    {"operator": "==", "left": {"alias": "a", "field": "note"}, "right": {"literal": null}}
                    """);
            Predicate flagSet = compiler.compile("""
                    {"or": [{"operator": "!=", "left": {"alias": "a", "field": "flag"}, "right": {"literal": false}}]}
                    """);

            assertThat(isNull.queryText()).isEqualTo("a.note == null");
            assertThat(flagSet.queryText()).isEqualTo("(a.flag != false)");
        }

        @Test
        @DisplayName("Should keep integer literals exact beyond double precision")
        void compilesExactIntegerLiterals() throws Exception {
            Predicate predicate = compiler.compile("""
                    {"operator": "==", "left": {"alias": "a", "field": "id"}, "right": {"literal": 9007199254740993}}
                    """);

            assertThat(predicate.queryText()).isEqualTo("a.id == 9007199254740993");
            assertThat(predicate.evaluate(ImmutableCapturedEvents.of("a",
                    new Event("e1", "TICK", Map.of("id", 9007199254740992L)))))
                    .isEqualTo(PredicateResult.NEGATIVE);
            assertThat(predicate.evaluate(ImmutableCapturedEvents.of("a",
                    new Event("e2", "TICK", Map.of("id", 9007199254740993L)))))
                    .isEqualTo(PredicateResult.POSITIVE);
        }

        @Test
        @DisplayName("Should compile definitions built in code")
        void compilesProgrammaticDefinition() throws Exception {
            PredicateDefinition definition = PredicateDefinition.allOf(List.of(
                    PredicateDefinition.comparison(OperandDefinition.field("a", "price"), ">=",
                            OperandDefinition.literal(10)),
                    PredicateDefinition.negation(PredicateDefinition.comparison(
                            OperandDefinition.field("a", "symbol"), "==", OperandDefinition.literal("MSFT")))));

            Predicate predicate = compiler.compile(definition);

            assertThat(predicate.queryText()).isEqualTo("(a.price >= 10) AND (NOT (a.symbol == \"MSFT\"))");
            assertThat(predicate.evaluate(ImmutableCapturedEvents.of("a",
                    new Event("e1", "TICK", Map.of("price", 12, "symbol", "IBM")))))
                    .isEqualTo(PredicateResult.POSITIVE);
        }

        @Test
        @DisplayName("Should build compiled comparisons with the configured diagnostics")
        void compilesWithConfiguredDiagnostics() throws Exception {
            PredicateCompiler configured = new PredicateCompiler(
                    OpenTelemetry.noop().getTracer("test"), EvaluatorConfig.defaults());

            Predicate predicate = configured.compile("""
                    {"operator": "<", "left": {"alias": "a", "field": "price"}, "right": {"literal": "cheap"}}
                    """);

            assertThat(predicate.evaluate(tick("a", "e1", 5))).isEqualTo(PredicateResult.NEGATIVE);
        }
    }

    @Nested
    @DisplayName("Invalid definitions")
    class InvalidDefinitions {

        @Test
        @DisplayName("Should throw exception for empty input")
        void shouldThrowForEmptyInput() {
            assertThatThrownBy(() -> compiler.compile("  "))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("predicate definition cannot be empty");
        }

        @Test
        @DisplayName("Should throw exception for malformed JSON")
        void shouldThrowForMalformedJson() {
            assertThatThrownBy(() -> compiler.compile("{\"operator\": "))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageStartingWith("$: malformed predicate definition");
        }

        @Test
        @DisplayName("Should throw exception for unknown properties")
        void shouldThrowForUnknownProperty() {
            assertThatThrownBy(() -> compiler.compile("{\"xor\": []}"))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("malformed predicate definition");
        }

        @Test
        @DisplayName("Should throw exception for unknown operator")
        void shouldThrowForUnknownOperator() {
            String json = """
                    {"operator": "=~", "left": {"alias": "a", "field": "x"}, "right": {"literal": 1}}
                    """;
            assertThatThrownBy(() -> compiler.compile(json))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage("$: unknown operator: =~");
        }

        @Test
        @DisplayName("Should report the path of a missing operand")
        void shouldReportPathOfMissingOperand() {
            String json = """
                    {"and": [
                        {"operator": "==", "left": {"alias": "a", "field": "x"}, "right": {"literal": 1}},
                        {"operator": ">", "left": {"alias": "b", "field": "x"}}
                    ]}
                    """;
            assertThatThrownBy(() -> compiler.compile(json))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage("$.and[1].right: missing operand");
        }

        @Test
        @DisplayName("Should throw exception for an empty logical list")
        void shouldThrowForEmptyLogicalList() {
            assertThatThrownBy(() -> compiler.compile("{\"not\": {\"or\": []}}"))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage("$.not.or: requires at least one operand");
        }

        @Test
        @DisplayName("Should throw exception for a node mixing predicate kinds")
        void shouldThrowForAmbiguousNode() {
            String json = """
                    {"operator": "==", "left": {"alias": "a", "field": "x"}, "right": {"literal": 1},
                     "not": {"operator": "==", "left": {"alias": "a", "field": "y"}, "right": {"literal": 2}}}
                    """;
            assertThatThrownBy(() -> compiler.compile(json))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage("$: ambiguous predicate, combines operator, not");
        }

        @Test
        @DisplayName("Should throw exception for a node with no predicate kind")
        void shouldThrowForEmptyNode() {
            assertThatThrownBy(() -> compiler.compile("{\"and\": [{}]}"))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage("$.and[0]: expected one of operator, and, or, not");
        }

        @Test
        @DisplayName("Should throw exception for an operand missing its field")
        void shouldThrowForMissingField() {
            String json = """
                    {"operator": "==", "left": {"alias": "a"}, "right": {"literal": 1}}
                    """;
            assertThatThrownBy(() -> compiler.compile(json))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage("$.left: missing field");
        }

        @Test
        @DisplayName("Should throw exception for an operand that is both field and literal")
        void shouldThrowForFieldAndLiteral() {
            String json = """
                    {"operator": "==", "left": {"alias": "a", "field": "x", "literal": 3}, "right": {"literal": 1}}
                    """;
            assertThatThrownBy(() -> compiler.compile(json))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("$.left: operand cannot be both");
        }

        @Test
        @DisplayName("Should throw exception for unsupported literal types")
        void shouldThrowForUnsupportedLiteral() {
            String json = """
                    {"operator": "==", "left": {"alias": "a", "field": "x"}, "right": {"literal": [1, 2]}}
                    """;
            assertThatThrownBy(() -> compiler.compile(json))
                    .isInstanceOf(CompilationException.class)
                    .hasMessage("$.right: unsupported literal type: ARRAY");
        }

        @Test
        @DisplayName("Should propagate I/O errors for missing files")
        void shouldPropagateIoErrors() {
            assertThatThrownBy(() -> compiler.compile(tempDir.resolve("missing.json")))
                    .isInstanceOf(NoSuchFileException.class);
        }
    }
}
