package io.github.superyaml.constraints;

import io.github.superyaml.core.StringValue;
import io.github.superyaml.core.Value;
import io.github.superyaml.core.ValueJson;
import io.github.superyaml.expr.ExpressionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintValidatorTest extends ConstraintsTestBase {

    private static final Value DATA = ValueJson.parse("""
            {"replicas": 3, "workers": 6, "env_name": "prod", "window": {"min": 1, "max": 5}, "count": 7}
            """);

    private static final Map<String, Value> ENV = Map.of("EXPECTED_ENV", StringValue.of("prod"));

    private static void validate(Map<String, List<String>> constraints) {
        ConstraintValidator.validate(DATA, ENV, constraints);
    }

    @Test
    void testPassingConstraintsWithPathsScopeAndEnv() {
        assertThatCode(() -> validate(Map.of(
                "replicas", List.of("value >= 1"),
                "$.workers", List.of("value == replicas * 2"),
                "env_name", List.of("=value == env.EXPECTED_ENV"),
                "window", List.of("min < max", "value.max - value.min == 4"),
                "$.window.min", List.of("value < max")
        ))).doesNotThrowAnyException();
    }

    @Test
    void testFalseConstraintNamesPathAndExpression() {
        assertThatThrownBy(() -> validate(Map.of("replicas", List.of("value >= 5"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessage("constraint error: constraint failed at '$.replicas': 'value >= 5' evaluated to false")
                .satisfies(ex -> {
                    final var ce = (ConstraintException) ex;
                    assertThat(ce.path()).isEqualTo("$.replicas");
                    assertThat(ce.expressions()).containsExactly("value >= 5");
                });
    }

    @Test
    void testNonBooleanResult() {
        assertThatThrownBy(() -> validate(Map.of("replicas", List.of("value + 1"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("constraint 'value + 1' at '$.replicas' must evaluate to boolean, got number");
    }

    @Test
    void testMissingPath() {
        assertThatThrownBy(() -> validate(Map.of("$.missing", List.of("value == 1"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("constraint path '$.missing' not found (normalized '$.missing')");
        assertThatThrownBy(() -> validate(Map.of("missing.deep", List.of("value == 1"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("not found (normalized '$.missing.deep')");
    }

    @Test
    void testUnknownReferenceSurfacesAsExpressionError() {
        assertThatThrownBy(() -> validate(Map.of("replicas", List.of("value > c"))))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("unknown reference 'c'");
    }

    @Test
    void testSyntaxErrorStopsBeforeEvaluation() {
        assertThatThrownBy(() -> validate(Map.of("replicas", List.of("value >= 100", "value = 1"))))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("use '==' for equality");
    }

    @Test
    void testContradictoryPairOrdering() {
        assertThatThrownBy(() -> validate(Map.of("window", List.of("value.min < value.max", "value.min > value.max"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("impossible constraints")
                .hasMessageContaining("value.min < value.max")
                .hasMessageContaining("value.min > value.max");
    }

    @Test
    void testContradictoryPairInsideSingleConjunction() {
        assertThatThrownBy(() -> validate(Map.of("window", List.of("value.min < value.max && value.min > value.max"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("impossible constraints");
    }

    @Test
    void testContradictoryPairWrittenInReverseOrder() {
        assertThatThrownBy(() -> validate(Map.of("$", List.of("a < b", "b < a"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("impossible constraints");
    }

    @Test
    void testConsistentPairOrdering() {
        assertThatCode(() -> validate(Map.of("window", List.of("value.min <= value.max", "value.min != value.max"))))
                .doesNotThrowAnyException();
    }

    @Test
    void testContradictoryRangeFiresWhateverTheValue() {
        for (final var stored : List.of("7", "0", "100", "\"text\"")) {
            final var data = ValueJson.parse("{\"port\": " + stored + "}");
            assertThatThrownBy(() -> ConstraintValidator.validate(data, Map.of(),
                    Map.of("port", List.of("value > 100", "value < 50"))))
                    .isInstanceOf(ConstraintException.class)
                    .hasMessageContaining("impossible constraints")
                    .hasMessageContaining("value > 100")
                    .hasMessageContaining("value < 50");
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "value >= 3 && value < 3",
            "value > 3 && value <= 3",
            "value > 3 && 3 > value",
            "value > -1 && value < -2",
            "value == 4 && value != 4",
            "value == 4 && value == 5"
    })
    void testContradictoryRangeInsideOneExpression(String expression) {
        assertThatThrownBy(() -> validate(Map.of("count", List.of(expression))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("impossible constraints");
    }

    @Test
    void testExcludedExactValue() {
        assertThatThrownBy(() -> validate(Map.of("count", List.of("value == 4", "value != 4"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("impossible constraints")
                .hasMessageContaining("value == 4")
                .hasMessageContaining("value != 4");
    }

    @Test
    void testExcludedPointReachedThroughInclusiveBounds() {
        assertThatThrownBy(() -> validate(Map.of("count", List.of("value != 7", "value >= 7", "value <= 7"))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("impossible constraints");
    }

    @Test
    void testConsistentRange() {
        assertThatCode(() -> validate(Map.of("count", List.of("value >= 5", "value <= 10", "value != 8"))))
                .doesNotThrowAnyException();
        assertThatCode(() -> validate(Map.of("count", List.of("value >= 7", "value <= 7"))))
                .doesNotThrowAnyException();
    }

    @Test
    void testDisjunctionsAreLeftToRuntime() {
        assertThatCode(() -> validate(Map.of("count", List.of("value < 5 || value > 6", "value > 10 || value < 8"))))
                .doesNotThrowAnyException();
    }

    @Test
    void testPathLimit() {
        final var many = new HashMap<String, List<String>>();
        for (int i = 0; i <= ConstraintValidator.MAX_CONSTRAINT_PATHS; i++) {
            many.put("p" + i, List.of("true"));
        }
        assertThatThrownBy(() -> validate(many))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("too many constraint paths: 2049 (max 2048)");
    }

    @Test
    void testPerPathLimit() {
        final var list = Collections.nCopies(ConstraintValidator.MAX_CONSTRAINTS_PER_PATH + 1, "value > 0");
        assertThatThrownBy(() -> validate(Map.of("count", list)))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("too many constraints for path 'count': 129 (max 128)");
    }

    @Test
    void testExpressionLengthLimit() {
        final var longSource = "value > 0" + " ".repeat(ConstraintValidator.MAX_CONSTRAINT_EXPRESSION_LENGTH) + "&& true";
        assertThatThrownBy(() -> validate(Map.of("count", List.of(longSource))))
                .isInstanceOf(ConstraintException.class)
                .hasMessageContaining("constraint expression at '$.count' exceeds max length (4096)");
    }
}
