package io.sase.cep.runtime.predicates;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorTest {

    @Test
    @DisplayName("Should resolve operators from symbols and names")
    void fromSymbol() {
        assertThat(Operator.fromSymbol(">=")).isEqualTo(Operator.GE);
        assertThat(Operator.fromSymbol(" != ")).isEqualTo(Operator.NE);
        assertThat(Operator.fromSymbol("lt")).isEqualTo(Operator.LT);
        assertThat(Operator.fromSymbol("=")).isNull();
        assertThat(Operator.fromSymbol(null)).isNull();
    }

    @Test
    @DisplayName("Only comparison operators should be ordering operators")
    void ordering() {
        assertThat(Operator.EQ.isOrdering()).isFalse();
        assertThat(Operator.NE.isOrdering()).isFalse();
        assertThat(Operator.GT.isOrdering()).isTrue();
        assertThat(Operator.LE.isOrdering()).isTrue();
    }
}
