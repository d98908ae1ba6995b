package dev.devanks.aquascenic.poller.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformsTest {

    @Test
    @DisplayName("isTruthy - loosely typed document values")
    void isTruthy() {
        assertThat(Transforms.isTruthy(1L)).isTrue();
        assertThat(Transforms.isTruthy(2.5)).isTrue();
        assertThat(Transforms.isTruthy("0")).isTrue();
        assertThat(Transforms.isTruthy(List.of())).isTrue();
        assertThat(Transforms.isTruthy(0L)).isFalse();
        assertThat(Transforms.isTruthy(Double.NaN)).isFalse();
        assertThat(Transforms.isTruthy("")).isFalse();
        assertThat(Transforms.isTruthy(null)).isFalse();
        assertThat(Transforms.isTruthy(false)).isFalse();
    }

    @Test
    @DisplayName("scaledUp - rounds to a whole number")
    void scaledUp_Rounds() {
        assertThat(Transforms.scaledUp(10).apply(5.04)).isEqualTo(50L);
        assertThat(Transforms.scaledUpAsString(100).apply(7.35)).isEqualTo("735");
        assertThat(Transforms.scaledUpAsString(100).apply(7)).isEqualTo("700");
    }

    @Test
    @DisplayName("asNumber - numeric strings accepted, anything else rejected")
    void asNumber() {
        assertThat(Transforms.asNumber(" 720 ")).isEqualTo(720.0);
        assertThatThrownBy(() -> Transforms.asNumber("high")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Transforms.asNumber(true)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("CodeTable - whole-number codes in any numeric form resolve")
    void codeTable_NumericForms() {
        CodeTable table = CodeTable.builder("test")
                .code(1, "on")
                .code(0, "off")
                .defaults("off", 0)
                .build();

        assertThat(table.label(1L)).isEqualTo("on");
        assertThat(table.label(1.0)).isEqualTo("on");
        assertThat(table.label("1")).isEqualTo("on");
        assertThat(table.label(1.5)).isEqualTo("off");
        assertThat(table.label("abc")).isEqualTo("off");
        assertThat(table.code("on")).isEqualTo(1L);
        assertThat(table.code("ON")).isEqualTo(0L);
    }

    @Test
    @DisplayName("CodeTable - defaults are mandatory")
    void codeTable_RequiresDefaults() {
        assertThatThrownBy(() -> CodeTable.builder("broken").code(0, "off").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("broken");
    }
}
