package io.bitmask.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaskWidthTest {

    @Test
    void shouldExposeWidths() {
        assertThat(MaskWidth.values()).containsExactly(MaskWidth.INT32, MaskWidth.INT64);
        assertThat(MaskWidth.INT32.bits()).isEqualTo(32);
        assertThat(MaskWidth.INT64.bits()).isEqualTo(64);
        assertThat(MaskWidth.INT64.maxIdentifier()).isEqualTo(63);
    }

    @Test
    void shouldCheckRange() {
        assertThat(MaskWidth.INT32.contains(0)).isTrue();
        assertThat(MaskWidth.INT32.contains(31)).isTrue();
        assertThat(MaskWidth.INT32.contains(32)).isFalse();
        assertThat(MaskWidth.INT64.contains(32)).isTrue();
        assertThat(MaskWidth.INT64.contains(-1)).isFalse();
        assertThat(MaskWidth.INT64.checkIdentifier(63)).isEqualTo(63);
    }

    @Test
    void shouldDescribeRejectedIdentifier() {
        assertThatThrownBy(() -> MaskWidth.INT32.checkIdentifier(40))
                .isInstanceOf(InvalidIdentifierException.class)
                .isInstanceOf(BitmaskException.class)
                .hasMessage("identifier 40 out of range for 32-bit mask: expected 0..31");
    }
}
