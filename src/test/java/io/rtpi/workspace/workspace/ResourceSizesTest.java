package io.rtpi.workspace.workspace;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceSizesTest {

    @Test
    void parseMemory_unitSuffixes() {
        assertThat(ResourceSizes.parseMemoryMb("4096M")).isEqualTo(4096);
        assertThat(ResourceSizes.parseMemoryMb("512Mi")).isEqualTo(512);
        assertThat(ResourceSizes.parseMemoryMb("8G")).isEqualTo(8192);
        assertThat(ResourceSizes.parseMemoryMb("2gi")).isEqualTo(2048);
        assertThat(ResourceSizes.parseMemoryMb("0.5G")).isEqualTo(512);
        assertThat(ResourceSizes.parseMemoryMb("1024")).isEqualTo(1024);
    }

    @Test
    void parseMemory_rejectsGarbage() {
        assertThatThrownBy(() -> ResourceSizes.parseMemoryMb("lots")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceSizes.parseMemoryMb("-1G")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceSizes.parseMemoryMb(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseMemory_rejectsValuesOutsideLongRange() {
        assertThatThrownBy(() -> ResourceSizes.parseMemoryMb("18446744073709551716M"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid memoryLimit");
        assertThatThrownBy(() -> ResourceSizes.parseMemoryMb("9223372036854775807G"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ResourceSizes.parseMemoryMb("9223372036854775807M")).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void parseMemory_rejectsBelowOneMegabyte() {
        assertThatThrownBy(() -> ResourceSizes.parseMemoryMb("0.0001M"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid memoryLimit");
        assertThat(ResourceSizes.parseMemoryMb("1.9M")).isEqualTo(1);
    }

    @Test
    void parseCpu_decimalCores() {
        assertThat(ResourceSizes.parseCpu("2")).isEqualTo(2.0);
        assertThat(ResourceSizes.parseCpu("0.5")).isEqualTo(0.5);
        assertThatThrownBy(() -> ResourceSizes.parseCpu("two")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceSizes.parseCpu("0")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatCpu_dropsTrailingZeros() {
        assertThat(ResourceSizes.formatCpu(2.0)).isEqualTo("2");
        assertThat(ResourceSizes.formatCpu(2.5)).isEqualTo("2.5");
    }
}
