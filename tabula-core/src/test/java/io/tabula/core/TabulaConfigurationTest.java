package io.tabula.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabulaConfigurationTest {

    @Test
    @DisplayName("Should expose documented defaults")
    void shouldExposeDefaults() {
        TabulaConfiguration config = TabulaConfiguration.defaults();

        assertThat(config.duplicateLabelPolicy()).isEqualTo(DuplicateLabelPolicy.ALL);
        assertThat(config.columnCollisionPolicy()).isEqualTo(ColumnCollisionPolicy.KEEP);
        assertThat(config.enableParallelApply()).isFalse();
        assertThat(config.parallelApplyThreshold()).isEqualTo(64);
    }

    @Test
    @DisplayName("Should build custom configuration")
    void shouldBuildCustomConfiguration() {
        TabulaConfiguration config = TabulaConfiguration.builder()
                .duplicateLabelPolicy(DuplicateLabelPolicy.REJECT)
                .columnCollisionPolicy(ColumnCollisionPolicy.REJECT)
                .enableParallelApply(true)
                .parallelApplyThreshold(2)
                .build();

        assertThat(config.duplicateLabelPolicy()).isEqualTo(DuplicateLabelPolicy.REJECT);
        assertThat(config.columnCollisionPolicy()).isEqualTo(ColumnCollisionPolicy.REJECT);
        assertThat(config.enableParallelApply()).isTrue();
        assertThat(config.parallelApplyThreshold()).isEqualTo(2);
    }

    @Test
    @DisplayName("toBuilder should copy every setting")
    void toBuilderShouldCopySettings() {
        TabulaConfiguration original = TabulaConfiguration.builder()
                .duplicateLabelPolicy(DuplicateLabelPolicy.FIRST)
                .enableParallelApply(true)
                .build();

        TabulaConfiguration copy = original.toBuilder().parallelApplyThreshold(8).build();

        assertThat(copy.duplicateLabelPolicy()).isEqualTo(DuplicateLabelPolicy.FIRST);
        assertThat(copy.enableParallelApply()).isTrue();
        assertThat(copy.parallelApplyThreshold()).isEqualTo(8);
        assertThat(original.parallelApplyThreshold()).isEqualTo(64);
    }

    @Test
    @DisplayName("Should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> TabulaConfiguration.builder().parallelApplyThreshold(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelApplyThreshold must be positive");
        assertThatThrownBy(() -> TabulaConfiguration.builder().duplicateLabelPolicy(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicateLabelPolicy required");
        assertThatThrownBy(() -> TabulaConfiguration.builder().columnCollisionPolicy(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("columnCollisionPolicy required");
    }

    @Test
    void exceptionShouldCarryKind() {
        TabulaException exception = TabulaException.unknownLabel("x");

        assertThat(exception.kind()).isEqualTo(ErrorKind.UNKNOWN_LABEL);
        assertThat(exception).hasMessageContaining("label not found: x");
        assertThatThrownBy(() -> new TabulaException(null, "boom"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
