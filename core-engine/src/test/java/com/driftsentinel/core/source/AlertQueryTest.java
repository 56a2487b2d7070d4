package com.driftsentinel.core.source;

import com.driftsentinel.core.model.AlertStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertQuery}.
 */
class AlertQueryTest {

    @Test
    @DisplayName("Should leave every filter empty by default")
    void shouldHaveNoFiltersByDefault() {
        AlertQuery query = AlertQuery.builder().build();

        assertThat(query.getSince()).isEmpty();
        assertThat(query.getStatus()).isEmpty();
        assertThat(query.getLimit()).isEmpty();
    }

    @Test
    @DisplayName("Should carry the configured filters")
    void shouldCarryFilters() {
        AlertQuery query = AlertQuery.builder()
                .since(LocalDate.of(2024, 5, 1))
                .status(AlertStatus.OPEN)
                .limit(20)
                .build();

        assertThat(query.getSince()).contains(LocalDate.of(2024, 5, 1));
        assertThat(query.getStatus()).contains(AlertStatus.OPEN);
        assertThat(query.getLimit()).hasValue(20);
        assertThat(query).isEqualTo(AlertQuery.builder()
                .since(LocalDate.of(2024, 5, 1))
                .status(AlertStatus.OPEN)
                .limit(20)
                .build());
    }

    @Test
    @DisplayName("Should reject a limit below one")
    void shouldRejectNonPositiveLimit() {
        assertThatThrownBy(() -> AlertQuery.builder().limit(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
