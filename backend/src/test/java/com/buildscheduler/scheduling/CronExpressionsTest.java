package com.buildscheduler.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class CronExpressionsTest {

    @Test
    void shouldPrefixSecondsToFiveFieldExpressions() {
        assertThat(CronExpressions.normalize("0 2 * * *")).isEqualTo("0 0 2 * * *");
        assertThat(CronExpressions.normalize(" */5 * * * * * ")).isEqualTo("*/5 * * * * *");
    }

    @Test
    void shouldRejectMissingOrMalformedExpressions() {
        assertThatThrownBy(() -> CronExpressions.validate(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cron expression is required");
        assertThatThrownBy(() -> CronExpressions.validate("every day"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid cron expression");
    }

    @Test
    void shouldListUpcomingFireTimes() {
        LocalDateTime from = LocalDateTime.of(2024, 3, 1, 10, 0);

        List<LocalDateTime> next = CronExpressions.nextFireTimes("0 2 * * *", from, 3);

        assertThat(next).containsExactly(
                LocalDateTime.of(2024, 3, 2, 2, 0),
                LocalDateTime.of(2024, 3, 3, 2, 0),
                LocalDateTime.of(2024, 3, 4, 2, 0));
    }

    @Test
    void nextReturnsNullForUnparseableExpression() {
        assertThat(CronExpressions.next("nope", LocalDateTime.now())).isNull();
    }
}
