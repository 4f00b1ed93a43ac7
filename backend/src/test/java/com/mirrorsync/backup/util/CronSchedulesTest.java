package com.mirrorsync.backup.util;

import com.cronutils.model.time.ExecutionTime;
import com.mirrorsync.backup.service.InvalidScheduleException;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronSchedulesTest {

    @Test
    void acceptsFiveFieldExpressions() {
        assertThat(CronSchedules.isValid("* * * * *")).isTrue();
        assertThat(CronSchedules.isValid("0 2 * * *")).isTrue();      // daily at 02:00
        assertThat(CronSchedules.isValid("*/15 8-17 * * 1-5")).isTrue();
        assertThat(CronSchedules.isValid(" 30 4 1,15 * * ")).isTrue();
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThat(CronSchedules.isValid("not a cron")).isFalse();
        assertThat(CronSchedules.isValid("60 * * * *")).isFalse();     // minute out of range
        assertThat(CronSchedules.isValid("* * * *")).isFalse();        // four fields
        assertThat(CronSchedules.isValid("0 0 12 * * ?")).isFalse();   // six fields
        assertThat(CronSchedules.isValid("")).isFalse();
        assertThat(CronSchedules.isValid(null)).isFalse();
    }

    @Test
    void parseFailureCarriesExpression() {
        assertThatThrownBy(() -> CronSchedules.parse("not a cron"))
            .isInstanceOf(InvalidScheduleException.class)
            .hasMessageContaining("not a cron");
    }

    @Test
    void nextExecutionFollowsZone() {
        ExecutionTime daily = CronSchedules.parse("0 2 * * *");
        ZoneId berlin = ZoneId.of("Europe/Berlin");
        ZonedDateTime from = ZonedDateTime.of(2026, 1, 10, 3, 0, 0, 0, berlin);

        ZonedDateTime next = daily.nextExecution(from).orElseThrow();

        assertThat(next).isEqualTo(ZonedDateTime.of(2026, 1, 11, 2, 0, 0, 0, berlin));
    }
}
