package com.example.timesheet.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimeRangeTest {

    @Test
    void colonTimesConvertToMinutes() {
        assertThat(new TimeRange("9:30", "18:00").startMinutes()).isEqualTo(570);
        assertThat(new TimeRange("13:00", "21:00").startMinutes()).isEqualTo(780);
    }

    @Test
    void separatorDoesNotMatter() {
        assertThat(new TimeRange("9h30", "18h00").startMinutes()).isEqualTo(570);
        assertThat(new TimeRange("09.30", "18.00").startMinutes()).isEqualTo(570);
    }

    @Test
    void hourWithoutMinutesStartsOnTheHour() {
        assertThat(new TimeRange("7", "15").startMinutes()).isEqualTo(420);
    }

    @Test
    void startWithoutDigitsIsRejected() {
        TimeRange range = new TimeRange("noon", "18:00");

        assertThrows(IllegalArgumentException.class, range::startMinutes);
    }

    @Test
    void missingStartIsRejected() {
        assertThrows(NullPointerException.class, () -> new TimeRange(null, "17:00"));
    }
}
