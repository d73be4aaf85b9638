package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.DayInfo;
import com.example.timesheet.domain.model.ShiftCapture;
import com.example.timesheet.domain.model.TimeRange;
import com.example.timesheet.domain.model.WeekRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ShiftResolverTest {

    private final ShiftResolver resolver = new ShiftResolver();

    @Test
    void latestStartWins() {
        List<ShiftCapture> captures = List.of(
                capture("Monday", "9:00", "17:00", "A"),
                capture("Monday", "9:30", "17:30", "B"),
                capture("Monday", "9:00", "17:00", "C")
        );

        DayInfo day = resolver.resolveDay(captures, "04.03.2024");

        assertThat(day.start()).isEqualTo("9:30");
        assertThat(day.end()).isEqualTo("17:30");
        assertThat(day.area()).isEqualTo("B");
        assertThat(day.date()).isEqualTo("04.03.2024");
    }

    @Test
    void equalStartsKeepTheFirstCapture() {
        List<ShiftCapture> captures = List.of(
                capture("Tuesday", "13:00", "21:00", "Front"),
                capture("Tuesday", "13:00", "22:00", "Back")
        );

        DayInfo day = resolver.resolveDay(captures, "");

        assertThat(day.end()).isEqualTo("21:00");
        assertThat(day.area()).isEqualTo("Front");
    }

    @Test
    void hourFormatStartsAreComparedByValue() {
        List<ShiftCapture> captures = List.of(
                capture("Monday", "13h00", "21h00", "Bar"),
                capture("Monday", "9h00", "17h00", "Kitchen")
        );

        DayInfo day = resolver.resolveDay(captures, "");

        assertThat(day.start()).isEqualTo("13h00");
        assertThat(day.area()).isEqualTo("Bar");
    }

    @Test
    void latestStartUsesTheLaterEntryAndAggregatesFlagsFromAll() {
        List<ShiftCapture> captures = List.of(
                new ShiftCapture("Thursday", new TimeRange("9:00", "17:00"), "Front", Set.of("ATM")),
                new ShiftCapture("Thursday", new TimeRange("13:00", "21:00"), "Back", Set.of())
        );

        DayInfo day = resolver.resolveDay(captures, "07.03.2024");

        assertThat(day).isEqualTo(new DayInfo("13:00", "21:00", "ATM", "07.03.2024", "Back"));
    }

    @Test
    void duplicateFlagsCollapse() {
        List<ShiftCapture> captures = List.of(
                new ShiftCapture("Friday", new TimeRange("9:00", "17:00"), null, Set.of("ATM")),
                new ShiftCapture("Friday", new TimeRange("10:00", "18:00"), null, Set.of("ATM")),
                new ShiftCapture("Friday", null, null, Set.of("ATM"))
        );

        assertThat(resolver.resolveDay(captures, "").note()).isEqualTo("ATM");
    }

    @Test
    void distinctFlagsAreSortedAndCommaJoined() {
        List<ShiftCapture> captures = List.of(
                new ShiftCapture("Friday", new TimeRange("9:00", "17:00"), null, Set.of("TRAINING")),
                new ShiftCapture("Friday", new TimeRange("9:00", "17:00"), null, Set.of("ATM"))
        );

        assertThat(resolver.resolveDay(captures, "").note()).isEqualTo("ATM, TRAINING");
    }

    @Test
    void capturesWithoutTimesOnlyContributeFlags() {
        List<ShiftCapture> captures = List.of(new ShiftCapture("Friday", null, "Kitchen", Set.of("ATM")));

        DayInfo day = resolver.resolveDay(captures, "08.03.2024");

        assertThat(day).isEqualTo(new DayInfo(null, null, "ATM", "08.03.2024", null));
    }

    @Test
    void resolvesEveryWeekdayInColumnOrder() {
        ScheduleCaptures captures = new ScheduleCaptures(
                List.of("04.03.2024", "05.03.2024", "06.03.2024", "07.03.2024", "08.03.2024"),
                List.of(capture("Wednesday", "9:30", "18:00", "Kitchen"))
        );

        WeekRecord week = resolver.resolve(captures, "08/03/2024", PageTokens.WEEKDAYS);

        assertThat(week.weekEnding()).isEqualTo("08/03/2024");
        assertThat(week.days().keySet()).containsExactly("Monday", "Tuesday", "Wednesday", "Thursday", "Friday");
        assertThat(week.day("Monday")).isEqualTo(DayInfo.off("04.03.2024"));
        assertThat(week.day("Wednesday").start()).isEqualTo("9:30");
        assertThat(week.day("Wednesday").working()).isTrue();
        assertThat(week.dates()).hasSize(5);
    }

    private static ShiftCapture capture(String weekday, String start, String end, String area) {
        return new ShiftCapture(weekday, new TimeRange(start, end), area, Set.of());
    }
}
