package com.example.timesheet.application.parser;

import com.example.timesheet.domain.model.GridRow;
import com.example.timesheet.domain.model.ShiftCapture;
import com.example.timesheet.domain.model.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleExtractorTest {

    private ScheduleExtractor extractor;
    private long nextKey;

    @BeforeEach
    void setUp() {
        GridSettings settings = GridSettings.defaults();
        extractor = new ScheduleExtractor(settings, new RowClassifier(settings));
        nextKey = 0L;
    }

    @Test
    void contentBeforeTheFirstShiftTimeRowIsIgnored() {
        List<GridRow> rows = List.of(
                row("", "Rohan", "", "", "", ""),
                row("", "9:00-17:00", "9:00-17:00", "9:00-17:00", "", ""),
                row("", "", "Rohan", "", "", "")
        );

        ScheduleCaptures captures = extractor.extract(rows, "Rohan");

        assertThat(captures.captures()).hasSize(1);
        assertThat(captures.captures().get(0).weekday()).isEqualTo("Tuesday");
    }

    @Test
    void nameUnderActiveShiftIsCapturedWithFlag() {
        List<GridRow> rows = List.of(
                row("", "9:00-17:00", "", "9:30-18:00", "9:00-17:00", "off"),
                row("", "Alice", "", "Jane Rohan ATM", "Bob", "")
        );

        List<ShiftCapture> captures = extractor.extract(rows, "Rohan").captures();

        assertThat(captures).containsExactly(
                new ShiftCapture("Wednesday", new TimeRange("9:30", "18:00"), null, Set.of("ATM")));
    }

    @Test
    void matchingIgnoresCase() {
        List<GridRow> rows = List.of(
                row("", "9:00-17:00", "9:00-17:00", "9:00-17:00", "", ""),
                row("", "ROHAN atm", "", "", "", "")
        );

        ShiftCapture capture = extractor.extract(rows, "rohan").captures().get(0);

        assertThat(capture.weekday()).isEqualTo("Monday");
        assertThat(capture.flags()).containsExactly("ATM");
    }

    @Test
    void laterShiftTimeRowReplacesTheActiveRanges() {
        List<GridRow> rows = List.of(
                row("", "9:00-17:00", "9:00-17:00", "9:00-17:00", "9:00-17:00", "9:00-17:00"),
                row("", "", "", "", "Rohan", ""),
                row("", "13:00-21:00", "13:00-21:00", "", "13:00-21:00", ""),
                row("", "", "", "", "Rohan", "")
        );

        List<ShiftCapture> captures = extractor.extract(rows, "Rohan").captures();

        assertThat(captures).extracting(ShiftCapture::timeRange)
                .containsExactly(new TimeRange("9:00", "17:00"), new TimeRange("13:00", "21:00"));
    }

    @Test
    void areaLabelSticksUntilReplaced() {
        List<GridRow> rows = List.of(
                row("Kitchen", "9:00-17:00", "9:00-17:00", "9:00-17:00", "9:00-17:00", "9:00-17:00"),
                row("", "Rohan", "", "", "", ""),
                row("", "", "Rohan", "", "", ""),
                row("Bar", "", "", "", "", ""),
                row("", "", "", "Rohan", "", ""),
                row("Floor", "", "", "", "Rohan", "")
        );

        List<ShiftCapture> captures = extractor.extract(rows, "Rohan").captures();

        assertThat(captures).extracting(ShiftCapture::area)
                .containsExactly("Kitchen", "Kitchen", "Bar", "Floor");
    }

    @Test
    void shiftTimeRowsAreNotScannedForTheName() {
        List<GridRow> rows = List.of(
                row("", "9:00-17:00 Rohan", "9:00-17:00", "9:00-17:00", "", "")
        );

        assertThat(extractor.extract(rows, "Rohan").captures()).isEmpty();
    }

    @Test
    void nameInAColumnWithoutRangeIsCapturedWithoutTimes() {
        List<GridRow> rows = List.of(
                row("", "9:00-17:00", "9:00-17:00", "9:00-17:00", "", ""),
                row("", "", "", "", "", "Rohan ATM")
        );

        ShiftCapture capture = extractor.extract(rows, "Rohan").captures().get(0);

        assertThat(capture.weekday()).isEqualTo("Friday");
        assertThat(capture.hasTimeRange()).isFalse();
        assertThat(capture.flags()).containsExactly("ATM");
    }

    @Test
    void firstDateRowSuppliesHeaderDates() {
        List<GridRow> rows = List.of(
                row("", "01.03.2024", "02.03.2024", "03.03.2024", "04.03.2024", "05.03.2024"),
                row("", "08.03.2024", "09.03.2024", "10.03.2024", "11.03.2024", "12.03.2024")
        );

        ScheduleCaptures captures = extractor.extract(rows, "Rohan");

        assertThat(captures.headerDates())
                .containsExactly("01.03.2024", "02.03.2024", "03.03.2024", "04.03.2024", "05.03.2024");
    }

    @Test
    void laterDateLikeRowIsScannedForTheName() {
        List<GridRow> rows = List.of(
                row("", "04.03.2024", "05.03.2024", "06.03.2024", "07.03.2024", "08.03.2024"),
                row("", "9:00-17:00", "9:00-17:00", "9:00-17:00", "", ""),
                row("", "Rohan 04.03.2024", "11.03.2024", "12.03.2024", "13.03.2024", "")
        );

        ScheduleCaptures captures = extractor.extract(rows, "Rohan");

        assertThat(captures.headerDates())
                .containsExactly("04.03.2024", "05.03.2024", "06.03.2024", "07.03.2024", "08.03.2024");
        assertThat(captures.captures()).containsExactly(
                new ShiftCapture("Monday", new TimeRange("9:00", "17:00"), null, Set.of()));
    }

    @Test
    void missingDateRowYieldsEmptyDates() {
        ScheduleCaptures captures = extractor.extract(List.of(row("", "Rohan", "", "", "", "")), "Rohan");

        assertThat(captures.headerDates()).containsExactly("", "", "", "", "");
        assertThat(captures.captures()).isEmpty();
    }

    @Test
    void walkExposesFinalState() {
        List<GridRow> rows = List.of(
                row("Kitchen", "9:00-17:00", "9:00-17:00", "9:00-17:00", "", "")
        );

        ExtractorState state = extractor.walk(rows, "Rohan");

        assertThat(state.hasActiveShift()).isTrue();
        assertThat(state.currentArea()).isEqualTo("Kitchen");
        assertThat(state.lastTimeRanges()).hasSize(5);
    }

    private GridRow row(String area, String... cells) {
        return new GridRow(nextKey++, new ArrayList<>(List.of(cells)), area);
    }
}
