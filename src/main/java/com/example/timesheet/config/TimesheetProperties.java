package com.example.timesheet.config;

import com.example.timesheet.application.parser.GridSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Binds the {@code timesheet.*} properties: whose schedule to read and how the timesheet grid looks.
 */
@ConfigurationProperties(prefix = "timesheet")
public class TimesheetProperties {

    private String targetName = "Rohan";
    private List<String> weekdays = new ArrayList<>(GridSettings.DEFAULT_WEEKDAYS);
    private String datePattern = GridSettings.DEFAULT_DATE_PATTERN;
    private String timeRangePattern = GridSettings.DEFAULT_TIME_RANGE_PATTERN;
    private String weekEndingPattern = GridSettings.DEFAULT_WEEK_ENDING_PATTERN;
    private List<String> flagMarkers = new ArrayList<>(List.of("ATM"));
    private int minDateCells = 4;
    private int minTimeCells = 3;

    /**
     * @return grid settings with the patterns compiled
     * @throws java.util.regex.PatternSyntaxException when a configured pattern is invalid
     */
    public GridSettings toGridSettings() {
        return new GridSettings(
                weekdays,
                Pattern.compile(datePattern),
                Pattern.compile(timeRangePattern),
                Pattern.compile(weekEndingPattern),
                flagMarkers,
                minDateCells,
                minTimeCells
        );
    }

    public String getTargetName() {
        return targetName;
    }

    public void setTargetName(String targetName) {
        this.targetName = targetName;
    }

    public List<String> getWeekdays() {
        return weekdays;
    }

    public void setWeekdays(List<String> weekdays) {
        this.weekdays = weekdays;
    }

    public String getDatePattern() {
        return datePattern;
    }

    public void setDatePattern(String datePattern) {
        this.datePattern = datePattern;
    }

    public String getTimeRangePattern() {
        return timeRangePattern;
    }

    public void setTimeRangePattern(String timeRangePattern) {
        this.timeRangePattern = timeRangePattern;
    }

    public String getWeekEndingPattern() {
        return weekEndingPattern;
    }

    public void setWeekEndingPattern(String weekEndingPattern) {
        this.weekEndingPattern = weekEndingPattern;
    }

    public List<String> getFlagMarkers() {
        return flagMarkers;
    }

    public void setFlagMarkers(List<String> flagMarkers) {
        this.flagMarkers = flagMarkers;
    }

    public int getMinDateCells() {
        return minDateCells;
    }

    public void setMinDateCells(int minDateCells) {
        this.minDateCells = minDateCells;
    }

    public int getMinTimeCells() {
        return minTimeCells;
    }

    public void setMinTimeCells(int minTimeCells) {
        this.minTimeCells = minTimeCells;
    }
}
