package com.example.timesheet.config;

import com.example.timesheet.application.parser.WeeklyScheduleParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free schedule parser into the Spring context.
 */
@Configuration
@EnableConfigurationProperties(TimesheetProperties.class)
public class TimesheetConfig {

    @Bean
    public WeeklyScheduleParser weeklyScheduleParser(TimesheetProperties properties) {
        return new WeeklyScheduleParser(properties.toGridSettings());
    }
}
