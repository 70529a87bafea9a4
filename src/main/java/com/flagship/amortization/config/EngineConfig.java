package com.flagship.amortization.config;

import com.flagship.amortization.calendar.HolidayCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine options and the holiday calendar from {@link EngineProperties}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
@Slf4j
public class EngineConfig {

    @Bean
    public EngineSettings engineSettings(EngineProperties properties) {
        EngineSettings settings = properties.toSettings();
        log.info("Amortization engine configured: roundingMode={}, dueDateAdjustment={}, billableDays={}",
            settings.getRoundingMode(), settings.getDueDateAdjustment(), settings.getBillableDaysConvention());
        return settings;
    }

    @Bean
    public HolidayCalendar holidayCalendar(EngineProperties properties) {
        HolidayCalendar calendar = properties.toCalendar();
        log.info("Holiday calendar configured: fixedHolidays={}, moveableHolidays={}",
            calendar.getFixedHolidays().size(), calendar.getMoveableHolidays());
        return calendar;
    }
}
