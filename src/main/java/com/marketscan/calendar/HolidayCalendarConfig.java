package com.marketscan.calendar;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

/**
 * NSE session hours and holiday list, bound from the {@code trading-calendar} block of
 * application.yml. Session times are exchange-local ({@link #timezone}).
 *
 * <p>The holiday list is refreshed each year from the exchange's published calendar; an entry
 * without a type closes the market for the whole day.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String timezone = "Asia/Kolkata";

    @DateTimeFormat(pattern = "HH:mm")
    private LocalTime sessionOpen = LocalTime.of(9, 15);

    /** Exclusive: a tick stamped exactly at the close is outside the session. */
    @DateTimeFormat(pattern = "HH:mm")
    private LocalTime sessionClose = LocalTime.of(15, 30);

    private List<Holiday> holidays = new ArrayList<>();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Holiday {

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;

        private String name;
        private HolidayType type = HolidayType.FULL_HOLIDAY;
    }
}
