package com.marketscan.calendar;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Service;

/**
 * Market hours awareness for the scan loop.
 *
 * <p>The equity session runs from {@code sessionOpen} (inclusive) to {@code sessionClose}
 * (exclusive) in the exchange time zone, Monday to Friday, except on configured full holidays.
 * Instants from any zone are converted to exchange time first.
 */
@Service
public class TradingCalendarService {

    private final HolidayCalendarConfig holidayCalendarConfig;
    private final Clock clock;
    private final ZoneId exchangeZone;

    public TradingCalendarService(HolidayCalendarConfig holidayCalendarConfig, Clock clock) {
        this.holidayCalendarConfig = holidayCalendarConfig;
        this.clock = clock;
        this.exchangeZone = ZoneId.of(holidayCalendarConfig.getTimezone());
    }

    /** True while the regular session is open right now. */
    public boolean isMarketOpen() {
        return isMarketOpen(ZonedDateTime.now(clock));
    }

    public boolean isMarketOpen(ZonedDateTime instant) {
        ZonedDateTime local = instant.withZoneSameInstant(exchangeZone);
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(holidayCalendarConfig.getSessionOpen())
                && time.isBefore(holidayCalendarConfig.getSessionClose());
    }

    /**
     * Checks if a date is a non-trading day (weekend or full holiday).
     * Weekends (Saturday/Sunday) are always holidays.
     */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.FULL_HOLIDAY);
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date);
    }

    /** Returns the next trading day after the given date. */
    public LocalDate getNextTradingDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isTradingDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /** Current date in the exchange time zone, used for daily risk rollover. */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(exchangeZone));
    }

    public ZoneId getExchangeZone() {
        return exchangeZone;
    }
}
