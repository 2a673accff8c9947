package com.marketscan.calendar;

/**
 * Classifies an entry on the NSE holiday list.
 *
 * <p>Only FULL_HOLIDAY closes the equity session. SETTLEMENT_HOLIDAY days trade normally; they
 * are listed so the calendar mirrors the exchange circular.
 */
public enum HolidayType {

    /** No trading at all. */
    FULL_HOLIDAY,

    /** Clearing is closed but the cash market trades. */
    SETTLEMENT_HOLIDAY
}
