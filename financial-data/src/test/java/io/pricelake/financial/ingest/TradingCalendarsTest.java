package io.pricelake.financial.ingest;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TradingCalendarsTest {
    @Test
    void knowsNyseHolidays() {
        assertFalse(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2024, 1, 1)));   // New Year
        assertFalse(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2024, 1, 15)));  // MLK
        assertFalse(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2024, 3, 29)));  // Good Friday
        assertFalse(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2024, 5, 27)));  // Memorial Day
        assertFalse(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2024, 11, 28))); // Thanksgiving
        assertFalse(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2021, 7, 5)));   // July 4th observed
        assertTrue(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2024, 1, 2)));
        assertTrue(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2021, 12, 31)));  // New Year 2022 on a Saturday
    }

    @Test
    void easterDates() {
        assertEquals(LocalDate.of(2024, 3, 31), TradingCalendars.easterSunday(2024));
        assertEquals(LocalDate.of(2025, 4, 20), TradingCalendars.easterSunday(2025));
    }

    @Test
    void fxCalendarIsWeekdays() {
        assertTrue(TradingCalendars.forInstrument("USDCNY=X").test(LocalDate.of(2024, 1, 1)));
        assertFalse(TradingCalendars.forInstrument("USDCNY=X").test(LocalDate.of(2024, 1, 6)));
    }
}
