package io.pricelake.financial.ingest;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Trading-day calendars used to decide whether a fetch window can return data. FX pairs ({@code EURUSD=X})
 * trade on weekdays; everything else follows a simplified NYSE calendar.
 */
public final class TradingCalendars {
    private static final Map<Integer, Set<LocalDate>> NYSE_HOLIDAYS = new ConcurrentHashMap<>();

    private TradingCalendars() {}

    public static Predicate<LocalDate> forInstrument(String instrument) {
        return instrument.endsWith("=X") ? TradingCalendars::isWeekday : TradingCalendars::isUsEquityTradingDay;
    }

    public static boolean isWeekday(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    public static boolean isUsEquityTradingDay(LocalDate d) {
        return isWeekday(d) && !NYSE_HOLIDAYS.computeIfAbsent(d.getYear(), TradingCalendars::nyseHolidays).contains(d);
    }

    /** True when {@code [start, end]} contains at least one day accepted by {@code calendar}. */
    public static boolean hasTradingDay(LocalDate start, LocalDate end, Predicate<LocalDate> calendar) {
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            if (calendar.test(d)) return true;
        }
        return false;
    }

    // Fixed-date holidays move to Friday/Monday when they fall on a weekend; New Year's Day on a Saturday is not
    // observed on the preceding Friday.
    static Set<LocalDate> nyseHolidays(int year) {
        Set<LocalDate> days = new HashSet<>();
        LocalDate newYear = LocalDate.of(year, Month.JANUARY, 1);
        if (newYear.getDayOfWeek() != DayOfWeek.SATURDAY) days.add(observed(newYear));
        days.add(observed(LocalDate.of(year, Month.JUNE, 19)));
        days.add(observed(LocalDate.of(year, Month.JULY, 4)));
        days.add(observed(LocalDate.of(year, Month.DECEMBER, 25)));
        days.add(nth(year, Month.JANUARY, 3, DayOfWeek.MONDAY));
        days.add(nth(year, Month.FEBRUARY, 3, DayOfWeek.MONDAY));
        days.add(LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)));
        days.add(nth(year, Month.SEPTEMBER, 1, DayOfWeek.MONDAY));
        days.add(nth(year, Month.NOVEMBER, 4, DayOfWeek.THURSDAY));
        days.add(easterSunday(year).minusDays(2));
        return days;
    }

    private static LocalDate observed(LocalDate date) {
        return switch (date.getDayOfWeek()) {
            case SATURDAY -> date.minusDays(1);
            case SUNDAY -> date.plusDays(1);
            default -> date;
        };
    }

    private static LocalDate nth(int year, Month month, int n, DayOfWeek dow) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, dow));
    }

    // Anonymous Gregorian algorithm
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int h = (19 * a + b - b / 4 - (b - (b + 8) / 25 + 1) / 3 + 15) % 30;
        int l = (32 + 2 * (b % 4) + 2 * (c / 4) - h - c % 4) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = (h + l - 7 * m + 114) % 31 + 1;
        return LocalDate.of(year, month, day);
    }
}
