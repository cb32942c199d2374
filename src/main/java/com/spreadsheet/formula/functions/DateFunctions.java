package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FunctionArgumentException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;

/**
 * NOW, TODAY, DATE and DATEDIF. Dates are epoch-millisecond timestamps,
 * interpreted in the zone of the injected clock.
 */
final class DateFunctions {

    private static final long MILLIS_PER_DAY = 24L * 60 * 60 * 1000;

    private final Clock clock;

    DateFunctions(Clock clock) {
        this.clock = clock;
    }

    Object now(List<Object> args) {
        return (double) clock.millis();
    }

    // Local midnight of the current day
    Object today(List<Object> args) {
        LocalDate today = LocalDate.now(clock);
        return (double) today.atStartOfDay(clock.getZone()).toInstant().toEpochMilli();
    }

    // DATE(year, month, day); months and days past their range roll over, like DATE(2024, 13, 1) = 2025-01-01
    Object date(List<Object> args) {
        long year = (long) Arguments.number("DATE", args.get(0), "year");
        long month = (long) Arguments.number("DATE", args.get(1), "month");
        long day = (long) Arguments.number("DATE", args.get(2), "day");
        try {
            LocalDate date = LocalDate.of(Math.toIntExact(year), 1, 1)
                    .plusMonths(month - 1)
                    .plusDays(day - 1);
            return (double) date.atStartOfDay(clock.getZone()).toInstant().toEpochMilli();
        } catch (DateTimeException | ArithmeticException e) {
            throw new FunctionArgumentException("DATE", "date out of range: " + year + "-" + month + "-" + day);
        }
    }

    // DATEDIF(start, end, unit) with unit D, M or Y
    Object datedif(List<Object> args) {
        long start = (long) Arguments.number("DATEDIF", args.get(0), "start_date");
        long end = (long) Arguments.number("DATEDIF", args.get(1), "end_date");
        String unit = Arguments.text("DATEDIF", args.get(2), "unit").toUpperCase(Locale.ROOT);

        ZonedDateTime startDate = Instant.ofEpochMilli(start).atZone(clock.getZone());
        ZonedDateTime endDate = Instant.ofEpochMilli(end).atZone(clock.getZone());

        switch (unit) {
            case "D":
                return (double) Math.floorDiv(end - start, MILLIS_PER_DAY);
            case "M":
                return (double) ((endDate.getYear() - startDate.getYear()) * 12
                        + (endDate.getMonthValue() - startDate.getMonthValue()));
            case "Y":
                return (double) (endDate.getYear() - startDate.getYear());
            default:
                throw new FunctionArgumentException("DATEDIF", "Invalid unit: " + unit + ". Use D, M, or Y.");
        }
    }
}
