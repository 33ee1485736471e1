package com.eduhub.schema;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Year;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Optional;

/**
 * Strict ISO-8601 parser producing BSON dates.
 *
 * <p>Dates may be written in extended or basic format:
 * <ul>
 *   <li>calendar: {@code 2023}, {@code 2023-05}, {@code 2023-05-01}, {@code 20230501}</li>
 *   <li>week: {@code 2023-W18}, {@code 2023-W18-1}, {@code 2023W18}, {@code 2023W181}</li>
 *   <li>ordinal: {@code 2023-121}, {@code 2023121}</li>
 * </ul>
 * The year-only and year-month forms are only accepted on their own. A time follows the date after
 * any single separator character ({@code T} in the standard, often a space). It is written as
 * {@code hh}, {@code hh:mm} / {@code hhmm} or {@code hh:mm:ss} / {@code hhmmss}, the latter with an
 * optional fraction introduced by {@code '.'} or {@code ','} and truncated to microseconds.
 * {@code 24:00} denotes midnight of the following day. The time may end with {@code Z} or an offset
 * written {@code +hh:mm}, {@code +hhmm} or {@code +hh}.
 *
 * <p>Values without an offset are read as UTC. Surrounding whitespace is not accepted.
 */
public final class IsoDateParser {

    private static final char DATE_SEPARATOR = '-';
    private static final char TIME_SEPARATOR = ':';
    private static final char WEEK_DESIGNATOR = 'W';
    private static final int MICROSECOND_DIGITS = 6;
    private static final int END_OF_DAY_HOUR = 24;

    private IsoDateParser() {}

    public static Optional<Date> parse(String value) {
        return parseInstant(value).map(Date::from);
    }

    public static Optional<Instant> parseInstant(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Reader(value).readInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Cursor over the text being parsed. Grammar violations surface as {@link DateTimeParseException},
     * out-of-range fields as the {@link DateTimeException} raised by {@code java.time}.
     */
    private static final class Reader {

        private final String text;
        private int pos;

        Reader(String text) {
            this.text = text;
        }

        Instant readInstant() {
            LocalDate date = readDate();
            if (atEnd()) {
                return date.atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            pos++;
            return readTime(date);
        }

        private LocalDate readDate() {
            int[] calendarDate;
            try {
                calendarDate = readCalendarDate();
            } catch (DateTimeParseException e) {
                pos = 0;
                return readWeekOrOrdinalDate();
            }
            return date(calendarDate[0], calendarDate[1], calendarDate[2]);
        }

        private int[] readCalendarDate() {
            int year = readDigits(4);
            if (atEnd()) {
                return new int[] {year, 1, 1};
            }
            boolean extended = skip(DATE_SEPARATOR);
            int month = readDigits(2);
            if (atEnd()) {
                if (extended) {
                    return new int[] {year, month, 1};
                }
                throw error("Year and month need a separator");
            }
            if (extended && !skip(DATE_SEPARATOR)) {
                throw error("Expected '-' before the day");
            }
            int day = readDigits(2);
            return new int[] {year, month, day};
        }

        private LocalDate readWeekOrOrdinalDate() {
            int year = readDigits(4);
            boolean extended = skip(DATE_SEPARATOR);
            if (skip(WEEK_DESIGNATOR)) {
                int week = readDigits(2);
                int dayOfWeek = 1;
                if (!atEnd()) {
                    if ((peek() == DATE_SEPARATOR) != extended) {
                        throw error("Inconsistent use of '-' in week date");
                    }
                    if (extended) {
                        pos++;
                    }
                    if (!atEnd() && isDigit(peek())) {
                        dayOfWeek = peek() - '0';
                        pos++;
                    }
                }
                return weekDate(year, week, dayOfWeek);
            }
            int dayOfYear = readDigits(3);
            if (year < 1 || dayOfYear < 1 || dayOfYear > Year.of(year).length()) {
                throw error("Invalid ordinal day " + dayOfYear + " for year " + year);
            }
            return LocalDate.ofYearDay(year, dayOfYear);
        }

        private Instant readTime(LocalDate date) {
            if (text.length() - pos < 2) {
                throw error("Time is too short");
            }
            int[] fields = new int[3];
            int micros = 0;
            int offsetSeconds = 0;
            boolean colons = false;
            int component = -1;

            while (!atEnd() && component < 5) {
                component++;
                char c = peek();
                if (c == '+' || c == '-' || c == 'Z' || c == 'z') {
                    offsetSeconds = readOffset();
                    break;
                }
                if (component == 1 && c == TIME_SEPARATOR) {
                    colons = true;
                    pos++;
                } else if (component == 2 && colons) {
                    if (c != TIME_SEPARATOR) {
                        throw error("Inconsistent use of ':' in time");
                    }
                    pos++;
                }
                if (component < 3) {
                    fields[component] = readDigits(2);
                } else if (component == 3) {
                    micros = readFraction();
                }
            }
            if (!atEnd()) {
                throw error("Unexpected trailing characters");
            }

            LocalDateTime local;
            if (fields[0] == END_OF_DAY_HOUR) {
                if (fields[1] != 0 || fields[2] != 0 || micros != 0) {
                    throw error("Hour 24 is only valid as 24:00:00");
                }
                local = date.plusDays(1).atStartOfDay();
            } else {
                local = LocalDateTime.of(date, LocalTime.of(fields[0], fields[1], fields[2], micros * 1000));
            }
            return local.toInstant(ZoneOffset.UTC).minusSeconds(offsetSeconds);
        }

        private int readFraction() {
            if (atEnd() || (peek() != '.' && peek() != ',')
                    || pos + 1 >= text.length() || !isDigit(text.charAt(pos + 1))) {
                return 0;
            }
            pos++;
            int start = pos;
            while (!atEnd() && isDigit(peek())) {
                pos++;
            }
            String digits = text.substring(start, Math.min(pos, start + MICROSECOND_DIGITS));
            int micros = Integer.parseInt(digits);
            for (int i = digits.length(); i < MICROSECOND_DIGITS; i++) {
                micros *= 10;
            }
            return micros;
        }

        private int readOffset() {
            String zone = text.substring(pos);
            pos = text.length();
            if (zone.equals("Z") || zone.equals("z")) {
                return 0;
            }
            if (zone.length() != 3 && zone.length() != 5 && zone.length() != 6) {
                throw error("Offset must be 1, 3, 5 or 6 characters");
            }
            int sign;
            if (zone.charAt(0) == '+') {
                sign = 1;
            } else if (zone.charAt(0) == '-') {
                sign = -1;
            } else {
                throw error("Offset requires a sign");
            }
            int hours = digits(zone.substring(1, 3));
            int minutes = 0;
            if (zone.length() > 3) {
                minutes = digits(zone.substring(zone.charAt(3) == TIME_SEPARATOR ? 4 : 3));
            }
            if (minutes > 59 || hours > 23) {
                throw error("Offset out of range: " + zone);
            }
            return sign * (hours * 60 + minutes) * 60;
        }

        private static LocalDate date(int year, int month, int day) {
            if (year < 1) {
                throw new DateTimeException("Year must be positive: " + year);
            }
            return LocalDate.of(year, month, day);
        }

        private LocalDate weekDate(int year, int week, int dayOfWeek) {
            if (year < 1 || week < 1 || week > 53) {
                throw error("Invalid week " + week);
            }
            if (dayOfWeek < 1 || dayOfWeek > 7) {
                throw error("Invalid weekday " + dayOfWeek);
            }
            LocalDate fourthOfJanuary = LocalDate.of(year, 1, 4);
            return fourthOfJanuary
                    .minusDays(fourthOfJanuary.getDayOfWeek().getValue() - 1L)
                    .plusWeeks(week - 1L)
                    .plusDays(dayOfWeek - 1L);
        }

        private int readDigits(int count) {
            if (text.length() - pos < count) {
                throw error("Expected " + count + " digits");
            }
            int value = digits(text.substring(pos, pos + count));
            pos += count;
            return value;
        }

        private int digits(String part) {
            if (part.isEmpty() || !part.chars().allMatch(IsoDateParser::isDigit)) {
                throw error("Expected digits but found '" + part + "'");
            }
            return Integer.parseInt(part);
        }

        private boolean skip(char expected) {
            if (!atEnd() && peek() == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private char peek() {
            return text.charAt(pos);
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private DateTimeParseException error(String message) {
            return new DateTimeParseException(message, text, pos);
        }
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
