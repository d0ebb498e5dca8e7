package org.netpreserve.sweeper.parse;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves displayed publication times against a base time. Understands relative text ("3時間前", "2 days ago",
 * "5h ago") and two absolute forms: "M-D" within the last year and "YYYY-M-D". Dates take the base time's hour and
 * minute in the base time's zone.
 */
public final class TimeTextParser {
    private static final Logger log = LoggerFactory.getLogger(TimeTextParser.class);
    private static final Pattern JAPANESE_RELATIVE = Pattern.compile("^(\\d+)\\s*(秒|分|時間|日|週間)前$");
    private static final Pattern ENGLISH_RELATIVE = Pattern.compile(
            "^(\\d+)\\s*(s|sec|secs|seconds?|m|min|mins|minutes?|h|hr|hrs|hours?|d|days?|w|wk|weeks?)\\s+ago$");
    private static final Pattern MONTH_DAY = Pattern.compile("^(\\d{1,2})-(\\d{1,2})$");
    private static final Pattern YEAR_MONTH_DAY = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");

    private TimeTextParser() {
    }

    /**
     * @return empty if the text is absent or in no recognized format
     */
    public static Optional<Instant> parse(@Nullable String text, ZonedDateTime base) {
        if (text == null || text.isBlank()) return Optional.empty();
        String trimmed = text.strip().toLowerCase(Locale.ROOT);
        try {
            Matcher m;
            if ((m = JAPANESE_RELATIVE.matcher(trimmed)).matches()) {
                return Optional.of(base.minus(Long.parseLong(m.group(1)), japaneseUnit(m.group(2))).toInstant());
            }
            if ((m = ENGLISH_RELATIVE.matcher(trimmed)).matches()) {
                return Optional.of(base.minus(Long.parseLong(m.group(1)), englishUnit(m.group(2))).toInstant());
            }
            if ((m = MONTH_DAY.matcher(trimmed)).matches()) {
                var monthDay = MonthDay.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
                int year = monthDay.isAfter(MonthDay.from(base)) ? base.getYear() - 1 : base.getYear();
                var date = LocalDate.of(year, monthDay.getMonthValue(), monthDay.getDayOfMonth());
                return Optional.of(atBaseTimeOfDay(date, base));
            }
            if ((m = YEAR_MONTH_DAY.matcher(trimmed)).matches()) {
                var date = LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(3)));
                return Optional.of(atBaseTimeOfDay(date, base));
            }
        } catch (DateTimeException | ArithmeticException e) {
            log.atWarn().addKeyValue("text", text).log("Invalid date: {}", e.getMessage());
            return Optional.empty();
        }
        log.atWarn().addKeyValue("text", text).log("Unparseable time text");
        return Optional.empty();
    }

    private static Instant atBaseTimeOfDay(LocalDate date, ZonedDateTime base) {
        return date.atTime(base.getHour(), base.getMinute()).atZone(base.getZone()).toInstant();
    }

    private static ChronoUnit japaneseUnit(String unit) {
        return switch (unit) {
            case "秒" -> ChronoUnit.SECONDS;
            case "分" -> ChronoUnit.MINUTES;
            case "時間" -> ChronoUnit.HOURS;
            case "日" -> ChronoUnit.DAYS;
            case "週間" -> ChronoUnit.WEEKS;
            default -> throw new IllegalArgumentException(unit);
        };
    }

    private static ChronoUnit englishUnit(String unit) {
        return switch (unit.charAt(0)) {
            case 's' -> ChronoUnit.SECONDS;
            case 'm' -> ChronoUnit.MINUTES;
            case 'h' -> ChronoUnit.HOURS;
            case 'd' -> ChronoUnit.DAYS;
            case 'w' -> ChronoUnit.WEEKS;
            default -> throw new IllegalArgumentException(unit);
        };
    }
}
