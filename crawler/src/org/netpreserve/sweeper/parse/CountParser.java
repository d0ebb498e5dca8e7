package org.netpreserve.sweeper.parse;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns displayed counts like "1.2万", "3,450" or "12.5K" into integers.
 */
public final class CountParser {
    private static final Logger log = LoggerFactory.getLogger(CountParser.class);
    private static final Pattern COUNT = Pattern.compile("^(\\d+(?:\\.\\d+)?)([万億KkMmGgBb]?)$");
    private static final Map<String, BigDecimal> SCALES = Map.of(
            "万", BigDecimal.valueOf(10_000),
            "億", BigDecimal.valueOf(100_000_000),
            "K", BigDecimal.valueOf(1_000),
            "M", BigDecimal.valueOf(1_000_000),
            "G", BigDecimal.valueOf(1_000_000_000),
            "B", BigDecimal.valueOf(1_000_000_000));

    private CountParser() {
    }

    /**
     * Parses a count. Fractions left over after scaling are truncated.
     *
     * @return empty if the text is absent or not a recognizable count
     */
    public static Optional<Long> parse(@Nullable String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String compact = text.replace(",", "").replaceAll("\\s+", "");
        var matcher = COUNT.matcher(compact);
        if (!matcher.matches()) {
            log.atWarn().addKeyValue("text", text).log("Unparseable count");
            return Optional.empty();
        }
        var value = new BigDecimal(matcher.group(1));
        String suffix = matcher.group(2);
        if (!suffix.isEmpty()) {
            value = value.multiply(SCALES.get(suffix.toUpperCase()));
        }
        try {
            return Optional.of(value.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            log.atWarn().addKeyValue("text", text).log("Count out of range");
            return Optional.empty();
        }
    }
}
