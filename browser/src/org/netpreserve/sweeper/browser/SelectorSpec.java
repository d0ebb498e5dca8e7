package org.netpreserve.sweeper.browser;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifies a field on a rendered page: a CSS selector plus, optionally, the attribute to read. Without an
 * attribute the element's visible text is read.
 * <p>
 * The string form is {@code "css"} or {@code "css @attribute"}, e.g. {@code "a[href*='/video/'] @href"}.
 *
 * @param css       CSS selector
 * @param attribute attribute name, or null for the element text
 */
public record SelectorSpec(@NotNull String css, @Nullable String attribute) {
    private static final Pattern ATTRIBUTE_SUFFIX = Pattern.compile("^(.*\\S)\\s+@([\\w-]+)$");

    public SelectorSpec {
        Objects.requireNonNull(css, "css");
        if (css.isBlank()) throw new IllegalArgumentException("blank css selector");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SelectorSpec parse(String spec) {
        var matcher = ATTRIBUTE_SUFFIX.matcher(spec.strip());
        if (matcher.matches()) {
            return new SelectorSpec(matcher.group(1), matcher.group(2));
        }
        return new SelectorSpec(spec.strip(), null);
    }

    public static SelectorSpec text(String css) {
        return new SelectorSpec(css, null);
    }

    public static SelectorSpec attribute(String css, String attribute) {
        return new SelectorSpec(css, attribute);
    }

    public boolean readsText() {
        return attribute == null;
    }

    @JsonValue
    @Override
    public String toString() {
        return attribute == null ? css : css + " @" + attribute;
    }
}
