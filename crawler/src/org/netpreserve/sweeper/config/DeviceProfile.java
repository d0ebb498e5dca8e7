package org.netpreserve.sweeper.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Kind of machine the browser runs on. A desktop gets a visible window, a server runs headless.
 */
public enum DeviceProfile {
    PC(List.of("--window-size=1280,960")),
    VPS(List.of("--headless=new", "--disable-gpu", "--no-sandbox", "--disable-dev-shm-usage",
            "--window-size=1280,960"));

    private final List<String> browserOptions;

    DeviceProfile(List<String> browserOptions) {
        this.browserOptions = browserOptions;
    }

    public List<String> browserOptions() {
        return browserOptions;
    }

    @JsonCreator
    public static DeviceProfile fromString(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
