package org.netpreserve.sweeper.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.util.DurationDeserializer;
import org.netpreserve.sweeper.util.ShellCommandDeserializer;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the rendering browser.
 *
 * @param executable      binary to invoke (e.g. "google-chrome-stable"), or null to let the driver find one
 * @param profile         device profile, selects the default set of command-line options
 * @param options         additional command-line options
 * @param profileDir      directory holding the logged-in browser profile, relative to the job directory
 * @param pageLoadTimeout how long a navigation may take
 * @param elementWait     how long to wait for elements to appear
 */
public record BrowserConfig(
        @Nullable String executable,
        DeviceProfile profile,
        @JsonDeserialize(using = ShellCommandDeserializer.class)
        List<String> options,
        @Nullable String profileDir,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration pageLoadTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration elementWait
) {
    public List<String> effectiveOptions() {
        var effective = new ArrayList<String>();
        if (profile != null) effective.addAll(profile.browserOptions());
        if (options != null) effective.addAll(options);
        return effective;
    }

    /**
     * Profile directory for the given worker. Each worker needs its own since Chrome locks the directory.
     */
    public @Nullable Path profileDirFor(Path jobDir, int workerIndex) {
        if (profileDir == null) return null;
        Path dir = jobDir.resolve(profileDir);
        return workerIndex == 0 ? dir : dir.resolveSibling(dir.getFileName() + "-" + workerIndex);
    }

    public BrowserConfig withProfile(DeviceProfile profile) {
        return new BrowserConfig(executable, profile, options, profileDir, pageLoadTimeout, elementWait);
    }
}
