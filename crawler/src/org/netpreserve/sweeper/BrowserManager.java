package org.netpreserve.sweeper;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sweeper.browser.RenderSession;
import org.netpreserve.sweeper.browser.SeleniumBrowser;
import org.netpreserve.sweeper.config.BrowserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Owns one worker's browser. The browser is started on first use and started again if it has died or its session
 * was lost.
 */
public class BrowserManager implements SessionProvider, Closeable {
    private static final Logger log = LoggerFactory.getLogger(BrowserManager.class);
    private final BrowserConfig config;
    private final @Nullable Path profileDir;
    private SeleniumBrowser browser;

    public BrowserManager(BrowserConfig config, @Nullable Path profileDir) {
        this.config = config;
        this.profileDir = profileDir;
    }

    @Override
    public synchronized RenderSession acquire() throws IOException {
        if (browser != null && !browser.isAlive()) {
            log.warn("Browser is gone, restarting it");
            stop();
        }
        if (browser == null) {
            log.atInfo().addKeyValue("profileDir", profileDir).log("Starting browser");
            browser = SeleniumBrowser.start(config.executable(), config.effectiveOptions(), profileDir,
                    config.pageLoadTimeout(), config.elementWait());
        }
        return browser.acquire();
    }

    @Override
    public synchronized void reset() {
        log.warn("Discarding browser after lost session");
        stop();
    }

    private void stop() {
        if (browser == null) return;
        try {
            browser.close();
        } finally {
            browser = null;
        }
    }

    @Override
    public synchronized void close() {
        stop();
    }
}
