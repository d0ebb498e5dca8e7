package org.netpreserve.sweeper.browser;

import org.jetbrains.annotations.Nullable;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.SessionNotCreatedException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.logging.Level;

/**
 * A Chrome instance driven through Selenium. Hands out at most one {@link RenderSession} at a time.
 */
public class SeleniumBrowser implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowser.class);
    private final ChromeDriver webDriver;
    private final Duration pageLoadTimeout;
    private final Duration elementWait;
    private SeleniumSession activeSession;

    static {
        // suppress noisy selenium logging
        java.util.logging.Logger.getLogger("org.openqa.selenium").setLevel(Level.WARNING);
    }

    private SeleniumBrowser(ChromeDriver webDriver, Duration pageLoadTimeout, Duration elementWait) {
        this.webDriver = webDriver;
        this.pageLoadTimeout = pageLoadTimeout;
        this.elementWait = elementWait;
    }

    /**
     * Starts a new browser.
     *
     * @param executable      Chrome binary, or null to let Selenium locate one
     * @param options         extra command-line options
     * @param profileDir      user data directory (keeps cookies between runs), or null for a throwaway profile
     * @param pageLoadTimeout how long a navigation may take before it is reported as timed out
     * @param elementWait     how long to wait for elements to appear after a navigation or scroll step
     */
    public static SeleniumBrowser start(@Nullable String executable, List<String> options, @Nullable Path profileDir,
                                        Duration pageLoadTimeout, Duration elementWait) throws IOException {
        var chromeOptions = new ChromeOptions();
        if (executable != null) chromeOptions.setBinary(executable);
        if (options != null) chromeOptions.addArguments(options);
        if (profileDir != null) chromeOptions.addArguments("--user-data-dir=" + profileDir.toAbsolutePath());
        try {
            var webDriver = new ChromeDriver(chromeOptions);
            webDriver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
            log.info("Started browser {}", webDriver.getCapabilities().getBrowserVersion());
            return new SeleniumBrowser(webDriver, pageLoadTimeout, elementWait);
        } catch (SessionNotCreatedException e) {
            throw new IOException("Unable to start browser: " + e.getMessage(), e);
        }
    }

    /**
     * Acquires the browser's session. The session must be closed before another one can be acquired.
     *
     * @throws IllegalStateException if a session is already active
     */
    public synchronized RenderSession acquire() {
        if (activeSession != null) throw new IllegalStateException("Browser session already in use");
        activeSession = new SeleniumSession(webDriver, elementWait, this::release);
        return activeSession;
    }

    private synchronized void release(SeleniumSession session) {
        if (activeSession == session) activeSession = null;
    }

    public Duration pageLoadTimeout() {
        return pageLoadTimeout;
    }

    public boolean isAlive() {
        try {
            webDriver.getWindowHandle();
            return true;
        } catch (NoSuchSessionException e) {
            return false;
        } catch (WebDriverException e) {
            log.debug("Browser liveness check failed", e);
            return false;
        }
    }

    @Override
    public void close() {
        log.debug("Closing web driver");
        try {
            webDriver.quit();
        } catch (NoSuchSessionException e) {
            // already gone
        }
    }
}
