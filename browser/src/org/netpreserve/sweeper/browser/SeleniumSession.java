package org.netpreserve.sweeper.browser;

import org.netpreserve.sweeper.util.Url;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.remote.UnreachableBrowserException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

class SeleniumSession implements RenderSession {
    private static final Logger log = LoggerFactory.getLogger(SeleniumSession.class);
    private final WebDriver webDriver;
    private final Duration elementWait;
    private final Consumer<SeleniumSession> onClose;
    private volatile boolean closed;

    SeleniumSession(WebDriver webDriver, Duration elementWait, Consumer<SeleniumSession> onClose) {
        this.webDriver = webDriver;
        this.elementWait = elementWait;
        this.onClose = onClose;
    }

    @Override
    public PageHandle navigate(Url url) throws NavigationException {
        ensureOpen();
        log.debug("Nav to {}", url);
        try {
            webDriver.navigate().to(url.toString());
            // pages that set an explicit body width render the listing grid wrongly when scrolled
            eval("document.body.style.width=''");
            return current();
        } catch (TimeoutException e) {
            throw new NavigationTimedOutException(url, "Page load timed out", e);
        } catch (NoSuchSessionException | UnreachableBrowserException e) {
            throw new SessionLostException("Browser session lost navigating to " + url, e);
        } catch (WebDriverException e) {
            throw new NavigationFailedException(url, e.getRawMessage(), e);
        }
    }

    @Override
    public PageHandle scrollUntil(Predicate<RenderSession> condition, int maxIterations) throws NavigationException {
        ensureOpen();
        int stalled = 0;
        for (int i = 0; i < maxIterations; i++) {
            if (condition.test(this)) return current();
            long heightBefore = scrollHeight();
            try {
                eval("window.scrollTo({top: document.body.scrollHeight - 200, left: 0, behavior: 'smooth'})");
                new WebDriverWait(webDriver, elementWait).until(driver -> scrollHeight() > heightBefore);
                stalled = 0;
            } catch (TimeoutException e) {
                // the page didn't grow, give it one more chance before concluding we're at the end
                if (++stalled >= 2) {
                    log.debug("Page stopped growing after {} scroll steps", i + 1);
                    break;
                }
            } catch (NoSuchSessionException | UnreachableBrowserException e) {
                throw new SessionLostException("Browser session lost while scrolling", e);
            } catch (WebDriverException e) {
                throw new NavigationFailedException(currentUrl(), "Scrolling failed: " + e.getRawMessage(), e);
            }
        }
        return current();
    }

    @Override
    public PageHandle click(SelectorSpec selector, int index) throws NavigationException {
        ensureOpen();
        try {
            List<WebElement> elements = webDriver.findElements(By.cssSelector(selector.css()));
            if (index >= elements.size()) {
                throw new NavigationFailedException(currentUrl(), "No element " + index + " for " + selector +
                                                                  " (found " + elements.size() + ")");
            }
            ((JavascriptExecutor) webDriver).executeScript("arguments[0].click();", elements.get(index));
            return current();
        } catch (StaleElementReferenceException e) {
            throw new NavigationFailedException(currentUrl(), "Element went stale before click: " + selector, e);
        } catch (NoSuchSessionException | UnreachableBrowserException e) {
            throw new SessionLostException("Browser session lost while clicking " + selector, e);
        } catch (WebDriverException e) {
            throw new NavigationFailedException(currentUrl(), "Click failed: " + e.getRawMessage(), e);
        }
    }

    @Override
    public Optional<String> extractField(SelectorSpec selector) {
        ensureOpen();
        return read(webDriver, selector);
    }

    @Override
    public List<Element> findAll(SelectorSpec selector) {
        ensureOpen();
        try {
            var elements = new ArrayList<Element>();
            for (WebElement webElement : webDriver.findElements(By.cssSelector(selector.css()))) {
                elements.add(relative -> read(webElement, relative));
            }
            return elements;
        } catch (NoSuchSessionException | UnreachableBrowserException e) {
            throw new SessionLostException("Browser session lost", e);
        } catch (WebDriverException e) {
            throw new PageReadException("Unable to list " + selector + ": " + e.getRawMessage(), e);
        }
    }

    @Override
    public boolean waitFor(SelectorSpec selector, Duration timeout) {
        ensureOpen();
        try {
            new WebDriverWait(webDriver, timeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(selector.css())));
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (NoSuchSessionException | UnreachableBrowserException e) {
            throw new SessionLostException("Browser session lost", e);
        } catch (WebDriverException e) {
            throw new PageReadException("Unable to wait for " + selector + ": " + e.getRawMessage(), e);
        }
    }

    @Override
    public PageHandle current() {
        try {
            return new PageHandle(new Url(webDriver.getCurrentUrl()), webDriver.getTitle(), Instant.now());
        } catch (NoSuchSessionException | UnreachableBrowserException e) {
            throw new SessionLostException("Browser session lost", e);
        } catch (WebDriverException e) {
            throw new PageReadException("Unable to read current page: " + e.getRawMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        onClose.accept(this);
    }

    private static Optional<String> read(SearchContext context, SelectorSpec selector) {
        try {
            WebElement element;
            if (selector.css().equals(":scope") && context instanceof WebElement webElement) {
                element = webElement;
            } else {
                List<WebElement> found = context.findElements(By.cssSelector(selector.css()));
                if (found.isEmpty()) return Optional.empty();
                element = found.get(0);
            }
            String value = selector.readsText() ? element.getText() : element.getAttribute(selector.attribute());
            if (value == null || value.isBlank()) return Optional.empty();
            return Optional.of(value.strip());
        } catch (StaleElementReferenceException e) {
            log.debug("Stale element reading {}", selector);
            return Optional.empty();
        } catch (NoSuchSessionException | UnreachableBrowserException e) {
            throw new SessionLostException("Browser session lost", e);
        } catch (WebDriverException e) {
            throw new PageReadException("Unable to read " + selector + ": " + e.getRawMessage(), e);
        }
    }

    private Url currentUrl() {
        try {
            return new Url(webDriver.getCurrentUrl());
        } catch (WebDriverException e) {
            return null;
        }
    }

    private long scrollHeight() {
        Object height = eval("return document.body.scrollHeight;");
        return height instanceof Number number ? number.longValue() : 0;
    }

    private Object eval(String script) {
        return ((JavascriptExecutor) webDriver).executeScript(script);
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Session closed");
    }
}
