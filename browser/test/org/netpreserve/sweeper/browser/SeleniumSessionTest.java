package org.netpreserve.sweeper.browser;

import org.junit.jupiter.api.Test;
import org.openqa.selenium.JavascriptException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SeleniumSessionTest {
    private static final SelectorSpec HEADING = SelectorSpec.text("h1");

    /**
     * A driver whose element lookups and scripts all fail with {@code error}.
     */
    private static WebDriver driverFailingWith(RuntimeException error) {
        InvocationHandler handler = (proxy, method, args) -> switch (method.getName()) {
            case "findElement", "findElements", "executeScript" -> throw error;
            case "getCurrentUrl" -> "https://www.example.com/@someone";
            case "getTitle" -> "someone";
            case "hashCode" -> System.identityHashCode(proxy);
            case "equals" -> proxy == args[0];
            case "toString" -> "driver failing with " + error;
            default -> null;
        };
        return (WebDriver) Proxy.newProxyInstance(SeleniumSessionTest.class.getClassLoader(),
                new Class<?>[]{WebDriver.class, JavascriptExecutor.class}, handler);
    }

    private static SeleniumSession session(WebDriver driver) {
        return new SeleniumSession(driver, Duration.ofMillis(100), s -> {});
    }

    @Test
    public void rejectedReadsArePageReadErrors() {
        var session = session(driverFailingWith(new WebDriverException("detached frame")));
        var e = assertThrows(PageReadException.class, () -> session.extractField(HEADING));
        assertTrue(e.getMessage().contains("detached frame"));
        assertThrows(PageReadException.class, () -> session.findAll(HEADING));
        assertThrows(PageReadException.class, () -> session.waitFor(HEADING, Duration.ofMillis(100)));
    }

    @Test
    public void scriptErrorOnClickIsNavigationFailure() {
        var session = session(driverFailingWith(new JavascriptException("tile is not clickable")));
        var e = assertThrows(NavigationFailedException.class, () -> session.click(HEADING, 0));
        assertEquals("https://www.example.com/@someone", e.url().toString());
    }

    @Test
    public void lostSessionIsStillSessionLoss() {
        var session = session(driverFailingWith(new NoSuchSessionException("invalid session id")));
        assertThrows(SessionLostException.class, () -> session.extractField(HEADING));
        assertThrows(SessionLostException.class, () -> session.findAll(HEADING));
        assertThrows(SessionLostException.class, () -> session.waitFor(HEADING, Duration.ofMillis(100)));
    }

    @Test
    public void currentPageIsReadFromTheDriver() {
        var page = session(driverFailingWith(new WebDriverException("unused"))).current();
        assertEquals("https://www.example.com/@someone", page.url().toString());
        assertEquals("someone", page.title());
    }
}
