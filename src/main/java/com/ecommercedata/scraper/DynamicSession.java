package com.ecommercedata.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Playwright-backed browser session for review pages that only render with scripts enabled.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Launches headless Chromium with sandbox and GPU disabled, one context, one page.</li>
 *   <li>Navigates and waits for a content marker; a missing marker is logged, not thrown.</li>
 *   <li>Hands the rendered HTML to Jsoup so extraction is shared with static pages.</li>
 *   <li>Releases page, browser and driver on close, even when one of them fails to close.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>Launch failures and a dead browser raise {@link DriverException}.</li>
 *   <li>Navigation failures on a live browser raise {@link NetworkException}.</li>
 * </ul>
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class DynamicSession implements DynamicSessionInterface {
    private static final Logger logger = LoggerFactory.getLogger(DynamicSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final Page page;
    private final BrowserSettings settings;
    private boolean markerFound;
    private boolean closed;

    DynamicSession(Playwright playwright, Browser browser, Page page, BrowserSettings settings) {
        this.playwright = playwright;
        this.browser = browser;
        this.page = page;
        this.settings = settings;
    }

    /**
     * Launches a browser and opens a blank page.
     *
     * @throws DriverException when Playwright or Chromium cannot be started
     */
    public static DynamicSession open(BrowserSettings settings) throws DriverException {
        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (PlaywrightException e) {
            throw new DriverException("Playwright initialization failed: " + e.getMessage(), e);
        }
        try {
            Browser browser = playwright.chromium().launch(launchOptions(settings));
            Page page = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(settings.userAgent())
                    .setViewportSize(1920, 1080))
                .newPage();
            page.setDefaultNavigationTimeout(settings.navigationTimeout().toMillis());
            logger.info("Browser session started (headless={})", settings.headless());
            return new DynamicSession(playwright, browser, page, settings);
        } catch (PlaywrightException e) {
            try {
                playwright.close();
            } catch (PlaywrightException closeError) {
                e.addSuppressed(closeError);
            }
            throw new DriverException("Error launching browser: " + e.getMessage(), e);
        }
    }

    private static BrowserType.LaunchOptions launchOptions(BrowserSettings settings) {
        return new BrowserType.LaunchOptions()
            .setHeadless(settings.headless())
            .setArgs(Arrays.asList(
                "--no-sandbox",
                "--disable-dev-shm-usage",
                "--disable-gpu",
                "--window-size=1920,1080",
                "--lang=en-US"
            ));
    }

    @Override
    public boolean navigate(String url, String markerSelector) throws NetworkException, DriverException {
        ensureOpen();
        markerFound = false;
        try {
            page.navigate(url, new Page.NavigateOptions().setTimeout(settings.navigationTimeout().toMillis()));
        } catch (PlaywrightException e) {
            rethrow(url, "navigation", e);
        }
        try {
            page.waitForSelector(markerSelector,
                new Page.WaitForSelectorOptions().setTimeout(settings.markerTimeout().toMillis()));
            markerFound = true;
        } catch (TimeoutError e) {
            logger.warn("Marker '{}' not found on {} within {} ms", markerSelector, url, settings.markerTimeout().toMillis());
        } catch (PlaywrightException e) {
            rethrow(url, "marker wait", e);
        }
        return markerFound;
    }

    @Override
    public Document render() throws DriverException {
        ensureOpen();
        try {
            if (!markerFound) {
                return Document.createShell(page.url());
            }
            return Jsoup.parse(page.content(), page.url());
        } catch (PlaywrightException e) {
            throw new DriverException("Could not read rendered page: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly("page", page::close);
        closeQuietly("browser", browser::close);
        closeQuietly("playwright", playwright::close);
        logger.info("Browser session closed");
    }

    /**
     * Throws {@link DriverException} when the browser is gone, otherwise a page-level
     * {@link NetworkException}.
     */
    private void rethrow(String url, String action, PlaywrightException e) throws NetworkException, DriverException {
        if (browserGone()) {
            throw new DriverException("Browser died during " + action + " of " + url + ": " + e.getMessage(), e);
        }
        throw new NetworkException(url, NetworkException.NO_STATUS, false, 1,
            "Browser " + action + " failed for " + url + ": " + e.getMessage(), e);
    }

    private boolean browserGone() {
        try {
            return page.isClosed() || !browser.isConnected();
        } catch (PlaywrightException e) {
            return true;
        }
    }

    private void ensureOpen() throws DriverException {
        if (closed) {
            throw new DriverException("Browser session is already closed", null);
        }
    }

    private static void closeQuietly(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.warn("Failed to close {}: {}", what, e.getMessage());
        }
    }
}
