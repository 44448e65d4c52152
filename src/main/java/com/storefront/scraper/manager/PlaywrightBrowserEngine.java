package com.storefront.scraper.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import com.storefront.scraper.config.ScraperConfig;
import com.storefront.scraper.interfaces.BrowserEngine;
import com.storefront.scraper.interfaces.BrowserPage;
import com.storefront.scraper.model.ProxyEndpoint;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;

/**
 * Chromium through Playwright. Playwright objects are thread-confined, so every scrape worker
 * thread lazily gets its own driver and browser; pages get a fresh context each. A thread whose
 * browser disconnected closes its old driver before starting a new one.
 */
@Component
@Slf4j
public class PlaywrightBrowserEngine implements BrowserEngine {

    private final ScraperConfig scraperConfig;
    private final ObjectMapper objectMapper;
    private final Supplier<Playwright> driverFactory;

    private final Queue<Playwright> drivers = new ConcurrentLinkedQueue<>();
    private final ThreadLocal<Playwright> threadDriver = new ThreadLocal<>();
    private final ThreadLocal<Browser> browsers = new ThreadLocal<>();

    @Autowired
    public PlaywrightBrowserEngine(ScraperConfig scraperConfig, ObjectMapper objectMapper) {
        this(scraperConfig, objectMapper, Playwright::create);
    }

    PlaywrightBrowserEngine(ScraperConfig scraperConfig, ObjectMapper objectMapper,
                            Supplier<Playwright> driverFactory) {
        this.scraperConfig = scraperConfig;
        this.objectMapper = objectMapper;
        this.driverFactory = driverFactory;
    }

    @Override
    public BrowserPage openPage(ProxyEndpoint proxy) {
        Browser browser = browserForCurrentThread();
        BrowserContext context = browser.newContext(createContextOptions(proxy));
        try {
            return new PlaywrightBrowserPage(context, context.newPage(), objectMapper);
        } catch (RuntimeException e) {
            context.close();
            throw e;
        }
    }

    Browser.NewContextOptions createContextOptions(ProxyEndpoint proxy) {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
                .setViewportSize(scraperConfig.getDesktopViewportWidth(), scraperConfig.getDesktopViewportHeight())
                .setLocale("en-US")
                .setIgnoreHTTPSErrors(true)
                .setServiceWorkers(ServiceWorkerPolicy.BLOCK);

        if (proxy != null) {
            Proxy playwrightProxy = new Proxy(proxy.serverAddress());
            if (proxy.hasCredentials()) {
                playwrightProxy.setUsername(proxy.getUsername()).setPassword(proxy.getPassword());
            }
            options.setProxy(playwrightProxy);
            log.debug("Context routed through proxy {}", proxy.id());
        }
        return options;
    }

    private Browser browserForCurrentThread() {
        Browser browser = browsers.get();
        if (browser != null && browser.isConnected()) {
            return browser;
        }
        releaseThreadDriver();
        Playwright playwright = driverFactory.get();
        drivers.add(playwright);
        threadDriver.set(playwright);
        browser = launchBrowser(playwright);
        browsers.set(browser);
        log.info("Launched browser for thread {}", Thread.currentThread().getName());
        return browser;
    }

    private void releaseThreadDriver() {
        Playwright stale = threadDriver.get();
        browsers.remove();
        threadDriver.remove();
        if (stale == null) {
            return;
        }
        drivers.remove(stale);
        log.warn("Browser for thread {} disconnected, closing its driver", Thread.currentThread().getName());
        closeQuietly(stale);
    }

    int activeDrivers() {
        return drivers.size();
    }

    private void closeQuietly(Playwright pw) {
        try {
            pw.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close browser driver: {}", e.getMessage());
        }
    }

    private Browser launchBrowser(Playwright pw) {
        List<String> args = new ArrayList<>(scraperConfig.getBROWSER_FLAGS());
        return pw.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(scraperConfig.isHeadless())
                .setTimeout(scraperConfig.getLaunchTimeoutMs())
                .setArgs(args));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} browser driver(s)", drivers.size());
        Playwright pw;
        while ((pw = drivers.poll()) != null) {
            closeQuietly(pw);
        }
    }
}
