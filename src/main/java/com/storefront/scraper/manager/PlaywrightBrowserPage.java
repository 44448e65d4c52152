package com.storefront.scraper.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import com.microsoft.playwright.options.ViewportSize;
import com.microsoft.playwright.options.WaitUntilState;
import com.storefront.scraper.enums.FailureKind;
import com.storefront.scraper.exception.NavigationException;
import com.storefront.scraper.exception.ScrapeAttemptException;
import com.storefront.scraper.interfaces.BrowserPage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class PlaywrightBrowserPage implements BrowserPage {

    private static final String IDENTITY_SCRIPT = """
            Object.defineProperty(navigator, 'userAgent', { get: () => %s, configurable: true });
            Object.defineProperty(navigator, 'appVersion', { get: () => %s.replace(/^Mozilla\\//, ''), configurable: true });
            """;

    private final BrowserContext context;
    private final Page page;
    private final ObjectMapper objectMapper;
    private final Map<String, String> headers = new HashMap<>();
    private final List<Map<String, Object>> captured = Collections.synchronizedList(new ArrayList<>());

    PlaywrightBrowserPage(BrowserContext context, Page page, ObjectMapper objectMapper) {
        this.context = context;
        this.page = page;
        this.objectMapper = objectMapper;
    }

    @Override
    public void setViewport(int width, int height) {
        page.setViewportSize(width, height);
    }

    @Override
    public void setIdentity(String userAgent) {
        headers.put("User-Agent", userAgent);
        context.setExtraHTTPHeaders(headers);
        String quoted = quote(userAgent);
        context.addInitScript(String.format(IDENTITY_SCRIPT, quoted, quoted));
    }

    @Override
    public void setHeaders(Map<String, String> extra) {
        headers.putAll(extra);
        context.setExtraHTTPHeaders(headers);
    }

    @Override
    public void injectPreNavigationOverrides(String script) {
        context.addInitScript(script);
    }

    @Override
    public void navigate(String url, int timeoutMs) {
        Response response;
        try {
            response = page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(timeoutMs)
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        } catch (TimeoutError e) {
            throw e;
        } catch (PlaywrightException e) {
            throw new NavigationException("Navigation to " + url + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            return;
        }
        int status = response.status();
        if (status == 403 || status == 401) {
            throw new ScrapeAttemptException(FailureKind.BLOCKED, "Access blocked with HTTP " + status);
        }
        if (status == 404) {
            throw new ScrapeAttemptException(FailureKind.NOT_FOUND, "Page not found: " + url);
        }
        if (status == 429) {
            throw new ScrapeAttemptException(FailureKind.RATE_LIMIT, "Rate limited by target (HTTP 429)");
        }
        log.debug("Navigated to {} | status={}", url, status);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> runQuery(String script) {
        Object result = page.evaluate(script);
        if (result instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        return new LinkedHashMap<>();
    }

    @Override
    public Object evaluate(String script, Object arg) {
        return page.evaluate(script, arg);
    }

    @Override
    public void movePointer(double x, double y) {
        page.mouse().move(x, y);
    }

    @Override
    public void scrollBy(int deltaY) {
        page.mouse().wheel(0, deltaY);
    }

    @Override
    public void focus(String selector) {
        page.focus(selector);
    }

    @Override
    public void typeCharacter(String character) {
        page.keyboard().type(character);
    }

    @Override
    public void pressKey(String key) {
        page.keyboard().press(key);
    }

    @Override
    public int countElements(String selector) {
        return page.locator(selector).count();
    }

    @Override
    public void hover(String selector, int index) {
        page.locator(selector).nth(index).hover(new Locator.HoverOptions().setTimeout(2_000));
    }

    @Override
    public int[] viewport() {
        ViewportSize size = page.viewportSize();
        return size == null ? new int[]{1366, 768} : new int[]{size.width, size.height};
    }

    @Override
    public List<Map<String, Object>> cookies() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Cookie c : context.cookies()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", c.name);
            m.put("value", c.value);
            m.put("domain", c.domain);
            m.put("path", c.path);
            m.put("expires", c.expires);
            m.put("httpOnly", c.httpOnly);
            m.put("secure", c.secure);
            if (c.sameSite != null) m.put("sameSite", c.sameSite.name());
            out.add(m);
        }
        return out;
    }

    @Override
    public void addCookies(List<Map<String, Object>> cookies) {
        List<Cookie> converted = new ArrayList<>();
        for (Map<String, Object> m : cookies) {
            Object name = m.get("name");
            Object value = m.get("value");
            Object domain = m.get("domain");
            if (name == null || value == null || domain == null) {
                continue;
            }
            Cookie cookie = new Cookie(name.toString(), value.toString())
                    .setDomain(domain.toString())
                    .setPath(m.getOrDefault("path", "/").toString());
            if (m.get("expires") instanceof Number n) cookie.setExpires(n.doubleValue());
            if (m.get("httpOnly") instanceof Boolean b) cookie.setHttpOnly(b);
            if (m.get("secure") instanceof Boolean b) cookie.setSecure(b);
            if (m.get("sameSite") != null) {
                cookie.setSameSite(SameSiteAttribute.valueOf(m.get("sameSite").toString().toUpperCase(Locale.ROOT)));
            }
            converted.add(cookie);
        }
        if (!converted.isEmpty()) {
            context.addCookies(converted);
        }
    }

    @Override
    public void enableResponseCapture(String urlFragment) {
        page.onResponse(resp -> {
            String type = resp.request().resourceType();
            if (!"xhr".equals(type) && !"fetch".equals(type)) {
                return;
            }
            log.debug("API call: {} {}", resp.request().method(), resp.url());
            String contentType = resp.headers().getOrDefault("content-type", "");
            if (!resp.url().contains(urlFragment) || !contentType.contains("json")) {
                return;
            }
            try {
                Map<String, Object> body = objectMapper.readValue(resp.text(), new TypeReference<>() {});
                body.put("_url", resp.url());
                captured.add(body);
            } catch (Exception e) {
                log.debug("Could not parse API response {}: {}", resp.url(), e.getMessage());
            }
        });
    }

    @Override
    public List<Map<String, Object>> capturedResponses() {
        synchronized (captured) {
            return List.copyOf(captured);
        }
    }

    @Override
    public void close() {
        safeClose(page::close);
        safeClose(context::close);
    }

    private void safeClose(Runnable closer) {
        try {
            closer.run();
        } catch (RuntimeException e) {
            log.debug("Close failed: {}", e.getMessage());
        }
    }

    private String quote(String value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot encode identity", e);
        }
    }
}
