package com.storefront.scraper.manager;

import com.storefront.scraper.interfaces.BrowserPage;
import com.storefront.scraper.utils.ClasspathScripts;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pre-navigation scripts that hide automation markers. The set is configuration: adding or removing
 * an entry in {@code scraper.stealth.scripts} changes what every page gets.
 */
@Component
@Slf4j
public class AntiFingerprintOverrides {

    static final Map<String, String> STEALTH_HEADERS = Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.9",
            "Cache-Control", "no-cache",
            "Upgrade-Insecure-Requests", "1",
            "Sec-Fetch-Dest", "document",
            "Sec-Fetch-Mode", "navigate",
            "Sec-Fetch-Site", "none"
    );

    private final List<String> resources;
    private final Map<String, String> scripts = new ConcurrentHashMap<>();

    public AntiFingerprintOverrides(
            @Value("${scraper.stealth.scripts:stealth/webdriver.js,stealth/plugins.js,stealth/languages.js,stealth/permissions.js,stealth/chrome-runtime.js}")
            List<String> resources) {
        this.resources = new CopyOnWriteArrayList<>(resources.stream().map(String::trim).toList());
    }

    @PostConstruct
    void init() {
        Map<String, String> loaded = new LinkedHashMap<>();
        for (String resource : resources) {
            loaded.put(resource, ClasspathScripts.read(resource));
        }
        scripts.putAll(loaded);
        log.info("Loaded {} anti-fingerprint overrides", loaded.size());
    }

    public void apply(BrowserPage page) {
        for (String resource : resources) {
            String script = scripts.get(resource);
            if (script != null) {
                page.injectPreNavigationOverrides(script);
            }
        }
        page.setHeaders(STEALTH_HEADERS);
    }

    public void register(String name, String script) {
        scripts.put(name, script);
        if (!resources.contains(name)) {
            resources.add(name);
        }
    }

    public boolean remove(String name) {
        scripts.remove(name);
        return resources.remove(name);
    }

    public List<String> names() {
        return List.copyOf(resources);
    }
}
