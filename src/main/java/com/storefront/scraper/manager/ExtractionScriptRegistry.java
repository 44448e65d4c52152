package com.storefront.scraper.manager;

import com.storefront.scraper.enums.Platform;
import com.storefront.scraper.utils.ClasspathScripts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opaque per-platform extraction scripts, read from {@code extraction/<platform>.js} on first use.
 */
@Component
@Slf4j
public class ExtractionScriptRegistry {

    private final Map<Platform, String> scripts = new ConcurrentHashMap<>();

    public String scriptFor(Platform platform) {
        return scripts.computeIfAbsent(platform, p -> {
            String resource = "extraction/" + p.getCode().toLowerCase(Locale.ROOT) + ".js";
            log.debug("Loading extraction script {}", resource);
            return ClasspathScripts.read(resource);
        });
    }

    public void override(Platform platform, String script) {
        scripts.put(platform, script);
        log.info("Extraction script for {} replaced", platform.getCode());
    }
}
