package com.storefront.scraper.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.scraper.exception.DeviceNotFoundException;
import com.storefront.scraper.interfaces.BrowserPage;
import com.storefront.scraper.model.profile.DeviceProfile;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catalog of mobile and tablet device profiles loaded from {@code static/devices.json}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DeviceProfileRegistry {

    static final String CATALOG = "static/devices.json";

    private final ObjectMapper objectMapper;
    private final Random behaviorRandom;

    private final List<DeviceProfile> profiles = new CopyOnWriteArrayList<>();
    private final AtomicInteger currentIndex = new AtomicInteger(0);

    @PostConstruct
    void init() {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(CATALOG)) {
            if (inputStream == null) {
                throw new IllegalStateException(CATALOG + " not found in classpath.");
            }
            List<DeviceProfile> deviceList = objectMapper.readValue(inputStream, new TypeReference<List<DeviceProfile>>() {});
            profiles.addAll(deviceList);
            log.info("Loaded {} devices successfully", deviceList.size());
        } catch (Exception e) {
            log.error("Failed to load devices from JSON", e);
            throw new IllegalStateException("Device initialization failed", e);
        }
    }

    public DeviceProfile random() {
        List<DeviceProfile> snapshot = List.copyOf(profiles);
        if (snapshot.isEmpty()) {
            throw new DeviceNotFoundException("No device found at this time");
        }
        return snapshot.get(behaviorRandom.nextInt(snapshot.size()));
    }

    public DeviceProfile byName(String name) {
        return profiles.stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new DeviceNotFoundException("Device not found: " + name));
    }

    public DeviceProfile next() {
        List<DeviceProfile> snapshot = List.copyOf(profiles);
        if (snapshot.isEmpty()) {
            throw new DeviceNotFoundException("No device found at this time");
        }
        int index = Math.floorMod(currentIndex.getAndIncrement(), snapshot.size());
        DeviceProfile profile = snapshot.get(index);
        log.debug("Selected device index: {}, name: {}", index, profile.getName());
        return profile;
    }

    public List<DeviceProfile> all() {
        return List.copyOf(profiles);
    }

    public void add(DeviceProfile profile) {
        if (profile == null || profile.getName() == null || profile.getViewport() == null) {
            throw new IllegalArgumentException("Device profile needs a name and a viewport");
        }
        profiles.removeIf(p -> p.getName().equalsIgnoreCase(profile.getName()));
        profiles.add(profile);
    }

    public boolean remove(String name) {
        return profiles.removeIf(p -> p.getName().equalsIgnoreCase(name));
    }

    /**
     * Pushes viewport, identity, headers and navigator/screen overrides onto the page.
     */
    public void apply(BrowserPage page, DeviceProfile profile) {
        log.info("Emulating device: {}", profile.getName());
        DeviceProfile.Viewport viewport = profile.getViewport();
        if (profile.isLandscape()) {
            page.setViewport(viewport.getHeight(), viewport.getWidth());
        } else {
            page.setViewport(viewport.getWidth(), viewport.getHeight());
        }
        page.setIdentity(profile.getUserAgent());
        page.setHeaders(profile.allHeaders());
        page.injectPreNavigationOverrides(buildDeviceOverrides(profile));
    }

    String buildDeviceOverrides(DeviceProfile profile) {
        DeviceProfile.Viewport viewport = profile.getViewport();
        DeviceProfile.Navigator navigator = profile.getNavigator() != null
                ? profile.getNavigator()
                : new DeviceProfile.Navigator("", "", profile.isHasTouch() ? 5 : 0);
        int width = profile.isLandscape() ? viewport.getHeight() : viewport.getWidth();
        int height = profile.isLandscape() ? viewport.getWidth() : viewport.getHeight();
        double ratio = viewport.getDeviceScaleFactor() != null ? viewport.getDeviceScaleFactor() : 1.0;
        String orientation = profile.isLandscape() ? "landscape-primary" : "portrait-primary";
        int angle = profile.isLandscape() ? 90 : 0;

        return String.format(Locale.ROOT, """
                Object.defineProperty(navigator, 'maxTouchPoints', { get: () => %d });
                Object.defineProperty(navigator, 'platform', { get: () => '%s' });
                Object.defineProperty(navigator, 'vendor', { get: () => '%s' });
                Object.defineProperty(screen, 'width', { get: () => %d });
                Object.defineProperty(screen, 'height', { get: () => %d });
                Object.defineProperty(window, 'innerWidth', { get: () => %d });
                Object.defineProperty(window, 'innerHeight', { get: () => %d });
                Object.defineProperty(window, 'devicePixelRatio', { get: () => %s });
                %s
                Object.defineProperty(screen, 'orientation', {
                    get: () => ({ type: '%s', angle: %d })
                });
                """,
                navigator.getMaxTouchPoints() != null ? navigator.getMaxTouchPoints() : 0,
                escape(navigator.getPlatform()),
                escape(navigator.getVendor()),
                width, height, width, height,
                ratio,
                profile.isHasTouch()
                        ? "window.ontouchstart = null; window.ontouchmove = null; window.ontouchend = null;"
                        : "",
                orientation, angle);
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
