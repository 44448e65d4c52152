package com.storefront.scraper.interfaces;

import java.util.List;
import java.util.Map;

/**
 * The narrow page surface the scraper drives. Closing releases the underlying context.
 */
public interface BrowserPage extends AutoCloseable {

    void setViewport(int width, int height);

    /**
     * Sets the user-agent string presented by the page, both in headers and to scripts.
     */
    void setIdentity(String userAgent);

    void setHeaders(Map<String, String> headers);

    /**
     * Registers a script that runs before any page script on every navigation.
     */
    void injectPreNavigationOverrides(String script);

    void navigate(String url, int timeoutMs);

    /**
     * Runs an extraction script (a function expression) and returns its record.
     */
    Map<String, Object> runQuery(String script);

    Object evaluate(String script, Object arg);

    void movePointer(double x, double y);

    void scrollBy(int deltaY);

    void focus(String selector);

    void typeCharacter(String character);

    void pressKey(String key);

    int countElements(String selector);

    void hover(String selector, int index);

    /**
     * @return {width, height} of the current viewport
     */
    int[] viewport();

    List<Map<String, Object>> cookies();

    void addCookies(List<Map<String, Object>> cookies);

    /**
     * Starts recording JSON bodies of XHR/fetch responses whose URL contains the fragment.
     */
    void enableResponseCapture(String urlFragment);

    List<Map<String, Object>> capturedResponses();

    @Override
    void close();
}
