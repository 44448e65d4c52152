package com.storefront.scraper.model.behavior;

/**
 * Either a character to type or a named key (e.g. "Backspace") to press, followed by a delay.
 */
public record Keystroke(String character, String key, long delayMs) {

    public static Keystroke type(char c, long delayMs) {
        return new Keystroke(String.valueOf(c), null, delayMs);
    }

    public static Keystroke press(String key, long delayMs) {
        return new Keystroke(null, key, delayMs);
    }

    public boolean isKeyPress() {
        return key != null;
    }
}
