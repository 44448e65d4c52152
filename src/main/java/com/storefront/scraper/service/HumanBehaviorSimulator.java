package com.storefront.scraper.service;

import com.storefront.scraper.interfaces.BrowserPage;
import com.storefront.scraper.model.behavior.BehaviorConfig;
import com.storefront.scraper.model.behavior.Keystroke;
import com.storefront.scraper.model.behavior.Point;
import com.storefront.scraper.model.behavior.ScrollStep;
import com.storefront.scraper.utils.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates and plays back human-looking interaction traces. Playback never fails the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HumanBehaviorSimulator {

    private static final String[] KEY_ROWS = {"qwertyuiop", "asdfghjkl", "zxcvbnm"};
    private static final String INTERACTIVE_SELECTOR = "button, a, input, select, textarea";
    private static final String TEXT_LENGTH_SCRIPT = "() => document.body ? (document.body.innerText || '').length : 0";

    private final BehaviorConfig config;
    private final Random behaviorRandom;
    private final Sleeper sleeper;

    /**
     * Full pass used before extraction: settle, pointer, scroll, then hover a few elements.
     */
    public void simulate(BrowserPage page) {
        log.debug("🧑 Simulating human behavior");
        try {
            BehaviorConfig.Delays delays = config.getDelays();
            if (!sleeper.pause(between(delays.getMinPageLoad(), delays.getMaxPageLoad()))) return;
            if (config.getMouse().isEnabled()) {
                simulateMouse(page);
            }
            if (config.getScroll().isEnabled()) {
                simulateScroll(page);
            }
            interactWithPage(page);
        } catch (RuntimeException e) {
            log.warn("Human behavior simulation failed: {}", e.getMessage());
        }
    }

    public List<Point> pointerPath(int width, int height) {
        BehaviorConfig.Mouse mouse = config.getMouse();
        int waypoints = between(mouse.getMinWaypoints(), mouse.getMaxWaypoints());
        List<Point> path = new ArrayList<>();
        Point current = new Point(behaviorRandom.nextDouble() * width, behaviorRandom.nextDouble() * height);
        for (int i = 0; i < waypoints; i++) {
            Point target = new Point(behaviorRandom.nextDouble() * width, behaviorRandom.nextDouble() * height);
            if (mouse.isNaturalCurves()) {
                path.addAll(curveBetween(current, target, width, height));
            }
            path.add(target);
            current = target;
        }
        return path;
    }

    private List<Point> curveBetween(Point from, Point to, int width, int height) {
        BehaviorConfig.Mouse mouse = config.getMouse();
        int count = between(mouse.getMinCurvePoints(), mouse.getMaxCurvePoints());
        List<Point> points = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            double t = (double) i / (count + 1);
            double x = from.x() + (to.x() - from.x()) * t + (behaviorRandom.nextDouble() - 0.5) * 2 * mouse.getJitter();
            double y = from.y() + (to.y() - from.y()) * t + (behaviorRandom.nextDouble() - 0.5) * 2 * mouse.getJitter();
            points.add(new Point(clamp(x, 0, width), clamp(y, 0, height)));
        }
        return points;
    }

    public List<ScrollStep> scrollSequence() {
        BehaviorConfig.Scroll scroll = config.getScroll();
        int steps = between(scroll.getMinSteps(), scroll.getMaxSteps());
        List<ScrollStep> sequence = new ArrayList<>(steps);
        for (int i = 0; i < steps; i++) {
            int amount = between(scroll.getMinScroll(), scroll.getMaxScroll());
            boolean reverse = i > 0 && behaviorRandom.nextDouble() < scroll.getReverseProbability();
            long pause = between(scroll.getMinStepDelay(), scroll.getMaxStepDelay());
            if (behaviorRandom.nextDouble() < scroll.getLongPauseProbability()) {
                pause += between(scroll.getMinLongPause(), scroll.getMaxLongPause());
            }
            sequence.add(new ScrollStep(reverse ? -amount : amount, pause));
        }
        return sequence;
    }

    /**
     * Keystrokes for the text, occasionally typing a neighbouring key and correcting it with Backspace.
     */
    public List<Keystroke> keystrokes(String text) {
        BehaviorConfig.Typing typing = config.getTyping();
        List<Keystroke> strokes = new ArrayList<>();
        for (char c : text.toCharArray()) {
            if (typing.isNaturalErrors() && Character.isLetter(c)
                    && behaviorRandom.nextDouble() < typing.getErrorProbability()) {
                strokes.add(Keystroke.type(neighbourOf(c), typingDelay()));
                strokes.add(Keystroke.press("Backspace", typingDelay()));
            }
            long delay = typingDelay();
            if (behaviorRandom.nextDouble() < typing.getHesitationProbability()) {
                delay += between(typing.getMinHesitation(), typing.getMaxHesitation());
            }
            strokes.add(Keystroke.type(c, delay));
        }
        return strokes;
    }

    /**
     * Time a reader at a random 200-300 wpm would need for the given amount of text, capped.
     */
    public long readingTimeMs(int textLength) {
        BehaviorConfig.Reading reading = config.getReading();
        double words = (double) textLength / Math.max(1, reading.getCharsPerWord());
        int wpm = between(reading.getMinWordsPerMinute(), reading.getMaxWordsPerMinute());
        long ms = (long) (words / wpm * 60_000);
        return Math.min(ms, reading.getMaxReadingTimeMs());
    }

    public void simulateMouse(BrowserPage page) {
        int[] viewport = page.viewport();
        BehaviorConfig.Mouse mouse = config.getMouse();
        for (Point point : pointerPath(viewport[0], viewport[1])) {
            page.movePointer(point.x(), point.y());
            if (!sleeper.pause(between(mouse.getMinDelay(), mouse.getMaxDelay()))) return;
        }
    }

    public void simulateScroll(BrowserPage page) {
        for (ScrollStep step : scrollSequence()) {
            page.scrollBy(step.deltaY());
            if (!sleeper.pause(step.pauseMs())) return;
        }
    }

    public void typeInto(BrowserPage page, String selector, String text) {
        try {
            page.focus(selector);
            playKeystrokes(page, keystrokes(text));
        } catch (RuntimeException e) {
            log.warn("Typing into {} failed: {}", selector, e.getMessage());
        }
    }

    /**
     * Fills fields in order, moving between them with Tab.
     */
    public void fillForm(BrowserPage page, Map<String, String> fields) {
        log.debug("📝 Simulating form filling for {} fields", fields.size());
        BehaviorConfig.Delays delays = config.getDelays();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            typeInto(page, field.getKey(), field.getValue());
            try {
                page.pressKey("Tab");
            } catch (RuntimeException e) {
                log.debug("Tab after {} failed: {}", field.getKey(), e.getMessage());
            }
            if (!sleeper.pause(between(delays.getMinBetweenActions(), delays.getMaxBetweenActions()))) return;
        }
    }

    public void simulateReading(BrowserPage page) {
        try {
            Object length = page.evaluate(TEXT_LENGTH_SCRIPT, null);
            int textLength = length instanceof Number n ? n.intValue() : 0;
            long budget = readingTimeMs(textLength);
            BehaviorConfig.Reading reading = config.getReading();
            log.debug("📖 Reading ~{} chars for {}ms", textLength, budget);
            long spent = 0;
            while (spent < budget) {
                long step = between(reading.getMinStepMs(), reading.getMaxStepMs());
                if (!sleeper.pause(step)) return;
                spent += step;
                if (behaviorRandom.nextDouble() < reading.getScrollProbability()) {
                    page.scrollBy(between(reading.getMinScroll(), reading.getMaxScroll()));
                }
            }
        } catch (RuntimeException e) {
            log.warn("Reading simulation failed: {}", e.getMessage());
        }
    }

    /**
     * Hovers over a few random interactive elements. Never clicks.
     */
    public void interactWithPage(BrowserPage page) {
        BehaviorConfig.Delays delays = config.getDelays();
        int available;
        try {
            available = page.countElements(INTERACTIVE_SELECTOR);
        } catch (RuntimeException e) {
            log.debug("Could not look up interactive elements: {}", e.getMessage());
            return;
        }
        if (available == 0) return;
        int interactions = Math.min(between(1, delays.getMaxHoverTargets()), available);
        for (int i = 0; i < interactions; i++) {
            try {
                page.hover(INTERACTIVE_SELECTOR, behaviorRandom.nextInt(available));
            } catch (RuntimeException e) {
                log.debug("Hover skipped: {}", e.getMessage());
                continue;
            }
            if (!sleeper.pause(between(delays.getMinHoverPause(), delays.getMaxHoverPause()))) return;
        }
    }

    private void playKeystrokes(BrowserPage page, List<Keystroke> strokes) {
        for (Keystroke stroke : strokes) {
            if (stroke.isKeyPress()) {
                page.pressKey(stroke.key());
            } else {
                page.typeCharacter(stroke.character());
            }
            if (!sleeper.pause(stroke.delayMs())) return;
        }
    }

    private long typingDelay() {
        BehaviorConfig.Typing typing = config.getTyping();
        return between(typing.getMinDelay(), typing.getMaxDelay());
    }

    char neighbourOf(char c) {
        char lower = Character.toLowerCase(c);
        for (String row : KEY_ROWS) {
            int idx = row.indexOf(lower);
            if (idx < 0) continue;
            int neighbour = idx == 0 ? 1 : idx == row.length() - 1 ? idx - 1
                    : idx + (behaviorRandom.nextBoolean() ? 1 : -1);
            char wrong = row.charAt(neighbour);
            return Character.isUpperCase(c) ? Character.toUpperCase(wrong) : wrong;
        }
        return c;
    }

    private int between(int min, int max) {
        if (max <= min) return min;
        return min + behaviorRandom.nextInt(max - min + 1);
    }

    private long between(long min, long max) {
        if (max <= min) return min;
        return min + (long) (behaviorRandom.nextDouble() * (max - min + 1));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
