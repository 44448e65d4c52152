package com.storefront.scraper.model.behavior;

/**
 * @param deltaY  signed wheel delta, negative scrolls up
 * @param pauseMs wait after the step
 */
public record ScrollStep(int deltaY, long pauseMs) {

    public boolean reverse() {
        return deltaY < 0;
    }
}
