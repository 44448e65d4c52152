package com.storefront.scraper.interfaces;

import com.storefront.scraper.model.ScrapingJob;
import com.storefront.scraper.model.ScrapingResult;

@FunctionalInterface
public interface JobProcessor {

    ScrapingResult process(ScrapingJob job);
}
