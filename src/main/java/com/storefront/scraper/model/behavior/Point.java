package com.storefront.scraper.model.behavior;

public record Point(double x, double y) {
}
