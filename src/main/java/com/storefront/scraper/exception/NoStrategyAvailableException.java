package com.storefront.scraper.exception;

public class NoStrategyAvailableException extends RuntimeException {
    public NoStrategyAvailableException() {
        super();
    }

    public NoStrategyAvailableException(String message) {
        super(message);
    }

    public NoStrategyAvailableException(String message, Throwable e) {
        super(message, e);
    }
}
