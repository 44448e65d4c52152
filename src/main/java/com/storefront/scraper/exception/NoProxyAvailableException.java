package com.storefront.scraper.exception;

public class NoProxyAvailableException extends RuntimeException {
    public NoProxyAvailableException() {
        super();
    }

    public NoProxyAvailableException(String message) {
        super(message);
    }

    public NoProxyAvailableException(String message, Throwable e) {
        super(message, e);
    }
}
