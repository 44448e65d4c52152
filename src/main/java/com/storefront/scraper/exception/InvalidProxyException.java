package com.storefront.scraper.exception;

public class InvalidProxyException extends RuntimeException {
    public InvalidProxyException() {
        super();
    }

    public InvalidProxyException(String message) {
        super(message);
    }

    public InvalidProxyException(String message, Throwable e) {
        super(message, e);
    }
}
