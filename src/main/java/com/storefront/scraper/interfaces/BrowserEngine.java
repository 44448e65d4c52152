package com.storefront.scraper.interfaces;

import com.storefront.scraper.model.ProxyEndpoint;

/**
 * Source of isolated browser pages. Each page owns its own context (cookies, proxy, identity).
 */
public interface BrowserEngine {

    /**
     * @param proxy egress proxy for the page, or null for a direct connection
     */
    BrowserPage openPage(ProxyEndpoint proxy);

    default BrowserPage openPage() {
        return openPage(null);
    }
}
