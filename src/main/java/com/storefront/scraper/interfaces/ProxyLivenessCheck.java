package com.storefront.scraper.interfaces;

import com.storefront.scraper.model.ProxyEndpoint;

@FunctionalInterface
public interface ProxyLivenessCheck {

    /**
     * @return true if a lightweight request through the proxy succeeded
     */
    boolean isAlive(ProxyEndpoint proxy);
}
