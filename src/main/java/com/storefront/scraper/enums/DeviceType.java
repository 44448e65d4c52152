package com.storefront.scraper.enums;

public enum DeviceType {
    PHONE,
    TABLET
}
