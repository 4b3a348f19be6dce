package com.ecommercedata.scraper;

import java.time.Duration;

/**
 * Launch and wait settings for a {@link DynamicSession}.
 *
 * @param headless          run Chromium without a window
 * @param navigationTimeout limit for a single navigation
 * @param markerTimeout     how long to wait for the content marker after navigating
 * @param userAgent         user agent of the browser context
 */
public record BrowserSettings(boolean headless, Duration navigationTimeout, Duration markerTimeout, String userAgent) {
}
