package com.ecommercedata.scraper;

/**
 * Opens browser sessions. {@code DynamicSession::open} in production.
 */
@FunctionalInterface
public interface DynamicSessionFactory {
    DynamicSessionInterface open(BrowserSettings settings) throws DriverException;
}
