package com.ecommercedata.scraper;

/**
 * The headless browser could not be launched or crashed mid-session.
 * Fatal for the dynamic scrape pass; there is no fallback to static fetching.
 */
public class DriverException extends PipelineException {
    public DriverException(String message, Throwable cause) {
        super("browser", message, cause);
    }
}
