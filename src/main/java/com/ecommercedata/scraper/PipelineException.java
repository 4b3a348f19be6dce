package com.ecommercedata.scraper;

/**
 * Base of the pipeline's checked error taxonomy.
 * <p>
 * Every subclass names the stage that failed so that a fatal error reaching {@link Main}
 * identifies both the stage and the unit of work (URL, table) it was processing.
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class PipelineException extends Exception {
    private final String stage;

    public PipelineException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /**
     * @return short name of the failing stage, e.g. {@code fetch}, {@code browser}, {@code load}
     */
    public String stage() {
        return stage;
    }
}
