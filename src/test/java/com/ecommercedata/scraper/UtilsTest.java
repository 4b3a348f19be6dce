package com.ecommercedata.scraper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the shared helpers.
 */
public class UtilsTest {

    @Test
    void testSanitizeFilename() {
        assertEquals("My_Data_Set_____", Utils.sanitizeFilename("My:Data/Set?*<>|"));
        assertEquals("social_mentions", Utils.sanitizeFilename("social mentions"));
        assertEquals("", Utils.sanitizeFilename(null));
    }

    @Test
    void testNormalizeIdentifier() {
        assertEquals("order_date", Utils.normalizeIdentifier("  Order Date "));
        assertEquals("customer_id", Utils.normalizeIdentifier("Customer-ID"));
        assertEquals("unit_price", Utils.normalizeIdentifier("Unit - \t Price"));
        assertEquals("", Utils.normalizeIdentifier(null));
    }
}
