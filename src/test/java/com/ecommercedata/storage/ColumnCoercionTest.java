package com.ecommercedata.storage;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnCoercionTest {
    @Test
    void testDateLikeNames() {
        assertTrue(ColumnCoercion.isDateLike("orderdate"));
        assertTrue(ColumnCoercion.isDateLike("birthdate"));
        assertTrue(ColumnCoercion.isDateLike("date_joined"));
        assertTrue(ColumnCoercion.isDateLike("signup_timestamp"));
        assertTrue(ColumnCoercion.isDateLike("created_at"));
        assertFalse(ColumnCoercion.isDateLike("price"));
        assertFalse(ColumnCoercion.isDateLike("category"));
    }

    @Test
    void testCompoundDateColumnIsCoerced() {
        List<Object> dates = ColumnCoercion.coerceDates(Arrays.asList("1990-05-17", null, "01/31/2024"));
        assertEquals(Arrays.asList(LocalDateTime.of(1990, 5, 17, 0, 0), null, LocalDateTime.of(2024, 1, 31, 0, 0)), dates);
    }

    @Test
    void testNonDateValuesKeepText() {
        assertNull(ColumnCoercion.coerceDates(Arrays.asList("2024-01-05", "pending")));
    }
}
