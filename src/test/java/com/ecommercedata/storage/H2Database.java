package com.ecommercedata.storage;

import java.util.UUID;

/**
 * Fresh in-memory H2 databases in PostgreSQL mode.
 */
public final class H2Database {
    private H2Database() {}

    public static DatabaseConnector fresh() {
        String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
        return new DatabaseConnector(url, "sa", "");
    }
}
