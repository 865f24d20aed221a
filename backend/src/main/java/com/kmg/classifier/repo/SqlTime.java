package com.kmg.classifier.repo;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public final class SqlTime {
    private SqlTime() {
    }

    public static long toMillis(Instant value) {
        return value.toEpochMilli();
    }

    public static Instant read(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        if (rs.wasNull()) {
            return null;
        }
        return Instant.ofEpochMilli(millis);
    }
}
