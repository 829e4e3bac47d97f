package com.frontline.core.database.dao;

import java.sql.SQLException;

public final class SqlCompat {

    private SqlCompat() {}

    public static boolean isUnknownColumn(SQLException e) {
        String state = e.getSQLState();
        return "42S22".equals(state) || (e.getMessage() != null && e.getMessage().contains("Unknown column"));
    }

    public static boolean isUnknownTable(SQLException e) {
        // MySQL/MariaDB: SQLState 42S02 = Base table or view not found
        String state = e.getSQLState();
        if ("42S02".equals(state)) return true;
        String msg = e.getMessage();
        return msg != null && msg.contains("doesn't exist");
    }

    public static double finiteOr(double value, double fallback) {
        return (Double.isNaN(value) || Double.isInfinite(value)) ? fallback : value;
    }
}
