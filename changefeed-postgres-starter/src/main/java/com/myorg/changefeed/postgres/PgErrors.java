package com.myorg.changefeed.postgres;

import java.sql.SQLException;

final class PgErrors {

    static final String LOCK_NOT_AVAILABLE = "55P03";
    static final String QUERY_CANCELED = "57014";

    private PgErrors() {}

    static boolean isLockTimeout(Throwable t) {
        return hasSqlState(t, LOCK_NOT_AVAILABLE);
    }

    static boolean isQueryCanceled(Throwable t) {
        return hasSqlState(t, QUERY_CANCELED);
    }

    private static boolean hasSqlState(Throwable t, String state) {
        Throwable cur = t;
        while (cur != null) {
            if (cur instanceof SQLException sql && state.equals(sql.getSQLState())) return true;
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        return false;
    }
}
