package com.myorg.changefeed.postgres;

import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;

/**
 * Advisory lock calls. Timeouts surface as SQLSTATE 55P03, see {@link PgErrors#isLockTimeout}.
 */
final class PgLocks {

    private PgLocks() {}

    static void xactLock(JdbcTemplate jdbc, long key) {
        jdbc.query("select pg_advisory_xact_lock(?)", rs -> null, key);
    }

    static void xactLock(JdbcTemplate jdbc, int classKey, int objKey) {
        jdbc.query("select pg_advisory_xact_lock(?, ?)", rs -> null, classKey, objKey);
    }

    static void xactLockShared(JdbcTemplate jdbc, long key) {
        jdbc.query("select pg_advisory_xact_lock_shared(?)", rs -> null, key);
    }

    static boolean tryXactLockShared(JdbcTemplate jdbc, long key) {
        return Boolean.TRUE.equals(jdbc.queryForObject("select pg_try_advisory_xact_lock_shared(?)", Boolean.class, key));
    }

    static void sessionLock(JdbcTemplate jdbc, long key) {
        jdbc.query("select pg_advisory_lock(?)", rs -> null, key);
    }

    static boolean sessionUnlock(JdbcTemplate jdbc, long key) {
        return Boolean.TRUE.equals(jdbc.queryForObject("select pg_advisory_unlock(?)", Boolean.class, key));
    }

    static void unlockAll(JdbcTemplate jdbc) {
        jdbc.query("select pg_advisory_unlock_all()", rs -> null);
    }

    static String currentLockTimeout(JdbcTemplate jdbc) {
        return jdbc.queryForObject("select current_setting('lock_timeout')", String.class);
    }

    /** Sets lock_timeout; {@code local} limits it to the current transaction. */
    static void setLockTimeout(JdbcTemplate jdbc, Duration timeout, boolean local) {
        setLockTimeout(jdbc, Math.max(1, timeout.toMillis()) + "ms", local);
    }

    static void setLockTimeout(JdbcTemplate jdbc, String value, boolean local) {
        jdbc.queryForObject("select set_config('lock_timeout', ?, ?)", String.class, value, local);
    }

    /** Whether some session holds the advisory lock in this database. */
    static boolean isHeld(JdbcTemplate jdbc, long key) {
        Boolean held = jdbc.queryForObject("""
                select exists(
                  select 1 from pg_locks
                   where locktype = 'advisory'
                     and database = (select oid from pg_database where datname = current_database())
                     and classid::bigint = ? and objid::bigint = ? and objsubid = 1
                     and granted)
                """, Boolean.class, LockKeys.classId(key), LockKeys.objId(key));
        return Boolean.TRUE.equals(held);
    }
}
