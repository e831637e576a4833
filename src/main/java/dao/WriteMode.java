package dao;

public enum WriteMode {
    /** Plain inserts, an existing id is a constraint violation. */
    INSERT,
    /** Rows whose id already exists are left untouched and counted as skipped. */
    UPSERT_OR_SKIP
}
