package config;

/**
 * Connection role. Each role may point at its own connection string.
 */
public enum StoreRole {
    ADMIN,
    READ_WRITE,
    READ_ONLY;

    public boolean isReadOnly() {
        return this == READ_ONLY;
    }
}
