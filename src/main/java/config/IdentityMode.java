package config;

public enum IdentityMode {
    /** UUID from the SHA-256 of a logical name. */
    HASHED,
    /** UUID drawn from the run's seeded generator. */
    SEEDED
}
