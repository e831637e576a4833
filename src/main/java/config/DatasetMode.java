package config;

public enum DatasetMode {
    /** Fixed named fixtures, identical output on every run. */
    DETERMINISTIC,
    /** Counts and distributions sampled from a seeded generator. */
    SCALE
}
