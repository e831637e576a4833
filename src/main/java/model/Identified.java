package model;

/**
 * A persisted entity keyed by a stable string identifier.
 */
public interface Identified {

    String getId();

    EntityKind kind();
}
