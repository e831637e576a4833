package model;

public enum EntityKind {
    USER("users", Users.class),
    CHAT("chats", Chat.class),
    MEMBERSHIP("memberships", Membership.class),
    MESSAGE("messages", Message.class);

    private final String table;
    private final Class<? extends Identified> entityClass;

    EntityKind(String table, Class<? extends Identified> entityClass) {
        this.table = table;
        this.entityClass = entityClass;
    }

    public String table() {
        return table;
    }

    public Class<? extends Identified> entityClass() {
        return entityClass;
    }

    /** Lowercase plural, used in reports. */
    public String label() {
        return table;
    }
}
