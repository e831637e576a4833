package model;

import java.util.Objects;

/**
 * Canonical key of a direct chat: the lower user id, "::", the higher user id.
 * The same two users always produce the same key, whatever their order.
 */
public final class DirectChatKey {

    public static final String SEPARATOR = "::";

    private final String low;
    private final String high;

    private DirectChatKey(String low, String high) {
        this.low = low;
        this.high = high;
    }

    public static DirectChatKey of(String userA, String userB) {
        Objects.requireNonNull(userA, "userA");
        Objects.requireNonNull(userB, "userB");
        if (userA.equals(userB)) {
            throw new IllegalArgumentException("A direct chat needs two distinct users: " + userA);
        }
        return userA.compareTo(userB) < 0 ? new DirectChatKey(userA, userB) : new DirectChatKey(userB, userA);
    }

    public static String keyOf(String userA, String userB) {
        return of(userA, userB).value();
    }

    /**
     * @return the parsed key, or null when {@code value} is not well formed
     */
    public static DirectChatKey parse(String value) {
        if (value == null) return null;
        int at = value.indexOf(SEPARATOR);
        if (at <= 0 || at != value.lastIndexOf(SEPARATOR)) return null;

        String first = value.substring(0, at);
        String second = value.substring(at + SEPARATOR.length());
        if (second.isEmpty() || first.compareTo(second) >= 0) return null;
        return new DirectChatKey(first, second);
    }

    public static boolean isWellFormed(String value) {
        return parse(value) != null;
    }

    public String low() {
        return low;
    }

    public String high() {
        return high;
    }

    public String value() {
        return low + SEPARATOR + high;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectChatKey)) return false;
        DirectChatKey other = (DirectChatKey) o;
        return low.equals(other.low) && high.equals(other.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high);
    }

    @Override
    public String toString() {
        return value();
    }
}
