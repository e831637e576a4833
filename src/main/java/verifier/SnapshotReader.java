package verifier;

import model.EntityKind;

import java.util.function.Consumer;

/**
 * Read-only view of a stored dataset, as much as the verification checks need.
 * Probes return the number of offending rows and at most {@code limit} of their identifiers.
 */
public interface SnapshotReader {

    long count(EntityKind kind);

    Findings duplicateIds(EntityKind kind, int limit);

    /** Handles equal ignoring case. */
    Findings duplicateHandles(int limit);

    /** Chat/user pairs with more than one membership. */
    Findings duplicateMembershipPairs(int limit);

    Findings duplicateDirectChatKeys(int limit);

    /** Memberships whose chat or user is missing. */
    Findings orphanMemberships(int limit);

    /** Messages whose chat or sender is missing. */
    Findings orphanMessages(int limit);

    /** Messages whose sender has no membership in the chat, or joined after the message was sent. */
    Findings messagesFromNonMembers(int limit);

    /** Users whose handle is empty or not lowercase. */
    Findings malformedHandles(int limit);

    /** Messages with a blank body. */
    Findings emptyMessages(int limit);

    void forEachChatSummary(Consumer<ChatSummary> consumer);

    void forEachMessageTiming(Consumer<MessageTiming> consumer);
}
