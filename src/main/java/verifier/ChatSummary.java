package verifier;

import lombok.Value;

/**
 * One chat with the shape of its membership. The member ids are the lowest and highest by string order.
 */
@Value
public class ChatSummary {
    String chatId;
    String type;
    String dmKey;
    long memberCount;
    String minMemberId;
    String maxMemberId;

    public boolean isDirect() {
        return "direct".equals(type);
    }

    public boolean isGroup() {
        return "group".equals(type);
    }
}
