package generator;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of the fixture files.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /** One entry of users.json. */
    @Data
    @NoArgsConstructor
    public static class UserFixture {
        private String username;
        private String displayName;
        private String password;
    }

    /** conversations.json */
    @Data
    @NoArgsConstructor
    public static class ConversationsFixture {
        /** ISO local date-time all offsets are relative to. */
        private String anchorTime;
        private List<ConversationFixture> conversations = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class ConversationFixture {
        private String type; // "direct" | "group"
        private String topic;
        private List<String> participants = new ArrayList<>();
        private List<MessageFixture> messages = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class MessageFixture {
        private String sender;
        private String content;
        private int offsetMinutes;
    }
}
