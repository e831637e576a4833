package verifier;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class MessageTiming {
    String messageId;
    String chatId;
    LocalDateTime sentAt;
    /** Null when the chat does not exist. */
    LocalDateTime chatCreatedAt;
}
