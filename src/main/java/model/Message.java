package model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "messages",
       indexes = {
               @Index(name = "ix_message_chat_sent", columnList = "chat_id, sent_at"),
               @Index(name = "ix_message_sender_sent", columnList = "sender_id, sent_at")
       })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message implements Identified {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "chat_id", nullable = false, length = 36)
    private String chatId;

    @Column(name = "sender_id", nullable = false, length = 36)
    private String senderId;

    @Column(nullable = false, length = 4000)
    private String content;

    @Column(name = "sent_at", nullable = false)
    private LocalDateTime sentAt;

    @Override
    public EntityKind kind() {
        return EntityKind.MESSAGE;
    }
}
