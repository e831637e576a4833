package model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "chats")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Chat implements Identified {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "chat_type", nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private ChatType type; // 'direct' | 'group'

    // group only
    @Column(length = 100)
    private String topic;

    // direct only, see DirectChatKey
    @Column(name = "dm_key", unique = true, length = 80)
    private String dmKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum ChatType {
        direct,
        group
    }

    @Override
    public EntityKind kind() {
        return EntityKind.CHAT;
    }
}
