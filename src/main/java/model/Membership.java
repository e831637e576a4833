package model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "memberships",
       uniqueConstraints = {@UniqueConstraint(columnNames = {"chat_id", "user_id"})},
       indexes = {@Index(name = "ix_membership_user_id", columnList = "user_id")})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Membership implements Identified {

    public enum MemberRole {
        ADMIN,
        MEMBER
    }

    @Id
    @Column(length = 36)
    private String id;

    // plain id columns, integrity is owned by the migrated schema
    @Column(name = "chat_id", nullable = false, length = 36)
    private String chatId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MemberRole role;

    @Column(name = "joined_at", nullable = false)
    private LocalDateTime joinedAt;

    @Override
    public EntityKind kind() {
        return EntityKind.MEMBERSHIP;
    }
}
