package com.realtime.messaging.chat.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(
        name = "chat_rooms",
        indexes = @Index(name = "ix_chat_rooms_kind", columnList = "kind"),
        uniqueConstraints = @UniqueConstraint(name = "uk_chat_rooms_identifier", columnNames = "external_identifier")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatRoom {

    public enum Kind { DIRECT, GROUP, DEPARTMENT, BROADCAST }

    @Id @Column(length = 40)
    private String id; // UUID string

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 20)
    private Kind kind;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "chat_room_participants", joinColumns = @JoinColumn(name = "room_id"))
    @Column(name = "user_id", nullable = false)
    @Builder.Default
    private Set<UUID> participantIds = new LinkedHashSet<>();

    @Column(name = "creator_id")
    private UUID creatorId;

    /** direct 방은 direct_{작은id}_{큰id} 로 1:1 중복 방지 */
    @Column(name = "external_identifier", nullable = false, length = 255)
    private String externalIdentifier;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    public boolean hasParticipant(UUID userId) {
        return userId != null && participantIds.contains(userId);
    }
}
