package com.realtime.messaging.channel.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "channels", indexes = @Index(name = "ix_channels_kind", columnList = "kind"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Channel {

    public enum Kind { DEPARTMENT, PROJECT, ANNOUNCEMENT }

    @Id @Column(length = 40)
    private String id; // UUID string

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 20)
    private Kind kind;

    @Column(length = 1000)
    private String description;

    @Column(name = "creator_id", nullable = false)
    private UUID creatorId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "channel_admins", joinColumns = @JoinColumn(name = "channel_id"))
    @Column(name = "user_id", nullable = false)
    @Builder.Default
    private Set<UUID> adminIds = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "channel_members", joinColumns = @JoinColumn(name = "channel_id"))
    @Column(name = "user_id", nullable = false)
    @Builder.Default
    private Set<UUID> memberIds = new LinkedHashSet<>();

    @Column(name = "is_public", nullable = false)
    @Builder.Default
    private boolean publicChannel = true;

    @Embedded
    @Builder.Default
    private ChannelSettings settings = ChannelSettings.defaults();

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
        if (settings == null) settings = ChannelSettings.defaults();
    }

    public boolean isAdmin(UUID userId) {
        return userId != null && adminIds.contains(userId);
    }

    public boolean isMember(UUID userId) {
        return userId != null && memberIds.contains(userId);
    }

    /** 알림 대상: 멤버 ∪ 관리자 */
    public Set<UUID> audience() {
        Set<UUID> all = new LinkedHashSet<>(adminIds);
        all.addAll(memberIds);
        return all;
    }
}
