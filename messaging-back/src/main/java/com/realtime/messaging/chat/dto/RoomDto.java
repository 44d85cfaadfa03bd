package com.realtime.messaging.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.messaging.chat.entity.ChatRoom;
import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RoomDto {
    private String id;
    private String name;
    private String kind;
    private List<String> participantIds;
    private String creatorId;
    private String externalIdentifier;
    private String description;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public static RoomDto from(ChatRoom r) {
        return RoomDto.builder()
                .id(r.getId())
                .name(r.getName())
                .kind(r.getKind().name().toLowerCase())
                .participantIds(r.getParticipantIds().stream().map(String::valueOf).sorted().toList())
                .creatorId(r.getCreatorId() != null ? r.getCreatorId().toString() : null)
                .externalIdentifier(r.getExternalIdentifier())
                .description(r.getDescription())
                .active(r.isActive())
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt())
                .build();
    }
}
