package com.realtime.messaging.channel.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.messaging.channel.entity.Channel;
import lombok.*;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChannelDto {
    private String id;
    private String name;
    private String kind;
    private String description;
    private String creatorId;
    private List<String> adminIds;
    private List<String> memberIds;
    @JsonProperty("is_public")
    private boolean publicChannel;
    private boolean allowMemberPosts;
    private boolean allowReactions;
    private boolean allowReplies;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public static ChannelDto from(Channel c) {
        return ChannelDto.builder()
                .id(c.getId())
                .name(c.getName())
                .kind(c.getKind().name().toLowerCase())
                .description(c.getDescription())
                .creatorId(c.getCreatorId().toString())
                .adminIds(c.getAdminIds().stream().map(String::valueOf).sorted().toList())
                .memberIds(c.getMemberIds().stream().map(String::valueOf).sorted().toList())
                .publicChannel(c.isPublicChannel())
                .allowMemberPosts(c.getSettings().isAllowMemberPosts())
                .allowReactions(c.getSettings().isAllowReactions())
                .allowReplies(c.getSettings().isAllowReplies())
                .active(c.isActive())
                .createdAt(c.getCreatedAt())
                .updatedAt(c.getUpdatedAt())
                .build();
    }
}
