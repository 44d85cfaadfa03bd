package com.realtime.messaging.channel.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record CreateChannelRequest(
        @NotBlank @Size(max = 255) String name,
        String kind,                   // department(기본) | project | announcement
        @Size(max = 1000) String description,
        List<UUID> adminIds,
        List<UUID> memberIds,
        Boolean isPublic,
        Boolean allowMemberPosts,
        Boolean allowReactions,
        Boolean allowReplies
) {}
