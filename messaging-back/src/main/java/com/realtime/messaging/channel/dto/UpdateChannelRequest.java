package com.realtime.messaging.channel.dto;

import jakarta.validation.constraints.Size;

/** null 필드는 변경하지 않음 */
public record UpdateChannelRequest(
        @Size(max = 255) String name,
        @Size(max = 1000) String description,
        Boolean isPublic,
        Boolean allowMemberPosts,
        Boolean allowReactions,
        Boolean allowReplies
) {}
