package com.realtime.messaging.channel.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChannelSettings {

    @Column(name = "allow_member_posts", nullable = false)
    @Builder.Default
    private boolean allowMemberPosts = true;

    @Column(name = "allow_reactions", nullable = false)
    @Builder.Default
    private boolean allowReactions = true;

    @Column(name = "allow_replies", nullable = false)
    @Builder.Default
    private boolean allowReplies = true;

    public static ChannelSettings defaults() {
        return ChannelSettings.builder().build();
    }
}
