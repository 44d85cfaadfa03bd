package com.realtime.messaging.message.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageDto {
    private Long id;
    private String messageId;
    private String roomId;
    private String channelId;
    private String senderId;
    private String senderName;
    private String content;
    private String messageType;     // text | file
    private String parentMessageId;
    private FileMetadataDto fileMetadata;
    @JsonProperty("is_broadcast")
    private boolean broadcast;
    @JsonProperty("is_edited")
    private boolean edited;
    @JsonProperty("is_deleted")
    private boolean deleted;
    private List<String> readBy;
    private Map<String, List<String>> reactions;
    private Instant createdAt;
    private Instant updatedAt;
}
