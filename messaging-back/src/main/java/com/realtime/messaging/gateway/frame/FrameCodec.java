package com.realtime.messaging.gateway.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.realtime.messaging.common.ChatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * 와이어 프레임 ↔ 타입. 인바운드는 여기서 한 번만 파싱/검증하고 이후로는 타입으로만 다룬다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FrameCodec {

    private static final Set<String> INBOUND_TYPES = Set.of(
            MessageFrame.TYPE, TypingStartFrame.TYPE, TypingStopFrame.TYPE,
            ReadReceiptFrame.TYPE, ReactionFrame.TYPE);

    private final ObjectMapper objectMapper;

    /**
     * @throws ChatException INVALID_FRAME: JSON이 아니거나, 모르는 type이거나, 필수 필드 누락
     */
    public InboundFrame decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw ChatException.invalidFrame("invalid JSON format");
        }
        if (root == null || !root.isObject()) {
            throw ChatException.invalidFrame("frame must be a JSON object");
        }

        ObjectNode obj = (ObjectNode) root;
        JsonNode typeNode = obj.get("type");
        // type 없으면 일반 메시지로 본다
        if (typeNode == null || typeNode.isNull()) {
            obj.put("type", MessageFrame.TYPE);
        } else if (!typeNode.isTextual() || !INBOUND_TYPES.contains(typeNode.asText())) {
            throw ChatException.invalidFrame("unsupported frame type: " + typeNode.asText());
        }

        InboundFrame frame;
        try {
            frame = objectMapper.treeToValue(obj, InboundFrame.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("frame binding failed: {}", e.getMessage());
            throw ChatException.invalidFrame("malformed " + obj.get("type").asText() + " frame");
        }
        frame.validate();
        return frame;
    }

    public String encode(OutboundEvent event) {
        try {
            return objectMapper.writerFor(OutboundEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize " + event.getClass().getSimpleName(), e);
        }
    }
}
