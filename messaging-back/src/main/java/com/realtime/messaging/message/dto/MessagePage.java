package com.realtime.messaging.message.dto;

import java.util.List;

public record MessagePage(List<MessageDto> messages, long total, int limit, long offset) {}
