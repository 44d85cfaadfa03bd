package com.realtime.messaging.chat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record CreateRoomRequest(
        @NotBlank @Size(max = 255) String name,
        @NotBlank String kind,                 // direct | group | department | broadcast
        @NotNull @Size(min = 2, max = 500) List<UUID> participantIds,
        String identifier,                     // 선택: 외부 식별자
        @Size(max = 1000) String description
) {}
