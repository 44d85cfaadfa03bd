package com.realtime.messaging.message.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realtime.messaging.message.entity.FileMetadata;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FileMetadataDto(String fileUrl, String fileName, String fileType, Long fileSize) {

    public static FileMetadataDto from(FileMetadata f) {
        if (f == null) return null;
        return new FileMetadataDto(f.getFileUrl(), f.getFileName(), f.getFileType(), f.getFileSize());
    }

    public FileMetadata toEntity() {
        return FileMetadata.builder()
                .fileUrl(fileUrl)
                .fileName(fileName)
                .fileType(fileType)
                .fileSize(fileSize)
                .build();
    }
}
