package dev.chatstore.storage.messages;

import dev.chatstore.storage.persistence.MessageEntity;
import dev.chatstore.storage.persistence.MessageStatus;
import dev.chatstore.storage.persistence.Sender;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record MessageResponse(
        UUID id,
        UUID sessionId,
        Sender sender,
        String content,
        Map<String, Object> context,
        MessageStatus status,
        String partialContent,
        String errorMessage,
        OffsetDateTime timestamp,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    static MessageResponse from(MessageEntity message) {
        return new MessageResponse(
                message.getId(),
                message.getSessionId(),
                message.getSender(),
                message.getContent(),
                message.getContext(),
                message.getStatus(),
                message.getPartialContent(),
                message.getErrorMessage(),
                message.getTimestamp(),
                message.getCreatedAt(),
                message.getUpdatedAt()
        );
    }

    public record Page(List<MessageResponse> messages, long total) {}

    public record Resumed(UUID messageId, MessageStatus status) {}
}
