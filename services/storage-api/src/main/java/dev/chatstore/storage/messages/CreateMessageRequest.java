package dev.chatstore.storage.messages;

import dev.chatstore.storage.persistence.Sender;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record CreateMessageRequest(
        @NotNull Sender sender,
        @NotNull @Size(min = 1, max = 10000) String content,
        Map<String, Object> context
) {}
