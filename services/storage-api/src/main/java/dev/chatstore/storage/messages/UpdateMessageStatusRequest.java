package dev.chatstore.storage.messages;

import dev.chatstore.storage.persistence.MessageStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateMessageStatusRequest(@NotNull MessageStatus status, String errorMessage) {}
