package dev.chatstore.storage.sessions;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record CreateSessionRequest(
        @NotNull UUID userId,
        String name,
        @JsonProperty("isFavorite") Boolean isFavorite
) {}
