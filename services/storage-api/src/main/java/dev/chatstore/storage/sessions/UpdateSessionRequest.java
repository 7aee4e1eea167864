package dev.chatstore.storage.sessions;

import jakarta.validation.constraints.NotNull;

public record UpdateSessionRequest(@NotNull(message = "Name is required for update") String name) {}
