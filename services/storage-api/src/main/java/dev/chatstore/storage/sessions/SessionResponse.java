package dev.chatstore.storage.sessions;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.chatstore.storage.persistence.SessionEntity;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record SessionResponse(
        UUID id,
        UUID userId,
        String name,
        @JsonProperty("isFavorite") boolean isFavorite,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    static SessionResponse from(SessionEntity session) {
        return new SessionResponse(
                session.getId(),
                session.getUserId(),
                session.getName(),
                session.isFavorite(),
                session.getCreatedAt(),
                session.getUpdatedAt()
        );
    }

    public record Page(List<SessionResponse> sessions, long total) {}
}
