package dev.chatstore.storage.domain;

import java.util.UUID;

public class SessionNotFoundException extends ChatStoreException {

    private final UUID sessionId;

    public SessionNotFoundException(UUID sessionId) {
        super("Session " + sessionId + " not found");
        this.sessionId = sessionId;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    @Override
    public String code() {
        return "SESSION_NOT_FOUND";
    }
}
