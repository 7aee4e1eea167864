package dev.chatstore.storage.domain;

import java.util.UUID;

public class NoMessagesException extends ChatStoreException {

    public NoMessagesException(UUID sessionId) {
        super("No messages found for session " + sessionId);
    }

    @Override
    public String code() {
        return "NO_MESSAGES";
    }
}
