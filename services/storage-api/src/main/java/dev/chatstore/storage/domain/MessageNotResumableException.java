package dev.chatstore.storage.domain;

import dev.chatstore.storage.persistence.MessageStatus;

import java.util.UUID;

public class MessageNotResumableException extends ChatStoreException {

    private final UUID messageId;
    private final MessageStatus status;

    public MessageNotResumableException(UUID messageId, MessageStatus status) {
        super("Latest message is not in a resumable state (status=" + status.wireValue() + ")");
        this.messageId = messageId;
        this.status = status;
    }

    public UUID getMessageId() {
        return messageId;
    }

    public MessageStatus getStatus() {
        return status;
    }

    @Override
    public String code() {
        return "NOT_RESUMABLE";
    }
}
