package dev.chatstore.storage.persistence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processing state of a message.
 *
 * <p>Forward transitions ({@code PENDING -> IN_PROGRESS -> COMPLETE | FAILED}) are driven by the
 * generation process. The only backward transition owned by this service is resume, which moves a
 * {@code PENDING} or {@code FAILED} message back to {@code PENDING}.</p>
 */
public enum MessageStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE,
    FAILED;

    public boolean isResumable() {
        return this == PENDING || this == FAILED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MessageStatus fromWire(String value) {
        if (value == null) return null;
        return MessageStatus.valueOf(value.trim().toUpperCase());
    }
}
