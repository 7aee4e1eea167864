package dev.chatstore.storage.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageRepositoryCustom {

    /**
     * List the messages of a session in chronological order (earliest {@code timestamp} first).
     */
    List<MessageEntity> listBySession(UUID sessionId, int skip, int limit);

    Optional<MessageEntity> update(UUID id, MessagePatch patch);
}
