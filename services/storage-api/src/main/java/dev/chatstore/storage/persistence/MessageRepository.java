package dev.chatstore.storage.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

public interface MessageRepository extends JpaRepository<MessageEntity, UUID>, MessageRepositoryCustom {

    default MessageEntity create(MessageEntity message) {
        return saveAndFlush(message);
    }

    long countBySessionId(UUID sessionId);

    boolean existsBySessionId(UUID sessionId);

    Optional<MessageEntity> findFirstBySessionIdOrderByTimestampDesc(UUID sessionId);

    default Optional<MessageEntity> findLatestBySession(UUID sessionId) {
        return findFirstBySessionIdOrderByTimestampDesc(sessionId);
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from MessageEntity m where m.id = :id")
    int deleteRowById(@Param("id") UUID id);

    default boolean delete(UUID id) {
        return deleteRowById(id) > 0;
    }
}
