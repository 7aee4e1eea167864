package dev.chatstore.storage.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

public interface SessionRepository extends JpaRepository<SessionEntity, UUID>, SessionRepositoryCustom {

    /**
     * Persist a new session and flush it so that the generated id and timestamps are populated.
     *
     * @param session the unsaved session
     * @return the persisted session
     */
    default SessionEntity create(SessionEntity session) {
        return saveAndFlush(session);
    }

    long countByUserId(UUID userId);

    /**
     * Delete the session row. Its messages are removed by the {@code ON DELETE CASCADE} foreign key
     * in the same statement.
     *
     * @param id the session id
     * @return the number of rows removed, 0 or 1
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from SessionEntity s where s.id = :id")
    int deleteRowById(@Param("id") UUID id);

    default boolean delete(UUID id) {
        return deleteRowById(id) > 0;
    }
}
