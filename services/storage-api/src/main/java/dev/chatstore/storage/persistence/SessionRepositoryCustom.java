package dev.chatstore.storage.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SessionRepositoryCustom {

    /**
     * List the sessions owned by a user, favorites first and then most recently updated first.
     *
     * @param userId the owning user
     * @param skip   number of rows to skip
     * @param limit  maximum number of rows to return
     * @return the requested window, possibly empty
     */
    List<SessionEntity> listByUser(UUID userId, int skip, int limit);

    /**
     * Apply a sparse update and refresh {@code updatedAt}.
     *
     * @return the updated session, or empty when no session has this id
     */
    Optional<SessionEntity> update(UUID id, SessionPatch patch);
}
