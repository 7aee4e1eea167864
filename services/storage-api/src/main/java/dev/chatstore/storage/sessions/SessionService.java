package dev.chatstore.storage.sessions;

import dev.chatstore.storage.domain.InvalidSessionNameException;
import dev.chatstore.storage.domain.PagedResult;
import dev.chatstore.storage.persistence.SessionEntity;
import dev.chatstore.storage.persistence.SessionPatch;
import dev.chatstore.storage.persistence.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRepository sessions;

    public SessionService(SessionRepository sessions) {
        this.sessions = sessions;
    }

    /**
     * Create a session for the given user.
     *
     * @param input the owner plus optional name and favorite flag; a null name becomes "New Chat"
     *              and a null favorite flag becomes {@code false}
     * @return the persisted session with its generated id and timestamps
     */
    public SessionEntity createSession(NewSession input) {
        Objects.requireNonNull(input.userId(), "userId is required");

        SessionEntity session = new SessionEntity();
        session.setUserId(input.userId());
        session.setName(input.name() == null ? SessionEntity.DEFAULT_NAME : input.name());
        session.setFavorite(Boolean.TRUE.equals(input.favorite()));
        SessionEntity created = sessions.create(session);

        log.info("session created sessionId={} userId={} name={}",
                created.getId(), created.getUserId(), created.getName());
        return created;
    }

    /**
     * Return one page of a user's sessions (favorites first, then most recently updated) and the
     * user's total session count.
     */
    @Transactional(readOnly = true)
    public PagedResult<SessionEntity> getUserSessions(UUID userId, int skip, int limit) {
        List<SessionEntity> page = sessions.listByUser(userId, skip, limit);
        long total = sessions.countByUserId(userId);
        log.debug("user sessions retrieved userId={} count={} total={} skip={} limit={}",
                userId, page.size(), total, skip, limit);
        return new PagedResult<>(page, total);
    }

    public Optional<SessionEntity> getSessionById(UUID sessionId) {
        Optional<SessionEntity> session = sessions.findById(sessionId);
        if (session.isEmpty()) {
            log.warn("session not found sessionId={}", sessionId);
        }
        return session;
    }

    /**
     * Rename a session. Surrounding whitespace is stripped before storing.
     *
     * @return the updated session, or empty when no session has this id
     * @throws InvalidSessionNameException if the name is null or blank; nothing is written
     */
    public Optional<SessionEntity> updateSessionName(UUID sessionId, String name) {
        if (name == null || name.isBlank()) {
            log.warn("invalid session name sessionId={}", sessionId);
            throw new InvalidSessionNameException();
        }
        String trimmed = name.strip();
        Optional<SessionEntity> updated = sessions.update(sessionId, SessionPatch.name(trimmed));
        updated.ifPresent(s -> log.info("session renamed sessionId={} name={}", sessionId, trimmed));
        return updated;
    }

    public Optional<SessionEntity> toggleFavorite(UUID sessionId, boolean favorite) {
        Optional<SessionEntity> updated = sessions.update(sessionId, SessionPatch.favorite(favorite));
        updated.ifPresent(s -> log.info("session favorite set sessionId={} favorite={}", sessionId, favorite));
        return updated;
    }

    /**
     * Delete a session together with all of its messages.
     *
     * @return {@code true} if the session existed
     */
    public boolean deleteSession(UUID sessionId) {
        boolean deleted = sessions.delete(sessionId);
        if (deleted) {
            log.info("session deleted sessionId={}", sessionId);
        } else {
            log.warn("session delete failed, not found sessionId={}", sessionId);
        }
        return deleted;
    }

    public boolean sessionExists(UUID sessionId) {
        return sessions.existsById(sessionId);
    }

    public record NewSession(UUID userId, String name, Boolean favorite) {}
}
