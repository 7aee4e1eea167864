package dev.chatstore.storage.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

class SessionRepositoryImpl implements SessionRepositoryCustom {

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional(readOnly = true)
    public List<SessionEntity> listByUser(UUID userId, int skip, int limit) {
        return em.createQuery(
                        "select s from SessionEntity s where s.userId = :userId "
                                + "order by s.favorite desc, s.updatedAt desc",
                        SessionEntity.class)
                .setParameter("userId", userId)
                .setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    @Transactional
    public Optional<SessionEntity> update(UUID id, SessionPatch patch) {
        SessionEntity session = em.find(SessionEntity.class, id);
        if (session == null) {
            return Optional.empty();
        }
        patch.applyTo(session);
        session.touch();
        em.flush();
        return Optional.of(session);
    }
}
