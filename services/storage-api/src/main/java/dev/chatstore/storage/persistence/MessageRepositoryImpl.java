package dev.chatstore.storage.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

class MessageRepositoryImpl implements MessageRepositoryCustom {

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional(readOnly = true)
    public List<MessageEntity> listBySession(UUID sessionId, int skip, int limit) {
        return em.createQuery(
                        "select m from MessageEntity m where m.sessionId = :sessionId "
                                + "order by m.timestamp asc, m.createdAt asc",
                        MessageEntity.class)
                .setParameter("sessionId", sessionId)
                .setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    @Transactional
    public Optional<MessageEntity> update(UUID id, MessagePatch patch) {
        MessageEntity message = em.find(MessageEntity.class, id);
        if (message == null) {
            return Optional.empty();
        }
        patch.applyTo(message);
        message.touch();
        em.flush();
        return Optional.of(message);
    }
}
