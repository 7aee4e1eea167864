package dev.chatstore.storage.messages;

import dev.chatstore.storage.domain.MessageNotResumableException;
import dev.chatstore.storage.domain.NoMessagesException;
import dev.chatstore.storage.domain.PagedResult;
import dev.chatstore.storage.domain.SessionNotFoundException;
import dev.chatstore.storage.persistence.MessageEntity;
import dev.chatstore.storage.persistence.MessagePatch;
import dev.chatstore.storage.persistence.MessageRepository;
import dev.chatstore.storage.persistence.MessageStatus;
import dev.chatstore.storage.persistence.Sender;
import dev.chatstore.storage.persistence.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final MessageRepository messages;
    private final SessionRepository sessions;

    public MessageService(MessageRepository messages, SessionRepository sessions) {
        this.messages = messages;
        this.sessions = sessions;
    }

    /**
     * Store a new message in an existing session.
     *
     * <p>Only the caller-supplied fields are set; {@code status} starts as {@code pending} and
     * {@code timestamp} as the creation time.</p>
     *
     * @param sessionId the session that owns the message
     * @param input     sender, content and optional context document
     * @return the persisted message
     * @throws SessionNotFoundException if the session does not exist; nothing is written
     */
    public MessageEntity createMessage(UUID sessionId, NewMessage input) {
        requireSession(sessionId, "create_message");

        MessageEntity message = new MessageEntity();
        message.setSessionId(sessionId);
        message.setSender(input.sender());
        message.setContent(input.content());
        message.setContext(input.context());
        MessageEntity created = messages.create(message);

        log.info("message created messageId={} sessionId={} sender={} contentLength={}",
                created.getId(), sessionId, created.getSender().wireValue(),
                created.getContent() == null ? 0 : created.getContent().length());
        return created;
    }

    /**
     * Return one page of a session's messages in chronological order and the session's total
     * message count.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    @Transactional(readOnly = true)
    public PagedResult<MessageEntity> getSessionMessages(UUID sessionId, int skip, int limit) {
        requireSession(sessionId, "get_session_messages");

        List<MessageEntity> page = messages.listBySession(sessionId, skip, limit);
        long total = messages.countBySessionId(sessionId);
        log.debug("session messages retrieved sessionId={} count={} total={} skip={} limit={}",
                sessionId, page.size(), total, skip, limit);
        return new PagedResult<>(page, total);
    }

    /**
     * Look up a message by id. A message whose session no longer exists is reported as absent.
     */
    public Optional<MessageEntity> getMessageById(UUID messageId) {
        Optional<MessageEntity> message = messages.findById(messageId)
                .filter(m -> sessions.existsById(m.getSessionId()));
        if (message.isEmpty()) {
            log.warn("message not found messageId={}", messageId);
        }
        return message;
    }

    /**
     * Reset the latest message of a session to {@code pending} so that it can be generated again.
     *
     * <p>Only {@code pending} and {@code failed} messages can be resumed. The error message is
     * cleared.</p>
     *
     * @param sessionId the session whose latest message (by {@code timestamp}) is resumed
     * @return the id and new status of the message, or empty if it was deleted before the write
     * @throws SessionNotFoundException     if the session does not exist
     * @throws NoMessagesException          if the session has no messages
     * @throws MessageNotResumableException if the latest message is {@code in_progress} or {@code complete}
     */
    public Optional<ResumeResult> resumeFailedMessage(UUID sessionId) {
        requireSession(sessionId, "resume_failed_message");

        MessageEntity latest = messages.findLatestBySession(sessionId).orElseThrow(() -> {
            log.warn("no messages found sessionId={} action=resume_failed_message", sessionId);
            return new NoMessagesException(sessionId);
        });

        if (!latest.getStatus().isResumable()) {
            log.warn("message not resumable sessionId={} messageId={} status={}",
                    sessionId, latest.getId(), latest.getStatus().wireValue());
            throw new MessageNotResumableException(latest.getId(), latest.getStatus());
        }

        Optional<MessageEntity> updated = messages.update(
                latest.getId(),
                MessagePatch.create().status(MessageStatus.PENDING).clearErrorMessage()
        );
        if (updated.isEmpty()) {
            log.warn("message vanished before resume sessionId={} messageId={}", sessionId, latest.getId());
            return Optional.empty();
        }

        log.info("message resumed sessionId={} messageId={}", sessionId, latest.getId());
        return updated.map(m -> new ResumeResult(m.getId(), m.getStatus()));
    }

    /**
     * Set a message's status and error message directly. No transition rules are checked; the
     * generation process is trusted to set legal states.
     */
    public Optional<MessageEntity> updateMessageStatus(UUID messageId, MessageStatus status, String errorMessage) {
        Objects.requireNonNull(status, "status is required");
        Optional<MessageEntity> updated = messages.update(
                messageId,
                MessagePatch.create().status(status).errorMessage(errorMessage)
        );
        updated.ifPresent(m -> log.info("message status updated messageId={} status={} errorMessage={}",
                messageId, status.wireValue(), errorMessage));
        return updated;
    }

    public boolean deleteMessage(UUID messageId) {
        boolean deleted = messages.delete(messageId);
        if (deleted) {
            log.info("message deleted messageId={}", messageId);
        } else {
            log.warn("message delete failed, not found messageId={}", messageId);
        }
        return deleted;
    }

    public boolean sessionHasMessages(UUID sessionId) {
        return messages.existsBySessionId(sessionId);
    }

    private void requireSession(UUID sessionId, String action) {
        if (!sessions.existsById(sessionId)) {
            log.warn("session not found sessionId={} action={}", sessionId, action);
            throw new SessionNotFoundException(sessionId);
        }
    }

    public record NewMessage(Sender sender, String content, Map<String, Object> context) {}

    public record ResumeResult(UUID messageId, MessageStatus status) {}
}
