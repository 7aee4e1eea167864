package dev.chatstore.storage.messages;

import dev.chatstore.storage.domain.MessageNotResumableException;
import dev.chatstore.storage.domain.PagedResult;
import dev.chatstore.storage.persistence.MessageEntity;
import dev.chatstore.storage.persistence.MessageRepository;
import dev.chatstore.storage.persistence.MessageStatus;
import dev.chatstore.storage.persistence.Sender;
import dev.chatstore.storage.sessions.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({SessionService.class, MessageService.class})
class MessageServiceIntegrationTest {

    @Autowired
    SessionService sessionService;

    @Autowired
    MessageService messageService;

    @Autowired
    MessageRepository messages;

    UUID sessionId;

    @BeforeEach
    void setUp() {
        sessionId = sessionService.createSession(
                new SessionService.NewSession(UUID.randomUUID(), null, null)).getId();
    }

    @Test
    void resume_failedLatestMessage_clearsErrorAndSetsPending() {
        MessageEntity question = messageService.createMessage(sessionId,
                new MessageService.NewMessage(Sender.USER, "question", null));
        MessageEntity answer = messageService.createMessage(sessionId,
                new MessageService.NewMessage(Sender.AI, "partial answer", null));
        answer.setTimestamp(OffsetDateTime.now().plusSeconds(1));
        messages.flush();
        messageService.updateMessageStatus(answer.getId(), MessageStatus.FAILED, "upstream timeout");

        MessageService.ResumeResult result = messageService.resumeFailedMessage(sessionId).orElseThrow();

        assertThat(result.messageId()).isEqualTo(answer.getId());
        assertThat(result.status()).isEqualTo(MessageStatus.PENDING);
        MessageEntity stored = messages.findById(answer.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(MessageStatus.PENDING);
        assertThat(stored.getErrorMessage()).isNull();
        assertThat(messages.findById(question.getId()).orElseThrow().getStatus()).isEqualTo(MessageStatus.PENDING);
    }

    @Test
    void resume_onlyLooksAtLatestMessage() {
        MessageEntity failed = messageService.createMessage(sessionId,
                new MessageService.NewMessage(Sender.AI, "old", null));
        messageService.updateMessageStatus(failed.getId(), MessageStatus.FAILED, "x");
        MessageEntity done = messageService.createMessage(sessionId,
                new MessageService.NewMessage(Sender.AI, "new", null));
        done.setTimestamp(OffsetDateTime.now().plusSeconds(1));
        messages.flush();
        messageService.updateMessageStatus(done.getId(), MessageStatus.COMPLETE, null);

        assertThatThrownBy(() -> messageService.resumeFailedMessage(sessionId))
                .isInstanceOf(MessageNotResumableException.class);
        assertThat(messages.findById(failed.getId()).orElseThrow().getStatus()).isEqualTo(MessageStatus.FAILED);
    }

    @Test
    void deleteSession_removesItsMessages() {
        MessageEntity m = messageService.createMessage(sessionId,
                new MessageService.NewMessage(Sender.USER, "bye", null));

        assertThat(sessionService.deleteSession(sessionId)).isTrue();

        assertThat(messageService.sessionHasMessages(sessionId)).isFalse();
        assertThat(messageService.getMessageById(m.getId())).isEmpty();
        assertThat(sessionService.sessionExists(sessionId)).isFalse();
    }

    @Test
    void getSessionMessages_pagesChronologically() {
        OffsetDateTime base = OffsetDateTime.now();
        for (int i = 0; i < 3; i++) {
            MessageEntity m = messageService.createMessage(sessionId,
                    new MessageService.NewMessage(Sender.USER, "m" + i, null));
            m.setTimestamp(base.plusSeconds(i));
        }
        messages.flush();

        PagedResult<MessageEntity> page = messageService.getSessionMessages(sessionId, 1, 5);

        assertThat(page.total()).isEqualTo(3);
        assertThat(page.items()).extracting(MessageEntity::getContent).containsExactly("m1", "m2");
    }
}
