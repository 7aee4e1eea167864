package dev.chatstore.storage.persistence;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class SessionRepositoryTest {

    @Autowired
    SessionRepository sessions;

    @Autowired
    MessageRepository messages;

    @Test
    void create_populatesIdTimestampsAndDefaults() {
        SessionEntity session = new SessionEntity();
        session.setUserId(UUID.randomUUID());

        SessionEntity created = sessions.create(session);

        assertThat(created.getId()).isNotNull();
        assertThat(created.getName()).isEqualTo("New Chat");
        assertThat(created.isFavorite()).isFalse();
        assertThat(created.getCreatedAt()).isNotNull();
        assertThat(created.getUpdatedAt()).isNotNull();
    }

    @Test
    void listByUser_putsFavoritesFirstThenMostRecentlyUpdated() throws Exception {
        UUID userId = UUID.randomUUID();
        SessionEntity favoriteOlder = newSession(userId, "favorite", true);
        pause();
        SessionEntity plainB = newSession(userId, "b", false);
        pause();
        SessionEntity plainC = newSession(userId, "c", false);
        newSession(UUID.randomUUID(), "other user", true);

        assertThat(names(sessions.listByUser(userId, 0, 10)))
                .containsExactly("favorite", "c", "b");

        pause();
        sessions.update(plainB.getId(), SessionPatch.name("b renamed"));

        assertThat(names(sessions.listByUser(userId, 0, 10)))
                .containsExactly("favorite", "b renamed", "c");
        assertThat(favoriteOlder.getUpdatedAt()).isBefore(plainC.getUpdatedAt());
    }

    @Test
    void listByUser_appliesSkipAndLimit_countIgnoresThem() throws Exception {
        UUID userId = UUID.randomUUID();
        for (int i = 0; i < 5; i++) {
            newSession(userId, "s" + i, false);
            pause();
        }

        List<SessionEntity> window = sessions.listByUser(userId, 1, 2);

        assertThat(names(window)).containsExactly("s3", "s2");
        assertThat(sessions.countByUserId(userId)).isEqualTo(5);
        assertThat(sessions.countByUserId(UUID.randomUUID())).isZero();
    }

    @Test
    void update_appliesOnlyAssignedFields_andRefreshesUpdatedAt() throws Exception {
        SessionEntity session = newSession(UUID.randomUUID(), "original", false);
        OffsetDateTime before = session.getUpdatedAt();
        pause();

        SessionEntity updated = sessions.update(session.getId(), SessionPatch.favorite(true)).orElseThrow();

        assertThat(updated.isFavorite()).isTrue();
        assertThat(updated.getName()).isEqualTo("original");
        assertThat(updated.getUpdatedAt()).isAfter(before);
    }

    @Test
    void update_sameValueTwice_stillAdvancesUpdatedAt() throws Exception {
        SessionEntity session = newSession(UUID.randomUUID(), "fav", false);

        OffsetDateTime first = sessions.update(session.getId(), SessionPatch.favorite(true)).orElseThrow().getUpdatedAt();
        pause();
        SessionEntity second = sessions.update(session.getId(), SessionPatch.favorite(true)).orElseThrow();

        assertThat(second.isFavorite()).isTrue();
        assertThat(second.getUpdatedAt()).isAfter(first);
    }

    @Test
    void update_unknownId_returnsEmpty() {
        assertThat(sessions.update(UUID.randomUUID(), SessionPatch.name("x"))).isEmpty();
    }

    @Test
    void delete_cascadesToMessages() {
        SessionEntity session = newSession(UUID.randomUUID(), "doomed", false);
        MessageEntity message = new MessageEntity();
        message.setSessionId(session.getId());
        message.setSender(Sender.USER);
        message.setContent("hello");
        UUID messageId = messages.create(message).getId();

        assertThat(sessions.delete(session.getId())).isTrue();

        assertThat(sessions.existsById(session.getId())).isFalse();
        assertThat(messages.existsBySessionId(session.getId())).isFalse();
        assertThat(messages.findById(messageId)).isEmpty();
    }

    @Test
    void delete_unknownId_returnsFalse() {
        assertThat(sessions.delete(UUID.randomUUID())).isFalse();
    }

    @Test
    void findById_and_exists() {
        SessionEntity session = newSession(UUID.randomUUID(), "here", false);

        Optional<SessionEntity> found = sessions.findById(session.getId());

        assertThat(found).map(SessionEntity::getName).contains("here");
        assertThat(sessions.existsById(session.getId())).isTrue();
        assertThat(sessions.findById(UUID.randomUUID())).isEmpty();
        assertThat(sessions.existsById(UUID.randomUUID())).isFalse();
    }

    private SessionEntity newSession(UUID userId, String name, boolean favorite) {
        SessionEntity session = new SessionEntity();
        session.setUserId(userId);
        session.setName(name);
        session.setFavorite(favorite);
        return sessions.create(session);
    }

    private static List<String> names(List<SessionEntity> list) {
        return list.stream().map(SessionEntity::getName).toList();
    }

    private static void pause() throws InterruptedException {
        Thread.sleep(5);
    }
}
