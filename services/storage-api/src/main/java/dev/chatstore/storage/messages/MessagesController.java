package dev.chatstore.storage.messages;

import dev.chatstore.storage.domain.PagedResult;
import dev.chatstore.storage.persistence.MessageEntity;
import dev.chatstore.storage.web.RateLimited;
import dev.chatstore.storage.web.ResourceNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequestMapping(value = "${chatstore.api-prefix:/api/v1}/sessions/{sessionId}/messages", produces = MediaType.APPLICATION_JSON_VALUE)
public class MessagesController {

    private final MessageService service;

    public MessagesController(MessageService service) {
        this.service = service;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @RateLimited("create-message")
    public ResponseEntity<MessageResponse> create(@PathVariable UUID sessionId,
                                                  @Valid @RequestBody CreateMessageRequest body) {
        MessageEntity message = service.createMessage(
                sessionId,
                new MessageService.NewMessage(body.sender(), body.content(), body.context())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(MessageResponse.from(message));
    }

    @GetMapping
    @RateLimited("get-messages")
    public MessageResponse.Page list(
            @PathVariable UUID sessionId,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit
    ) {
        PagedResult<MessageEntity> page = service.getSessionMessages(sessionId, skip, limit);
        return new MessageResponse.Page(
                page.items().stream().map(MessageResponse::from).toList(),
                page.total()
        );
    }

    @GetMapping("/{messageId}")
    @RateLimited("get-messages")
    public MessageResponse get(@PathVariable UUID sessionId, @PathVariable UUID messageId) {
        return MessageResponse.from(requireMessageInSession(sessionId, messageId));
    }

    @PatchMapping(value = "/{messageId}/status", consumes = MediaType.APPLICATION_JSON_VALUE)
    @RateLimited("update-message-status")
    public MessageResponse updateStatus(@PathVariable UUID sessionId,
                                        @PathVariable UUID messageId,
                                        @Valid @RequestBody UpdateMessageStatusRequest body) {
        requireMessageInSession(sessionId, messageId);
        return service.updateMessageStatus(messageId, body.status(), body.errorMessage())
                .map(MessageResponse::from)
                .orElseThrow(() -> messageNotFound(sessionId, messageId));
    }

    @DeleteMapping("/{messageId}")
    @RateLimited("delete-message")
    public ResponseEntity<Void> delete(@PathVariable UUID sessionId, @PathVariable UUID messageId) {
        requireMessageInSession(sessionId, messageId);
        if (!service.deleteMessage(messageId)) {
            throw messageNotFound(sessionId, messageId);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Resume the session's latest message. The path's message must belong to the session; the
     * message that is actually reset is always the latest one by timestamp.
     */
    @PostMapping("/{messageId}/resume")
    @RateLimited("resume-message")
    public MessageResponse.Resumed resume(@PathVariable UUID sessionId, @PathVariable UUID messageId) {
        requireMessageInSession(sessionId, messageId);
        return service.resumeFailedMessage(sessionId)
                .map(r -> new MessageResponse.Resumed(r.messageId(), r.status()))
                .orElseThrow(() -> messageNotFound(sessionId, messageId));
    }

    private MessageEntity requireMessageInSession(UUID sessionId, UUID messageId) {
        return service.getMessageById(messageId)
                .filter(m -> sessionId.equals(m.getSessionId()))
                .orElseThrow(() -> messageNotFound(sessionId, messageId));
    }

    private static ResourceNotFoundException messageNotFound(UUID sessionId, UUID messageId) {
        return new ResourceNotFoundException("Message " + messageId + " not found in session " + sessionId);
    }
}
