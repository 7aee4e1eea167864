package dev.chatstore.storage.sessions;

import dev.chatstore.storage.domain.PagedResult;
import dev.chatstore.storage.persistence.SessionEntity;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequestMapping(value = "${chatstore.api-prefix:/api/v1}/sessions", produces = MediaType.APPLICATION_JSON_VALUE)
public class SessionsController {

    private final SessionService service;

    public SessionsController(SessionService service) {
        this.service = service;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @RateLimited("create-session")
    public ResponseEntity<SessionResponse> create(@Valid @RequestBody CreateSessionRequest body) {
        SessionEntity session = service.createSession(
                new SessionService.NewSession(body.userId(), body.name(), body.isFavorite())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    @GetMapping
    @RateLimited("list-sessions")
    public SessionResponse.Page list(
            @RequestParam UUID userId,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit
    ) {
        PagedResult<SessionEntity> page = service.getUserSessions(userId, skip, limit);
        return new SessionResponse.Page(
                page.items().stream().map(SessionResponse::from).toList(),
                page.total()
        );
    }

    @GetMapping("/{sessionId}")
    @RateLimited("get-session")
    public SessionResponse get(@PathVariable UUID sessionId) {
        return service.getSessionById(sessionId)
                .map(SessionResponse::from)
                .orElseThrow(() -> sessionNotFound(sessionId));
    }

    @PutMapping(value = "/{sessionId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @RateLimited("update-session")
    public SessionResponse update(@PathVariable UUID sessionId, @Valid @RequestBody UpdateSessionRequest body) {
        return service.updateSessionName(sessionId, body.name())
                .map(SessionResponse::from)
                .orElseThrow(() -> sessionNotFound(sessionId));
    }

    @PatchMapping("/{sessionId}/favorite")
    @RateLimited("toggle-favorite")
    public SessionResponse toggleFavorite(@PathVariable UUID sessionId, @RequestParam boolean isFavorite) {
        return service.toggleFavorite(sessionId, isFavorite)
                .map(SessionResponse::from)
                .orElseThrow(() -> sessionNotFound(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    @RateLimited("delete-session")
    public ResponseEntity<Void> delete(@PathVariable UUID sessionId) {
        if (!service.deleteSession(sessionId)) {
            throw sessionNotFound(sessionId);
        }
        return ResponseEntity.noContent().build();
    }

    private static ResourceNotFoundException sessionNotFound(UUID sessionId) {
        return new ResourceNotFoundException("Session " + sessionId + " not found");
    }
}
