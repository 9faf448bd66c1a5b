package io.github.drompincen.agentlink.gateway.controller;

import io.github.drompincen.agentlink.gateway.session.AgentSessionRegistry;
import io.github.drompincen.agentlink.protocol.api.ApprovalDecisionRequest;
import io.github.drompincen.agentlink.protocol.api.ApprovalScope;
import io.github.drompincen.agentlink.protocol.api.CreateSessionRequest;
import io.github.drompincen.agentlink.protocol.api.PermissionRequestDto;
import io.github.drompincen.agentlink.protocol.api.SendMessageRequest;
import io.github.drompincen.agentlink.protocol.api.SessionDto;
import io.github.drompincen.agentlink.protocol.api.SessionMode;
import io.github.drompincen.agentlink.protocol.api.SessionOptions;
import io.github.drompincen.agentlink.runtime.session.AgentSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final AgentSessionRegistry registry;

    public SessionController(AgentSessionRegistry registry) {
        this.registry = registry;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody(required = false) CreateSessionRequest req) {
        CreateSessionRequest request = req != null ? req : new CreateSessionRequest(null, null, null, null, null);
        try {
            return ResponseEntity.ok(registry.create(request).toDto());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping
    public List<SessionDto> list() {
        return registry.all().stream().map(AgentSession::toDto).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return withSession(id, s -> ResponseEntity.ok(s.toDto()));
    }

    @GetMapping("/{id}/turn")
    public ResponseEntity<?> currentTurn(@PathVariable String id) {
        return withSession(id, s -> ResponseEntity.ok(s.currentTurn()));
    }

    @GetMapping("/{id}/prompts")
    public ResponseEntity<?> pendingPrompts(@PathVariable String id) {
        return withSession(id, s -> ResponseEntity.ok(s.pendingPrompts()));
    }

    @GetMapping("/{id}/errors")
    public ResponseEntity<?> errors(@PathVariable String id) {
        return withSession(id, s -> ResponseEntity.ok(s.errors()));
    }

    @PostMapping("/{id}/messages")
    public ResponseEntity<?> sendMessage(@PathVariable String id, @RequestBody SendMessageRequest req) {
        if (req == null || req.content() == null || req.content().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "content is required"));
        }
        return withSession(id, s -> {
            s.sendMessage(req.content(), req.contextFiles()).exceptionally(e -> {
                log.warn("Message for session {} not delivered: {}", id, e.getMessage());
                return null;
            });
            return ResponseEntity.accepted().build();
        });
    }

    @PostMapping("/{id}/interrupt")
    public ResponseEntity<?> interrupt(@PathVariable String id) {
        return withSession(id, s -> s.interrupt()
                ? ResponseEntity.accepted().build()
                : ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "session is not connected")));
    }

    @PostMapping("/{id}/prompts/{requestId}")
    public ResponseEntity<?> decide(@PathVariable String id, @PathVariable String requestId,
                                    @RequestBody ApprovalDecisionRequest req) {
        return withSession(id, s -> ResponseEntity.ok(applyDecision(s, requestId, req)));
    }

    @PutMapping("/{id}/mode")
    public ResponseEntity<?> changeMode(@PathVariable String id, @RequestBody Map<String, String> body) {
        return withSession(id, s -> {
            s.changeMode(SessionMode.fromWire(body.get("mode")));
            return ResponseEntity.ok(s.toDto());
        });
    }

    @PutMapping("/{id}/model")
    public ResponseEntity<?> setModel(@PathVariable String id, @RequestBody Map<String, String> body) {
        return withSession(id, s -> {
            String model = body.get("model");
            if (model == null || model.isBlank()) throw new IllegalArgumentException("model is required");
            s.setModel(model);
            return ResponseEntity.ok(s.toDto());
        });
    }

    @PutMapping("/{id}/thinking")
    public ResponseEntity<?> setMaxThinkingTokens(@PathVariable String id, @RequestBody Map<String, Integer> body) {
        return withSession(id, s -> {
            Integer tokens = body.get("max_thinking_tokens");
            if (tokens == null || tokens < 0) throw new IllegalArgumentException("max_thinking_tokens must be >= 0");
            s.setMaxThinkingTokens(tokens);
            return ResponseEntity.ok(s.toDto());
        });
    }

    /** Stored only; the next connect restarts the remote process. */
    @PutMapping("/{id}/options")
    public ResponseEntity<?> changeOptions(@PathVariable String id, @RequestBody SessionOptions options) {
        return withSession(id, s -> {
            s.changeOptions(options);
            return ResponseEntity.ok(s.toDto());
        });
    }

    @PostMapping("/{id}/restart")
    public ResponseEntity<?> restart(@PathVariable String id) {
        return withSession(id, s -> {
            s.restart();
            return ResponseEntity.accepted().build();
        });
    }

    @PostMapping("/{id}/switch")
    public ResponseEntity<?> switchSession(@PathVariable String id, @RequestBody Map<String, Object> body) {
        return withSession(id, s -> {
            Object target = body.get("session_id");
            boolean resume = !Boolean.FALSE.equals(body.get("resume"));
            s.switchSession(target != null ? target.toString() : null, resume);
            return ResponseEntity.ok(s.toDto());
        });
    }

    @PostMapping("/{id}/new")
    public ResponseEntity<?> newSession(@PathVariable String id) {
        return withSession(id, s -> {
            s.newSession();
            return ResponseEntity.ok(s.toDto());
        });
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> close(@PathVariable String id) {
        return registry.close(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    private PermissionRequestDto applyDecision(AgentSession session, String requestId, ApprovalDecisionRequest req) {
        String decision = Optional.ofNullable(req.decision()).orElse("").toLowerCase(Locale.ROOT);
        switch (decision) {
            case "allow" -> {
                if (req.answers() != null) {
                    req.answers().forEach((question, answer) -> session.answerQuestion(requestId, question, answer));
                }
                if (req.nextMode() != null && !req.nextMode().isBlank()) {
                    return session.approvePlanExit(requestId, SessionMode.fromWire(req.nextMode()));
                }
                ApprovalScope scope = req.scope() == null ? null : ApprovalScope.fromDestination(req.scope())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown approval scope: " + req.scope()));
                return session.approve(requestId, req.updatedInput(), scope);
            }
            case "deny" -> {
                return session.deny(requestId, req.reason());
            }
            case "dismiss" -> {
                return session.dismiss(requestId);
            }
            default -> throw new IllegalArgumentException("decision must be allow, deny or dismiss");
        }
    }

    private ResponseEntity<?> withSession(String id, Function<AgentSession, ResponseEntity<?>> action) {
        Optional<AgentSession> session = registry.find(id);
        if (session.isEmpty()) return ResponseEntity.notFound().build();
        try {
            return action.apply(session.get());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }
}
