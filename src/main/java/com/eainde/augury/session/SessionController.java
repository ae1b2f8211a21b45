package com.eainde.augury.session;

import com.eainde.augury.conversation.ModificationResult;
import com.eainde.augury.conversation.TurnReply;
import com.eainde.augury.error.InputValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Log4j2
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    public ResponseEntity<SessionStarted> start(@RequestBody StartSessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.startSession(request.question()));
    }

    @PostMapping("/{sessionId}/turns")
    public TurnReply submitTurn(@PathVariable String sessionId, @RequestBody TurnRequest request) {
        return sessionService.submitTurn(sessionId, request.text());
    }

    @PutMapping("/{sessionId}/fields/{field}")
    public ModificationResult modifyField(@PathVariable String sessionId, @PathVariable String field,
                                          @RequestBody FieldUpdateRequest request) {
        return sessionService.modifyField(sessionId, field, request.value());
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> abandon(@PathVariable String sessionId) {
        sessionService.abandonSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    /** Invalid values are a re-prompt, not a server error. */
    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<Map<String, String>> invalidInput(InputValidationException e) {
        log.debug("Rejected value for {}: {}", e.getField(), e.getReason());
        return ResponseEntity.unprocessableEntity().body(Map.of(
                "field", e.getField(),
                "message", "Please provide a different value: " + e.getReason()));
    }
}
