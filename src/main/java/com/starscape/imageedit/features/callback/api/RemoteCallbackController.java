package com.starscape.imageedit.features.callback.api;

import com.starscape.imageedit.features.callback.api.dto.CallbackResponse;
import com.starscape.imageedit.features.callback.app.CallbackEventParser;
import com.starscape.imageedit.features.callback.app.TaskCallbackHandler;
import com.starscape.imageedit.features.callback.domain.CallbackEvent;
import com.starscape.imageedit.features.callback.domain.CallbackOutcome;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Webhook the remote service calls when a task finishes.
 * The body is read raw so that unparseable payloads are acknowledged too.
 */
@RestController
public class RemoteCallbackController {

    private final CallbackEventParser parser;
    private final TaskCallbackHandler callbackHandler;

    public RemoteCallbackController(CallbackEventParser parser, TaskCallbackHandler callbackHandler) {
        this.parser = parser;
        this.callbackHandler = callbackHandler;
    }

    @PostMapping("/rhcallback")
    public ResponseEntity<CallbackResponse> onCallback(@RequestBody(required = false) String body) {
        CallbackEvent event = parser.parse(body);
        CallbackOutcome outcome = callbackHandler.onCallback(event);
        return ResponseEntity.ok(CallbackResponse.of(outcome));
    }
}
