package com.eainde.augury.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class SessionNotFoundException extends AuguryException {

    public SessionNotFoundException(String sessionId) {
        super("No active session: " + sessionId);
    }
}
