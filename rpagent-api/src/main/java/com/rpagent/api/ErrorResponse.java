package com.rpagent.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of every non-200 response: {@code {"code": "...", "message": "..."}}. */
public final class ErrorResponse {

    private final ErrorCode code;
    private final String message;

    @JsonCreator
    public ErrorResponse(@JsonProperty("code") ErrorCode code, @JsonProperty("message") String message) {
        this.code = code;
        this.message = message;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
