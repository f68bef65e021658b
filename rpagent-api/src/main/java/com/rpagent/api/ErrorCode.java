package com.rpagent.api;

import jakarta.servlet.http.HttpServletResponse;

/** Error codes returned in {@link ErrorResponse}, each with the HTTP status it is sent with. */
public enum ErrorCode {

    INVALID_REQUEST(HttpServletResponse.SC_BAD_REQUEST),
    VALIDATION_ERROR(HttpServletResponse.SC_BAD_REQUEST),
    NOT_FOUND(HttpServletResponse.SC_NOT_FOUND),
    METHOD_NOT_ALLOWED(HttpServletResponse.SC_METHOD_NOT_ALLOWED),
    NOT_ACCEPTABLE(HttpServletResponse.SC_NOT_ACCEPTABLE),
    CONFLICT(HttpServletResponse.SC_CONFLICT),
    UNSUPPORTED_MEDIA_TYPE(HttpServletResponse.SC_UNSUPPORTED_MEDIA_TYPE),
    LAUNCH_FAILED(HttpServletResponse.SC_INTERNAL_SERVER_ERROR),
    STOP_FAILED(HttpServletResponse.SC_INTERNAL_SERVER_ERROR),
    STORE_ERROR(HttpServletResponse.SC_INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(HttpServletResponse.SC_INTERNAL_SERVER_ERROR),
    /** Neither the new nor the previous plugin runs; the new config is persisted. */
    DEGRADED_STATE(HttpServletResponse.SC_SERVICE_UNAVAILABLE);

    private final int status;

    ErrorCode(int status) {
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
