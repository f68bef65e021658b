package com.rpagent.api;

import com.rpagent.lifecycle.ConfigConflictException;
import com.rpagent.lifecycle.ConfigNotFoundException;
import com.rpagent.lifecycle.DegradedStateException;
import com.rpagent.plugin.LaunchException;
import com.rpagent.plugin.StopException;
import com.rpagent.providerconfig.store.ConfigStoreException;
import com.rpagent.providerconfig.store.CorruptRecordException;
import com.rpagent.providerconfig.validation.ConfigValidationException;

/** Maps failures of a call to the error code (and so the HTTP status) of the response. */
final class ErrorMapper {

    private ErrorMapper() {
    }

    static ErrorCode codeFor(Throwable t) {
        if (t instanceof ApiException) return ((ApiException) t).getCode();
        if (t instanceof ConfigValidationException) return ErrorCode.VALIDATION_ERROR;
        if (t instanceof ConfigConflictException) return ErrorCode.CONFLICT;
        if (t instanceof ConfigNotFoundException) return ErrorCode.NOT_FOUND;
        if (t instanceof DegradedStateException) return ErrorCode.DEGRADED_STATE;
        if (t instanceof LaunchException) return ErrorCode.LAUNCH_FAILED;
        if (t instanceof StopException) return ErrorCode.STOP_FAILED;
        if (t instanceof ConfigStoreException || t instanceof CorruptRecordException) return ErrorCode.STORE_ERROR;
        return ErrorCode.INTERNAL_ERROR;
    }
}
