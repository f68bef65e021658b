package com.rpagent.api;

import com.rpagent.lifecycle.LifecycleCoordinator;
import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.validation.ConfigValidator;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Validates a decoded call and runs it against the {@link LifecycleCoordinator}. Operations run
 * on a dedicated executor and the calling thread waits for them, so an operation always runs to
 * completion even when the client goes away.
 */
public final class CallDispatcher {

    private final ConfigValidator validator;
    private final LifecycleCoordinator coordinator;
    private final ExecutorService operations;

    public CallDispatcher(ConfigValidator validator, LifecycleCoordinator coordinator, ExecutorService operations) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.operations = Objects.requireNonNull(operations, "operations");
    }

    /**
     * @return the 200 body for the call
     * @throws ApiException for a call without its required section
     * @throws RuntimeException the coordinator's or validator's failure, unchanged
     */
    public Object dispatch(AgentCall call) {
        if (call.getType() == null) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Missing call 'type'");
        }
        switch (call.getType()) {
            case ADD_RESOURCE_PROVIDER_CONFIG: {
                ResourceProviderConfig config = validator.requireValid(
                        info(call.getAddResourceProviderConfig(), "add_resource_provider_config"));
                return run(() -> OperationResponse.of(coordinator.add(config)));
            }
            case UPDATE_RESOURCE_PROVIDER_CONFIG: {
                ResourceProviderConfig config = validator.requireValid(
                        info(call.getUpdateResourceProviderConfig(), "update_resource_provider_config"));
                return run(() -> OperationResponse.of(coordinator.update(config)));
            }
            case REMOVE_RESOURCE_PROVIDER_CONFIG: {
                ProviderIdentity identity = call.getRemoveResourceProviderConfig();
                if (identity == null) {
                    throw new ApiException(ErrorCode.INVALID_REQUEST, "Missing 'remove_resource_provider_config'");
                }
                return run(() -> OperationResponse.of(coordinator.remove(identity)));
            }
            case GET_RESOURCE_PROVIDERS:
                return ResourceProvidersResponse.of(coordinator.describe());
            default:
                throw new ApiException(ErrorCode.INVALID_REQUEST, "Unsupported call type " + call.getType());
        }
    }

    private static ResourceProviderConfig info(AgentCall.ConfigInfo section, String field) {
        if (section == null || section.getInfo() == null) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Missing '" + field + ".info'");
        }
        return section.getInfo();
    }

    private <T> T run(Callable<T> operation) {
        Future<T> future = operations.submit(operation);
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(ErrorCode.INTERNAL_ERROR, "Interrupted while waiting for the operation; it continues in the background");
        }
    }
}
