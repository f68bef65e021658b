package com.rpagent.api;

/** Calls accepted on {@code /api/v1}. */
public enum CallType {
    ADD_RESOURCE_PROVIDER_CONFIG,
    UPDATE_RESOURCE_PROVIDER_CONFIG,
    REMOVE_RESOURCE_PROVIDER_CONFIG,
    GET_RESOURCE_PROVIDERS
}
