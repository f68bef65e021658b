package com.rpagent.providerconfig;

/**
 * Service a plugin container serves. A plugin spec must not declare the same service in two
 * containers; the controller service (or, failing that, the node service) answers capacity queries.
 */
public enum ServiceRole {
    CONTROLLER_SERVICE,
    NODE_SERVICE
}
