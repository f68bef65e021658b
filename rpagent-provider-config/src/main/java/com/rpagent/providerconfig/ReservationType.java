package com.rpagent.providerconfig;

/** How resources of a provider are reserved for a role. */
public enum ReservationType {
    STATIC,
    DYNAMIC
}
