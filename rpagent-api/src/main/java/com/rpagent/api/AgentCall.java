package com.rpagent.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;

/**
 * Call envelope posted to {@code /api/v1}, e.g.
 * <pre>
 * {"type": "ADD_RESOURCE_PROVIDER_CONFIG", "add_resource_provider_config": {"info": {...}}}
 * {"type": "REMOVE_RESOURCE_PROVIDER_CONFIG", "remove_resource_provider_config": {"type": "...", "name": "..."}}
 * </pre>
 * Only the section matching {@code type} is read.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AgentCall {

    private final CallType type;
    private final ConfigInfo addResourceProviderConfig;
    private final ConfigInfo updateResourceProviderConfig;
    private final ProviderIdentity removeResourceProviderConfig;

    @JsonCreator
    public AgentCall(
            @JsonProperty("type") CallType type,
            @JsonProperty("add_resource_provider_config") ConfigInfo addResourceProviderConfig,
            @JsonProperty("update_resource_provider_config") ConfigInfo updateResourceProviderConfig,
            @JsonProperty("remove_resource_provider_config") ProviderIdentity removeResourceProviderConfig) {
        this.type = type;
        this.addResourceProviderConfig = addResourceProviderConfig;
        this.updateResourceProviderConfig = updateResourceProviderConfig;
        this.removeResourceProviderConfig = removeResourceProviderConfig;
    }

    public static AgentCall add(ResourceProviderConfig info) {
        return new AgentCall(CallType.ADD_RESOURCE_PROVIDER_CONFIG, new ConfigInfo(info), null, null);
    }

    public static AgentCall update(ResourceProviderConfig info) {
        return new AgentCall(CallType.UPDATE_RESOURCE_PROVIDER_CONFIG, null, new ConfigInfo(info), null);
    }

    public static AgentCall remove(ProviderIdentity identity) {
        return new AgentCall(CallType.REMOVE_RESOURCE_PROVIDER_CONFIG, null, null, identity);
    }

    public static AgentCall getResourceProviders() {
        return new AgentCall(CallType.GET_RESOURCE_PROVIDERS, null, null, null);
    }

    public CallType getType() {
        return type;
    }

    @JsonProperty("add_resource_provider_config")
    public ConfigInfo getAddResourceProviderConfig() {
        return addResourceProviderConfig;
    }

    @JsonProperty("update_resource_provider_config")
    public ConfigInfo getUpdateResourceProviderConfig() {
        return updateResourceProviderConfig;
    }

    @JsonProperty("remove_resource_provider_config")
    public ProviderIdentity getRemoveResourceProviderConfig() {
        return removeResourceProviderConfig;
    }

    /** {@code {"info": <ResourceProviderConfig>}} section of add and update calls. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ConfigInfo {

        private final ResourceProviderConfig info;

        @JsonCreator
        public ConfigInfo(@JsonProperty("info") ResourceProviderConfig info) {
            this.info = info;
        }

        public ResourceProviderConfig getInfo() {
            return info;
        }
    }
}
