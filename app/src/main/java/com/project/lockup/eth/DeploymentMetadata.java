package com.project.lockup.eth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of {@code deployments/<network>.json} written when a lockup is deployed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeploymentMetadata {

    @JsonProperty("address")
    private String address;

    @JsonProperty("token")
    private String token;

    @JsonProperty("network")
    private String network;

    @JsonProperty("deployer")
    private String deployer;

    @JsonProperty("deployedAt")
    private String deployedAt;

    /**
     * Address of the SimpleLockup contract.
     */
    public String address() {
        return address;
    }

    public String token() {
        return token;
    }

    public String network() {
        return network;
    }

    public String deployer() {
        return deployer;
    }

    public String deployedAt() {
        return deployedAt;
    }
}
