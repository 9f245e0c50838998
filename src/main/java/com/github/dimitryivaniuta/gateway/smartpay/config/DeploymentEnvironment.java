package com.github.dimitryivaniuta.gateway.smartpay.config;

import com.github.dimitryivaniuta.gateway.smartpay.psp.GatewayEnvironment;

/**
 * Environment this connector is deployed to.
 */
public enum DeploymentEnvironment {
    DEVELOPMENT,
    TEST,
    ACCEPTANCE,
    LIVE;

    /**
     * Test credentials are used for development and test deployments, live credentials otherwise.
     *
     * @return true when the test credential set applies
     */
    public boolean usesTestCredentials() {
        return this == DEVELOPMENT || this == TEST;
    }

    /**
     * Acceptance and live talk to the production gateway; everything else to the sandbox.
     *
     * @return gateway environment
     */
    public GatewayEnvironment gatewayEnvironment() {
        return this == ACCEPTANCE || this == LIVE ? GatewayEnvironment.PRODUCTION : GatewayEnvironment.SANDBOX;
    }
}
