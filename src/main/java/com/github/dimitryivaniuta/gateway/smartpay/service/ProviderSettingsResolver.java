package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.config.AppProperties;
import com.github.dimitryivaniuta.gateway.smartpay.config.DeploymentEnvironment;
import com.github.dimitryivaniuta.gateway.smartpay.domain.PaymentServiceProvider;
import com.github.dimitryivaniuta.gateway.smartpay.repo.PaymentServiceProviderRepository;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.Credentials;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ProviderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads a PSP account with the credential set of the current deployment environment.
 */
@Service
public class ProviderSettingsResolver {

    private static final Logger log = LoggerFactory.getLogger(ProviderSettingsResolver.class);

    public static final String REFRESH_TOKEN_LIVE = "smartpay_refresh_token_live";
    public static final String REFRESH_TOKEN_TEST = "smartpay_refresh_token_test";
    public static final String SIGNING_KEY_LIVE = "smartpay_signing_key_live";
    public static final String SIGNING_KEY_TEST = "smartpay_signing_key_test";

    private final PaymentServiceProviderRepository providerRepository;
    private final ProviderSecretStore secretStore;
    private final AppProperties props;

    public ProviderSettingsResolver(
            PaymentServiceProviderRepository providerRepository,
            ProviderSecretStore secretStore,
            AppProperties props
    ) {
        this.providerRepository = providerRepository;
        this.secretStore = secretStore;
        this.props = props;
    }

    /**
     * Resolves settings and credentials.
     *
     * <p>Development and test deployments read the test credentials, acceptance and live the live ones.
     * A missing credential is returned as {@code null}; callers decide what that means.</p>
     *
     * @param providerId provider id
     * @return settings
     * @throws ProviderNotFoundException when no provider has this id
     */
    @Transactional(readOnly = true)
    public ProviderSettings resolve(Long providerId) {
        PaymentServiceProvider provider = providerRepository.findById(providerId)
                .orElseThrow(() -> new ProviderNotFoundException(providerId));

        DeploymentEnvironment environment = props.getEnvironment();
        boolean test = environment.usesTestCredentials();
        Credentials credentials = new Credentials(
                secretStore.find(providerId, test ? REFRESH_TOKEN_TEST : REFRESH_TOKEN_LIVE).orElse(null),
                secretStore.find(providerId, test ? SIGNING_KEY_TEST : SIGNING_KEY_LIVE).orElse(null)
        );
        log.debug("Resolved provider {} for {} with {}", providerId, environment, credentials);

        return new ProviderSettings(
                provider.getId(),
                provider.getTitle(),
                provider.getSuccessUrl(),
                provider.getFailUrl(),
                provider.getPendingUrl(),
                provider.getReturnUrl(),
                provider.getWebhookUrl(),
                credentials,
                environment.gatewayEnvironment()
        );
    }
}
