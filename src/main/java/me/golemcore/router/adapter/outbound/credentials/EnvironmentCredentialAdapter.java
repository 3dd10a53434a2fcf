package me.golemcore.router.adapter.outbound.credentials;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.CredentialPort;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves provider API keys from configuration.
 *
 * <p>
 * An explicit {@code router.providers.<p>.api-key} wins; otherwise the
 * variable named by {@code api-key-env} is read through the Spring
 * {@link Environment}, so system properties and OS environment both work.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnvironmentCredentialAdapter implements CredentialPort {

    private static final int MIN_PLAUSIBLE_KEY_LENGTH = 20;

    private final RouterProperties properties;
    private final Environment environment;

    @Override
    public Optional<String> getApiKeyForProvider(String provider) {
        RouterProperties.ProviderProperties config = properties.getProviders().get(provider);
        if (config == null) {
            log.debug("[Credentials] No configuration for provider {}", provider);
            return Optional.empty();
        }

        String key = config.getApiKey();
        if ((key == null || key.isBlank()) && config.getApiKeyEnv() != null && !config.getApiKeyEnv().isBlank()) {
            key = environment.getProperty(config.getApiKeyEnv());
        }
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }

        String trimmed = key.strip();
        if (trimmed.length() < MIN_PLAUSIBLE_KEY_LENGTH || trimmed.contains(" ")) {
            log.warn("[Credentials] API key for {} looks malformed (length {})", provider, trimmed.length());
        }
        return Optional.of(trimmed);
    }
}
