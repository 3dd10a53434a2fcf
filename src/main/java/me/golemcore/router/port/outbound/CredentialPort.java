package me.golemcore.router.port.outbound;

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

import java.util.Optional;

/**
 * Port for resolving provider API keys from an external secret store or the
 * process environment.
 */
public interface CredentialPort {

    /**
     * Returns the API key for a provider, or empty when none is configured.
     */
    Optional<String> getApiKeyForProvider(String provider);

    /**
     * Checks whether the provider has a usable key.
     */
    default boolean hasCredentials(String provider) {
        return getApiKeyForProvider(provider).isPresent();
    }
}
