package me.golemcore.router.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.service.ModelRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans: clock, JSON mapper and the model registry.
 *
 * <p>
 * The registry is loaded once while the context starts; an invalid catalogue
 * fails startup with a {@link me.golemcore.router.domain.model.ModelRegistryException}.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class AutoConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ModelRegistry modelRegistry(ModelRegistryLoader loader, RouterProperties properties) {
        ModelRegistry registry = loader.load();
        log.info("GolemCore Router starting with {} models", registry.size());
        log.info("Providers configured: {}", properties.getProviders().keySet());
        log.info("Multi-agent collaborator: {}", properties.getCrew().isEnabled() ? properties.getCrew().getUrl()
                : "disabled");
        log.info("Context retrieval: {}", properties.getRag().isEnabled() ? properties.getRag().getUrl()
                : "disabled");
        return registry;
    }
}
