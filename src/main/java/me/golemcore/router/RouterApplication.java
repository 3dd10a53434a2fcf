package me.golemcore.router;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * GolemCore Router: routes chat requests across free-tier LLM models.
 *
 * <p>
 * Each request is scored for complexity, sent either directly to a model or to
 * a multi-agent collaborator, and failed over across models while respecting
 * per-model rate limits and a temporary blacklist.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → RouterController
 * Domain Layer       → RequestRouter, ModelSelector, UsageLedger, BlacklistManager
 * Infrastructure     → langchain4j, crew and LightRAG adapters
 * </pre>
 *
 * <p>
 * All configuration lives in {@code application.properties} under the
 * {@code router.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RouterApplication.class, args);
    }

}
