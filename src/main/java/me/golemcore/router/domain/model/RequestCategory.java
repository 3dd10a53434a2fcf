package me.golemcore.router.domain.model;

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

/**
 * Coarse topic of a request as seen by the complexity classifier.
 */
public enum RequestCategory {

    FACTUAL(false), GENERAL(false), CREATIVE(false), CODING(false), RESEARCH(false), BUSINESS_STRATEGY(
            true), MULTI_FILE_CODE(true);

    private final boolean inherentlyMultiStep;

    RequestCategory(boolean inherentlyMultiStep) {
        this.inherentlyMultiStep = inherentlyMultiStep;
    }

    /**
     * Categories that always go to the multi-agent path regardless of score.
     */
    public boolean isInherentlyMultiStep() {
        return inherentlyMultiStep;
    }
}
