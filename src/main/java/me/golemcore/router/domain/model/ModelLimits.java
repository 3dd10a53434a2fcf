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
 * Quota limits of a model: requests per minute, tokens per minute and requests
 * per day. A limit of {@code 0} admits nothing in that dimension.
 */
public record ModelLimits(int rpm, long tpm, int rpd) {

    public ModelLimits {
        if (rpm < 0 || tpm < 0 || rpd < 0) {
            throw new IllegalArgumentException("Limits must not be negative: rpm=" + rpm
                    + ", tpm=" + tpm + ", rpd=" + rpd);
        }
    }
}
