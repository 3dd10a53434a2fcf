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
 * Terminal outcome of routing a request.
 */
public enum RoutingStatus {

    RESPONDED,

    /** Every candidate is blacklisted, over a limit, or already tried. */
    NO_MODEL_AVAILABLE,

    /** Attempt budget spent on provider failures. */
    UPSTREAM_FAILURE,

    DEADLINE_EXCEEDED,

    CANCELLED
}
