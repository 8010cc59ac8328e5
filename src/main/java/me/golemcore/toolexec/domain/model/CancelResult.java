package me.golemcore.toolexec.domain.model;

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
 * Output of {@code cancel}. Cancelling a finished invocation is a no-op that
 * reports {@code cancelled=false}.
 */
public record CancelResult(boolean cancelled, String message) {

    public static final String ALREADY_COMPLETED = "Already completed";

    public static CancelResult accepted(String message) {
        return new CancelResult(true, message);
    }

    public static CancelResult rejected(String message) {
        return new CancelResult(false, message);
    }
}
