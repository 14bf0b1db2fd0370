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

package me.golemcore.governor.context;

/**
 * Estimates the input tokens of a payload before it is sent.
 *
 * @param <P>
 *            payload type
 */
@FunctionalInterface
public interface TokenEstimator<P> {

    int CHARS_PER_TOKEN = 4;

    int estimate(P payload);

    /**
     * Roughly four characters per token over {@code String.valueOf(payload)}.
     */
    static <P> TokenEstimator<P> characterBased() {
        return payload -> payload == null ? 0 : String.valueOf(payload).length() / CHARS_PER_TOKEN;
    }
}
