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

package me.golemcore.governor.routing;

import me.golemcore.governor.domain.model.FallbackEvent;

/**
 * Notified synchronously, on the calling thread, before a call is sent to a
 * backend other than the primary. Exceptions thrown here are logged and do not
 * affect routing.
 */
@FunctionalInterface
public interface FallbackListener {

    void onFallback(FallbackEvent event);
}
