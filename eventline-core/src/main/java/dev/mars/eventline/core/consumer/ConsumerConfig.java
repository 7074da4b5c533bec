package dev.mars.eventline.core.consumer;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.core.bus.EventHandler;

import java.util.Objects;

/**
 * Declares a consumer of a broker stream.
 *
 * @param stream      broker stream to follow
 * @param name        unique consumer name, also used as the handler name on the bus
 * @param handler     handler registered on the bus for the stream's event type; may be null
 *                    when handlers are registered separately
 * @param retroactive start from the beginning of the stream instead of its current tip
 */
public record ConsumerConfig(String stream, String name, EventHandler<? extends Event> handler, boolean retroactive) {

    public ConsumerConfig {
        Objects.requireNonNull(stream, "Consumer stream cannot be null");
        Objects.requireNonNull(name, "Consumer name cannot be null");
    }
}
