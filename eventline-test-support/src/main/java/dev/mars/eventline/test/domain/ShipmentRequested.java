package dev.mars.eventline.test.domain;

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
import dev.mars.eventline.api.domain.Messages;

import java.time.Instant;

/**
 * An event from another domain, as delivered through a broker stream.
 */
public record ShipmentRequested(String messageId, Instant createdAt, String orderId, String carrier) implements Event {

    public static final String STREAM = "shipping.requested";

    public static ShipmentRequested of(String orderId, String carrier) {
        return new ShipmentRequested(Messages.newId(), Messages.now(), orderId, carrier);
    }

    @Override
    public String stream() {
        return STREAM;
    }
}
