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

import dev.mars.eventline.api.domain.DomainEvent;
import dev.mars.eventline.api.domain.Messages;

import java.time.Instant;

public record OrderItemAdded(String messageId, Instant createdAt, String aggregateId, String sku, int quantity,
                             long unitPriceCents) implements DomainEvent {

    public static final String STREAM = "order.item_added";

    public static OrderItemAdded of(String orderId, String sku, int quantity, long unitPriceCents) {
        return new OrderItemAdded(Messages.newId(), Messages.now(), orderId, sku, quantity, unitPriceCents);
    }

    @Override
    public String stream() {
        return STREAM;
    }
}
