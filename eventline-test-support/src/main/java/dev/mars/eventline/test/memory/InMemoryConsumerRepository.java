package dev.mars.eventline.test.memory;

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

import dev.mars.eventline.api.consumer.Consumer;
import dev.mars.eventline.api.consumer.ConsumerRepository;
import dev.mars.eventline.api.consumer.ConsumerState;
import dev.mars.eventline.api.domain.ChangeSet;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.ConsumerNotFoundException;
import io.vertx.core.Future;

import java.util.List;
import java.util.stream.Collectors;

public class InMemoryConsumerRepository implements ConsumerRepository<InMemoryTransaction> {

    @Override
    public Future<Consumer> get(InMemoryTransaction tx, String consumerId) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("consumer read"));
        }
        return tx.consumer(consumerId)
            .map(row -> Future.succeededFuture(row.toConsumer()))
            .orElseGet(() -> Future.failedFuture(new ConsumerNotFoundException(consumerId)));
    }

    @Override
    public Future<List<Consumer>> list(InMemoryTransaction tx) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("consumer read"));
        }
        return Future.succeededFuture(tx.consumers().stream().map(ConsumerRow::toConsumer).collect(Collectors.toList()));
    }

    @Override
    public Future<Void> add(InMemoryTransaction tx, Consumer consumer) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("consumer write"));
        }
        boolean nameTaken = tx.consumers().stream().anyMatch(row -> row.name().equals(consumer.getName()));
        if (nameTaken) {
            return Future.failedFuture(new IllegalStateException("Consumer name already exists: " + consumer.getName()));
        }
        tx.stageConsumer(ConsumerRow.of(consumer));
        tx.database().recordConsumerWrite();
        consumer.markPersisted();
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> update(InMemoryTransaction tx, Consumer consumer) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("consumer write"));
        }
        ChangeSet changes = consumer.changes();
        if (changes.isEmpty()) {
            return Future.succeededFuture();
        }
        return tx.consumer(consumer.getId())
            .map(row -> {
                ConsumerRow updated = changes.contains(ConsumerState.ACKED_ID)
                    ? row.withAckedId((String) changes.get(ConsumerState.ACKED_ID))
                    : row;
                tx.stageConsumer(updated);
                tx.database().recordConsumerWrite();
                consumer.markPersisted();
                return Future.<Void>succeededFuture();
            })
            .orElseGet(() -> Future.failedFuture(new ConsumerNotFoundException(consumer.getId())));
    }
}
