package dev.mars.eventline.core.uow;

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

import dev.mars.eventline.api.domain.Aggregate;
import dev.mars.eventline.api.domain.AggregateFactory;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.store.EventStore;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

class TransactionalAggregateRepository<C> implements AggregateRepository {

    private final C tx;
    private final EventStore<C> eventStore;
    private final BooleanSupplier active;
    private final Map<String, Aggregate> seen = new LinkedHashMap<>();

    TransactionalAggregateRepository(C tx, EventStore<C> eventStore, BooleanSupplier active) {
        this.tx = tx;
        this.eventStore = eventStore;
        this.active = active;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <A extends Aggregate> Future<A> get(String aggregateId, AggregateFactory<A> factory) {
        return requireActive("aggregate access").compose(v -> {
            Aggregate known;
            synchronized (seen) {
                known = seen.get(aggregateId);
            }
            if (known != null) {
                return Future.succeededFuture((A) known);
            }
            return eventStore.get(tx, aggregateId, factory).map(this::track);
        });
    }

    @Override
    public <A extends Aggregate> Future<List<A>> getAll(List<String> aggregateIds, AggregateFactory<A> factory) {
        List<A> loaded = new ArrayList<>(aggregateIds.size());
        Future<Void> chain = Future.succeededFuture();
        for (String id : aggregateIds) {
            chain = chain.compose(v -> get(id, factory).map(aggregate -> {
                loaded.add(aggregate);
                return null;
            }));
        }
        return chain.map(v -> loaded);
    }

    @Override
    public <A extends Aggregate> A add(A aggregate) {
        if (!active.getAsBoolean()) {
            throw ConfigurationException.noActiveTransaction("aggregate add");
        }
        return track(aggregate);
    }

    @Override
    public Future<Boolean> exists(String aggregateId) {
        return requireActive("aggregate access").compose(v -> eventStore.exists(tx, aggregateId));
    }

    @Override
    public List<Aggregate> seen() {
        synchronized (seen) {
            return List.copyOf(seen.values());
        }
    }

    private Future<Void> requireActive(String operation) {
        if (!active.getAsBoolean()) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction(operation));
        }
        return Future.succeededFuture();
    }

    private <A extends Aggregate> A track(A aggregate) {
        synchronized (seen) {
            Aggregate existing = seen.putIfAbsent(aggregate.getId(), aggregate);
            if (existing != null && existing != aggregate) {
                throw new IllegalStateException("Aggregate " + aggregate.getId()
                    + " is already tracked by this unit of work as a different instance");
            }
        }
        return aggregate;
    }
}
