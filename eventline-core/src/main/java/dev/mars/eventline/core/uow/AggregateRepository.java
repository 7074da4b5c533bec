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
import io.vertx.core.Future;

import java.util.List;

/**
 * Aggregate access bound to one unit of work. Every aggregate loaded or added is
 * remembered so its pending events are flushed when the unit of work completes.
 * Loading the same id twice returns the same instance.
 */
public interface AggregateRepository {

    /**
     * Fails with {@link dev.mars.eventline.api.error.AggregateNotFoundException} for an empty stream.
     */
    <A extends Aggregate> Future<A> get(String aggregateId, AggregateFactory<A> factory);

    <A extends Aggregate> Future<List<A>> getAll(List<String> aggregateIds, AggregateFactory<A> factory);

    /**
     * Tracks a newly created aggregate.
     */
    <A extends Aggregate> A add(A aggregate);

    Future<Boolean> exists(String aggregateId);

    List<Aggregate> seen();
}
