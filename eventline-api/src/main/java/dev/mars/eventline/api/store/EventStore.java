package dev.mars.eventline.api.store;

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
import dev.mars.eventline.api.domain.DomainEvent;
import io.vertx.core.Future;

import java.util.List;

/**
 * Append-only persistence of aggregate event streams. Every operation runs on the
 * transaction handle it is given and never opens one of its own.
 *
 * <p>Failures are reported through the returned future:</p>
 * <ul>
 *   <li>{@link dev.mars.eventline.api.error.ConfigurationException} when {@code tx} is null</li>
 *   <li>{@link dev.mars.eventline.api.error.DuplicateVersionException} when a version is already taken</li>
 *   <li>{@link dev.mars.eventline.api.error.AggregateNotFoundException} when a stream has no events</li>
 *   <li>{@link dev.mars.eventline.api.error.UnknownEventTypeException} when a stored type is not registered</li>
 * </ul>
 *
 * @param <C> transaction handle type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface EventStore<C> {

    /**
     * Writes {@code events} as versions {@code currentVersion + 1}, {@code currentVersion + 2}, ...
     * in order. All rows are written or none.
     */
    Future<Void> append(C tx, String aggregateId, List<? extends DomainEvent> events, long currentVersion);

    /**
     * Loads the stream in version order and rebuilds the aggregate by replay.
     */
    <A extends Aggregate> Future<A> get(C tx, String aggregateId, AggregateFactory<A> factory);

    Future<Boolean> exists(C tx, String aggregateId);

    /**
     * The highest persisted version, or {@link Aggregate#NO_VERSION} for an empty stream.
     */
    Future<Long> currentVersion(C tx, String aggregateId);
}
