package dev.mars.eventline.api.consumer;

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

import io.vertx.core.Future;

import java.util.List;

/**
 * Storage of consumer progress rows on a caller-supplied transaction.
 *
 * @param <C> transaction handle type
 */
public interface ConsumerRepository<C> {

    /**
     * Fails with {@link dev.mars.eventline.api.error.ConsumerNotFoundException} when absent.
     */
    Future<Consumer> get(C tx, String consumerId);

    Future<List<Consumer>> list(C tx);

    Future<Void> add(C tx, Consumer consumer);

    /**
     * Writes the consumer's changed columns; a consumer without changes is left untouched.
     */
    Future<Void> update(C tx, Consumer consumer);
}
