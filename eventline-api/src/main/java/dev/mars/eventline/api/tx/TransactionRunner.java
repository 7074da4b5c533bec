package dev.mars.eventline.api.tx;

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

import java.util.function.Function;

/**
 * Runs work inside a single transaction. The transaction commits when the returned
 * future succeeds and rolls back when it fails.
 *
 * @param <C> the transaction handle passed to persistence operations
 */
public interface TransactionRunner<C> {

    <T> Future<T> withTransaction(Function<C, Future<T>> work);
}
