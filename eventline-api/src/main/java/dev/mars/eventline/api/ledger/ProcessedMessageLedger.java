package dev.mars.eventline.api.ledger;

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

/**
 * Durable record of message ids whose effects are already committed.
 *
 * <p>Marking an id twice fails with
 * {@link dev.mars.eventline.api.error.DuplicateMessageException}.</p>
 *
 * @param <C> transaction handle type
 */
public interface ProcessedMessageLedger<C> {

    Future<Boolean> isProcessed(C tx, String messageId);

    Future<Void> markProcessed(C tx, String messageId);
}
