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

/**
 * The transactional scope handed to a handler. Everything reachable from here shares
 * one transaction: aggregate reads and appends, outbox writes, ledger entries and
 * consumer progress. Calls made outside the {@link UnitOfWorkState#ACTIVE} state fail
 * with {@link dev.mars.eventline.api.error.ConfigurationException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface UnitOfWork {

    AggregateRepository repository();

    TransactionalOutbox outbox();

    ProcessedMessages ledger();

    ConsumerStore consumers();

    UnitOfWorkState state();
}
