package dev.mars.eventline.core.bus;

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

import dev.mars.eventline.api.domain.Command;
import dev.mars.eventline.core.uow.UnitOfWork;
import io.vertx.core.Future;

/**
 * Performs the single state transition a command requests.
 *
 * @param <C> the command type
 */
@FunctionalInterface
public interface CommandHandler<C extends Command> {

    Future<Void> handle(UnitOfWork uow, C command);
}
