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

import dev.mars.eventline.api.domain.DomainEvent;

import java.util.List;

/**
 * Outcome of a committed unit of work.
 *
 * @param value  what the work returned
 * @param events events drained from every touched aggregate, in flush order
 */
public record UnitOfWorkResult<T>(T value, List<DomainEvent> events) {

    public UnitOfWorkResult {
        events = List.copyOf(events);
    }
}
