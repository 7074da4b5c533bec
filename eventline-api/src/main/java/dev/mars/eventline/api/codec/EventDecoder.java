package dev.mars.eventline.api.codec;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.eventline.api.domain.Event;

import java.io.IOException;

/**
 * Turns a stored JSON payload back into a typed event.
 */
@FunctionalInterface
public interface EventDecoder {

    Event decode(String json, ObjectMapper mapper) throws IOException;

    static EventDecoder of(Class<? extends Event> type) {
        return (json, mapper) -> mapper.readValue(json, type);
    }
}
