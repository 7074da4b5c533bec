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

import dev.mars.eventline.api.domain.StateSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistent fields of a {@link Consumer}, keyed by column name.
 */
public record ConsumerState(String stream, String name, String ackedId, boolean retroactive)
    implements StateSnapshot {

    public static final String STREAM = "stream";
    public static final String NAME = "name";
    public static final String ACKED_ID = "acked_id";
    public static final String RETROACTIVE = "retroactive";

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(STREAM, stream);
        fields.put(NAME, name);
        fields.put(ACKED_ID, ackedId);
        fields.put(RETROACTIVE, retroactive);
        return fields;
    }
}
