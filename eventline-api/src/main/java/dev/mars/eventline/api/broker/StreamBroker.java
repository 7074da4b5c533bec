package dev.mars.eventline.api.broker;

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
 * An append-only, offset-addressable message stream provider.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface StreamBroker {

    /**
     * Appends an entry and returns the offset the broker assigned to it.
     */
    Future<String> append(String stream, String data);

    /**
     * Reads up to {@code maxCount} entries positioned strictly after {@code offset}, oldest first.
     */
    Future<List<StreamRecord>> readAfter(String stream, String offset, int maxCount);

    /**
     * Offset of the newest entry, or {@link StreamOffsets#START} for an empty stream.
     */
    Future<String> latestOffset(String stream);
}
