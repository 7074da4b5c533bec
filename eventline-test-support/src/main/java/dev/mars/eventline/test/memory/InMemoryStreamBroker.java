package dev.mars.eventline.test.memory;

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

import dev.mars.eventline.api.broker.StreamBroker;
import dev.mars.eventline.api.broker.StreamOffsets;
import dev.mars.eventline.api.broker.StreamRecord;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Append-only broker keeping each stream in memory. Offsets are sequence numbers starting at 1.
 */
public class InMemoryStreamBroker implements StreamBroker {

    private final Map<String, List<StreamRecord>> streams = new ConcurrentHashMap<>();

    @Override
    public synchronized Future<String> append(String stream, String data) {
        List<StreamRecord> records = streams.computeIfAbsent(stream, key -> new ArrayList<>());
        String offset = String.valueOf(records.size() + 1);
        records.add(new StreamRecord(stream, offset, data));
        return Future.succeededFuture(offset);
    }

    @Override
    public synchronized Future<List<StreamRecord>> readAfter(String stream, String offset, int maxCount) {
        List<StreamRecord> records = streams.getOrDefault(stream, List.of());
        return Future.succeededFuture(records.stream()
            .filter(record -> StreamOffsets.isAfter(record.offset(), offset))
            .limit(maxCount)
            .collect(Collectors.toList()));
    }

    @Override
    public synchronized Future<String> latestOffset(String stream) {
        List<StreamRecord> records = streams.getOrDefault(stream, List.of());
        return Future.succeededFuture(records.isEmpty() ? StreamOffsets.START : records.get(records.size() - 1).offset());
    }

    public synchronized List<StreamRecord> records(String stream) {
        return List.copyOf(streams.getOrDefault(stream, List.of()));
    }
}
