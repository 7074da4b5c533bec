package dev.mars.eventline.api.domain;

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

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Helpers for building message envelopes.
 */
public final class Messages {

    private Messages() {
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Current time at microsecond precision, the resolution PostgreSQL stores.
     */
    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public static String domainOf(String stream) {
        if (stream == null) {
            return "";
        }
        int dot = stream.indexOf('.');
        return dot < 0 ? stream : stream.substring(0, dot);
    }
}
