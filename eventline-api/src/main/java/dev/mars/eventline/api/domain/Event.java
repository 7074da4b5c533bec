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

/**
 * An immutable fact. Each event names the stream it belongs to in the form
 * {@code <domain>.<name>}; the stream doubles as the event's type discriminator.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface Event extends Message {

    String stream();

    default String eventType() {
        return stream();
    }

    /**
     * The prefix of the stream name before the first dot.
     */
    default String domain() {
        return Messages.domainOf(stream());
    }

    @Override
    default String messageType() {
        return eventType();
    }
}
