package dev.mars.eventline.api.error;

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
 * An event discriminator could not be resolved, either by the type registry while
 * decoding or by an aggregate's transition function.
 */
public class UnknownEventTypeException extends EventlineException {

    private final String eventType;

    public UnknownEventTypeException(String eventType) {
        super(EventlineErrorCodes.UNKNOWN_EVENT_TYPE, "Unknown event type: " + eventType);
        this.eventType = eventType;
    }

    public UnknownEventTypeException(String eventType, String context) {
        super(EventlineErrorCodes.UNKNOWN_EVENT_TYPE, "Unknown event type '" + eventType + "' for " + context);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
