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
 * Standard error codes carried by every {@link EventlineException}.
 *
 * Error code ranges:
 * - EVLERR0001-0049: General/System errors
 * - EVLERR0100-0149: Configuration errors
 * - EVLERR0250-0299: Event Store errors
 * - EVLERR0400-0449: Message and codec errors
 * - EVLERR0450-0499: Consumer errors
 * - EVLERR0500-0549: Handler errors
 */
public final class EventlineErrorCodes {

    private EventlineErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "EVLERR0001";

    // ========================================================================
    // Configuration Errors (0100-0149)
    // ========================================================================
    public static final String CONFIGURATION_INVALID = "EVLERR0100";
    public static final String NO_ACTIVE_TRANSACTION = "EVLERR0101";
    public static final String HANDLER_ALREADY_REGISTERED = "EVLERR0102";
    public static final String EVENT_TYPES_MISSING = "EVLERR0103";

    // ========================================================================
    // Event Store Errors (0250-0299)
    // ========================================================================
    public static final String AGGREGATE_NOT_FOUND = "EVLERR0250";
    public static final String DUPLICATE_VERSION = "EVLERR0251";

    // ========================================================================
    // Message Errors (0400-0449)
    // ========================================================================
    public static final String UNKNOWN_EVENT_TYPE = "EVLERR0400";
    public static final String DUPLICATE_MESSAGE = "EVLERR0401";
    public static final String CODEC_FAILURE = "EVLERR0402";

    // ========================================================================
    // Consumer Errors (0450-0499)
    // ========================================================================
    public static final String CONSUMER_NOT_FOUND = "EVLERR0450";
    public static final String CONSUMER_LIMIT_EXCEEDED = "EVLERR0451";

    // ========================================================================
    // Handler Errors (0500-0549)
    // ========================================================================
    public static final String HANDLER_FAILED = "EVLERR0500";
}
