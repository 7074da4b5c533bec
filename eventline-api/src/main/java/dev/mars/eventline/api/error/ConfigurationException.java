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
 * Raised when a collaborator is missing or misconfigured, including any persistence
 * call made without a bound transaction handle.
 */
public class ConfigurationException extends EventlineException {

    public ConfigurationException(String message) {
        super(EventlineErrorCodes.CONFIGURATION_INVALID, message);
    }

    public ConfigurationException(String code, String message) {
        super(code, message);
    }

    public static ConfigurationException noActiveTransaction(String operation) {
        return new ConfigurationException(EventlineErrorCodes.NO_ACTIVE_TRANSACTION,
            "No active transaction bound for " + operation);
    }
}
