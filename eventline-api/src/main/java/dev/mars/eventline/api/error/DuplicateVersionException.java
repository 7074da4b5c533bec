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
 * A concurrent writer already persisted the stream position this append targeted.
 * The enclosing transaction is rolled back; retrying is left to the caller.
 */
public class DuplicateVersionException extends EventlineException {

    private final String aggregateId;
    private final long version;

    public DuplicateVersionException(String aggregateId, long version) {
        this(aggregateId, version, null);
    }

    public DuplicateVersionException(String aggregateId, long version, Throwable cause) {
        super(EventlineErrorCodes.DUPLICATE_VERSION,
            "Version " + version + " already exists for aggregate " + aggregateId, cause);
        this.aggregateId = aggregateId;
        this.version = version;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getVersion() {
        return version;
    }
}
