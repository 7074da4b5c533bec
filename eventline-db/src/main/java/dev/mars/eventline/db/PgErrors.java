package dev.mars.eventline.db;

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

import io.vertx.pgclient.PgException;

/**
 * SQLSTATE inspection for failures raised by the reactive PostgreSQL client.
 */
public final class PgErrors {

    public static final String UNIQUE_VIOLATION = "23505";

    private PgErrors() {
        // Prevent instantiation
    }

    /**
     * Walks the cause chain to the first {@link PgException} and returns its SQLSTATE, or null.
     */
    public static String sqlState(Throwable t) {
        Throwable cause = t;
        while (cause != null && !(cause instanceof PgException)) {
            cause = cause.getCause();
        }
        return cause == null ? null : ((PgException) cause).getSqlState();
    }

    /**
     * True when {@code t} is a unique violation, on {@code constraint} if one is given.
     * The message check covers drivers that report the constraint only in the text.
     */
    public static boolean isUniqueViolation(Throwable t, String constraint) {
        if (t == null) {
            return false;
        }
        String message = t.getMessage();
        boolean namesConstraint = constraint == null || (message != null && message.contains(constraint));
        if (UNIQUE_VIOLATION.equals(sqlState(t))) {
            return namesConstraint;
        }
        return constraint != null && namesConstraint;
    }
}
