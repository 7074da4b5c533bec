package dev.mars.eventline.core.uow;

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

import dev.mars.eventline.api.error.DuplicateVersionException;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Opt-in retry for callers whose unit of work lost a concurrent append race. Each attempt
 * must build a fresh unit of work so aggregates are reloaded at their new version.
 *
 * <pre>{@code
 * RetryOnConflict.retry(3, () -> bus.handle(command));
 * }</pre>
 */
public final class RetryOnConflict {
    private static final Logger logger = LoggerFactory.getLogger(RetryOnConflict.class);

    private RetryOnConflict() {
    }

    public static <T> Future<T> retry(int maxAttempts, Supplier<Future<T>> operation) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        return attempt(1, maxAttempts, operation);
    }

    private static <T> Future<T> attempt(int attempt, int maxAttempts, Supplier<Future<T>> operation) {
        return operation.get().recover(error -> {
            if (isConflict(error) && attempt < maxAttempts) {
                logger.debug("Version conflict on attempt {}/{}, retrying: {}", attempt, maxAttempts, error.getMessage());
                return attempt(attempt + 1, maxAttempts, operation);
            }
            return Future.failedFuture(error);
        });
    }

    /**
     * True when {@code error} or one of its causes is a {@link DuplicateVersionException}.
     */
    public static boolean isConflict(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof DuplicateVersionException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
