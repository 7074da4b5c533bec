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
import dev.mars.eventline.api.error.HandlerException;
import dev.mars.eventline.test.categories.TestCategories;
import io.vertx.core.Future;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static dev.mars.eventline.core.InMemoryUnitOfWorks.await;
import static dev.mars.eventline.core.InMemoryUnitOfWorks.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class RetryOnConflictTest {

    @Test
    void retriesConflictsUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = await(RetryOnConflict.retry(3, () -> attempts.incrementAndGet() < 3
            ? Future.failedFuture(new DuplicateVersionException("order-1", 4))
            : Future.succeededFuture("done")));

        assertEquals("done", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void givesUpAfterMaxAttempts() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        Throwable failure = awaitFailure(RetryOnConflict.retry(2, () -> {
            attempts.incrementAndGet();
            return Future.failedFuture(new DuplicateVersionException("order-1", 4));
        }));

        assertTrue(failure instanceof DuplicateVersionException);
        assertEquals(2, attempts.get());
    }

    @Test
    void otherFailuresAreNotRetried() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        awaitFailure(RetryOnConflict.retry(5, () -> {
            attempts.incrementAndGet();
            return Future.failedFuture(new IllegalStateException("validation"));
        }));

        assertEquals(1, attempts.get());
    }

    @Test
    void conflictIsFoundInCauseChain() {
        HandlerException wrapped = new HandlerException("place-order", "cmd-1",
            new DuplicateVersionException("order-1", 2));

        assertTrue(RetryOnConflict.isConflict(wrapped));
        assertFalse(RetryOnConflict.isConflict(new RuntimeException(new IllegalStateException())));
        assertThrows(IllegalArgumentException.class, () -> RetryOnConflict.retry(0, Future::succeededFuture));
    }
}
