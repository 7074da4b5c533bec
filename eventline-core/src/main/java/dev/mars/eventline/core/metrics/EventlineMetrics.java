package dev.mars.eventline.core.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Micrometer metrics for units of work, bus dispatch and consumer loops.
 *
 * <p>Every {@code record*} method is a no-op until {@link #bindTo(MeterRegistry)} has been
 * called, so components can be built before or without a registry.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class EventlineMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(EventlineMetrics.class);

    private final String instanceId;
    private volatile MeterRegistry registry;

    // Counters
    private Counter messagesHandled;
    private Counter handlerFailures;
    private Counter eventsAppended;
    private Counter outboxMessagesWritten;
    private Counter consumerRecordsProcessed;
    private Counter consumerIterationFailures;
    private Counter publishFailures;

    // Timers
    private Timer unitOfWorkCommitted;
    private Timer unitOfWorkRolledBack;

    public EventlineMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * Metrics that are never bound to a registry.
     */
    public static EventlineMetrics noop() {
        return new EventlineMetrics("noop");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        messagesHandled = Counter.builder("eventline.messages.handled")
            .description("Total number of messages taken off the bus queue")
            .tag("instance", instanceId)
            .register(registry);

        handlerFailures = Counter.builder("eventline.handler.failures")
            .description("Total number of handler invocations that failed")
            .tag("instance", instanceId)
            .register(registry);

        eventsAppended = Counter.builder("eventline.events.appended")
            .description("Total number of events appended to aggregate streams")
            .tag("instance", instanceId)
            .register(registry);

        outboxMessagesWritten = Counter.builder("eventline.outbox.written")
            .description("Total number of messages written to the outbox")
            .tag("instance", instanceId)
            .register(registry);

        consumerRecordsProcessed = Counter.builder("eventline.consumer.records.processed")
            .description("Total number of stream records dispatched and acknowledged")
            .tag("instance", instanceId)
            .register(registry);

        consumerIterationFailures = Counter.builder("eventline.consumer.iterations.failed")
            .description("Total number of consumer loop iterations that failed")
            .tag("instance", instanceId)
            .register(registry);

        publishFailures = Counter.builder("eventline.publish.failures")
            .description("Total number of external publish attempts that failed")
            .tag("instance", instanceId)
            .register(registry);

        unitOfWorkCommitted = Timer.builder("eventline.uow.duration")
            .description("Time from unit of work start to commit")
            .tag("instance", instanceId)
            .tag("outcome", "committed")
            .register(registry);

        unitOfWorkRolledBack = Timer.builder("eventline.uow.duration")
            .description("Time from unit of work start to rollback")
            .tag("instance", instanceId)
            .tag("outcome", "rolled_back")
            .register(registry);

        this.registry = registry;
        logger.info("Eventline metrics registered for instance: {}", instanceId);
    }

    public void recordMessageHandled(String messageType) {
        if (messagesHandled != null) {
            messagesHandled.increment();
        }
        if (registry != null) {
            Counter.builder("eventline.messages.handled.by.type")
                .tag("instance", instanceId)
                .tag("type", messageType)
                .register(registry)
                .increment();
        }
    }

    public void recordHandlerFailure(String handlerName) {
        if (handlerFailures != null) {
            handlerFailures.increment();
        }
        if (registry != null) {
            Counter.builder("eventline.handler.failures.by.handler")
                .tag("instance", instanceId)
                .tag("handler", handlerName)
                .register(registry)
                .increment();
        }
    }

    public void recordEventsAppended(int count) {
        if (eventsAppended != null) {
            eventsAppended.increment(count);
        }
    }

    public void recordOutboxMessages(int count) {
        if (outboxMessagesWritten != null) {
            outboxMessagesWritten.increment(count);
        }
    }

    public void recordPublishFailure() {
        if (publishFailures != null) {
            publishFailures.increment();
        }
    }

    public void recordConsumerRecords(String consumerName, int count) {
        if (consumerRecordsProcessed != null) {
            consumerRecordsProcessed.increment(count);
        }
        if (registry != null) {
            Counter.builder("eventline.consumer.records.processed.by.consumer")
                .tag("instance", instanceId)
                .tag("consumer", consumerName)
                .register(registry)
                .increment(count);
        }
    }

    public void recordConsumerFailure(String consumerId) {
        if (consumerIterationFailures != null) {
            consumerIterationFailures.increment();
        }
    }

    public void recordUnitOfWork(Duration duration, boolean committed) {
        Timer timer = committed ? unitOfWorkCommitted : unitOfWorkRolledBack;
        if (timer != null) {
            timer.record(duration);
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}
