package dev.mars.eventline.core.consumer;

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

import dev.mars.eventline.api.broker.StreamBroker;
import dev.mars.eventline.api.broker.StreamOffsets;
import dev.mars.eventline.api.consumer.Consumer;
import dev.mars.eventline.core.uow.UnitOfWorkFactory;
import dev.mars.eventline.core.uow.UnitOfWorkResult;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Creates stored consumers for configured entries that do not exist yet. Existing
 * consumers keep their offsets.
 */
public class ConsumerRegistrar {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerRegistrar.class);

    private final UnitOfWorkFactory<?> unitOfWorkFactory;
    private final StreamBroker broker;

    public ConsumerRegistrar(UnitOfWorkFactory<?> unitOfWorkFactory, StreamBroker broker) {
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "UnitOfWorkFactory cannot be null");
        this.broker = Objects.requireNonNull(broker, "StreamBroker cannot be null");
    }

    /**
     * @return the consumers created by this call
     */
    public Future<List<Consumer>> register(List<ConsumerConfig> configs) {
        return unitOfWorkFactory.<List<Consumer>>execute(uow -> uow.consumers().list().compose(existing -> {
                Set<String> names = new HashSet<>();
                existing.forEach(consumer -> names.add(consumer.getName()));
                List<Consumer> created = new ArrayList<>();
                Future<Void> chain = Future.succeededFuture();
                for (ConsumerConfig config : configs) {
                    if (!names.add(config.name())) {
                        continue;
                    }
                    chain = chain.compose(v -> startOffset(config).compose(offset -> {
                        Consumer consumer = Consumer.create(config.stream(), config.name(), config.retroactive(), offset);
                        created.add(consumer);
                        logger.info("Registering consumer: name={}, stream={}, ackedId={}",
                            consumer.getName(), consumer.getStream(), consumer.getAckedId());
                        return uow.consumers().add(consumer);
                    }));
                }
                return chain.map(v -> created);
            }))
            .map(UnitOfWorkResult::value);
    }

    private Future<String> startOffset(ConsumerConfig config) {
        if (config.retroactive()) {
            return Future.succeededFuture(StreamOffsets.START);
        }
        return broker.latestOffset(config.stream());
    }
}
