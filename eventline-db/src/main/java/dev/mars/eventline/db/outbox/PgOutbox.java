package dev.mars.eventline.db.outbox;

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

import dev.mars.eventline.api.codec.EncodedMessage;
import dev.mars.eventline.api.codec.MessageCodec;
import dev.mars.eventline.api.domain.Message;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.DuplicateMessageException;
import dev.mars.eventline.api.outbox.Outbox;
import dev.mars.eventline.db.PgErrors;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes messages into {@code message_outbox} on the caller's connection, so they commit
 * or roll back with the rest of the unit of work.
 */
public class PgOutbox implements Outbox<SqlConnection> {
    private static final Logger logger = LoggerFactory.getLogger(PgOutbox.class);

    private static final String INSERT_SQL = """
        INSERT INTO message_outbox (id, type, data, created)
        VALUES ($1, $2, $3::jsonb, $4)
        """;

    private final MessageCodec codec;

    public PgOutbox(MessageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "MessageCodec cannot be null");
    }

    @Override
    public Future<Void> send(SqlConnection tx, List<? extends Message> messages) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("outbox send"));
        }
        if (messages == null || messages.isEmpty()) {
            return Future.succeededFuture();
        }

        List<Tuple> batch = new ArrayList<>(messages.size());
        try {
            for (Message message : messages) {
                EncodedMessage encoded = codec.encode(message);
                batch.add(Tuple.of(encoded.id(), encoded.type(), new JsonObject(encoded.data()),
                    OffsetDateTime.ofInstant(message.createdAt(), ZoneOffset.UTC)));
            }
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        return tx.preparedQuery(INSERT_SQL).executeBatch(batch)
            .<Void>map(rs -> null)
            .recover(error -> {
                if (PgErrors.isUniqueViolation(error, "message_outbox_pkey")) {
                    return Future.failedFuture(new DuplicateMessageException(ids(messages), error));
                }
                return Future.failedFuture(error);
            })
            .onSuccess(v -> logger.debug("Wrote {} messages to outbox", batch.size()))
            .onFailure(error -> logger.error("Failed to write {} messages to outbox: {}",
                batch.size(), error.getMessage()));
    }

    private static String ids(List<? extends Message> messages) {
        return messages.stream().map(Message::messageId).collect(Collectors.joining(","));
    }
}
