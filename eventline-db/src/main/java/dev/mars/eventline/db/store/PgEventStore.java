package dev.mars.eventline.db.store;

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

import dev.mars.eventline.api.codec.MessageCodec;
import dev.mars.eventline.api.domain.Aggregate;
import dev.mars.eventline.api.domain.AggregateFactory;
import dev.mars.eventline.api.domain.DomainEvent;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.DuplicateVersionException;
import dev.mars.eventline.api.store.EventStore;
import dev.mars.eventline.api.store.EventStreams;
import dev.mars.eventline.api.store.StoredEvent;
import dev.mars.eventline.db.PgErrors;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL event store over the {@code events} table.
 *
 * <p>Optimistic concurrency rests on the {@code events_stream_version_key} unique
 * constraint: two writers appending the same version to one stream cannot both commit,
 * and the loser sees a {@link DuplicateVersionException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgEventStore implements EventStore<SqlConnection> {
    private static final Logger logger = LoggerFactory.getLogger(PgEventStore.class);

    static final String VERSION_CONSTRAINT = "events_stream_version_key";

    private static final String INSERT_SQL = """
        INSERT INTO events (id, stream_id, type, version, created, data)
        VALUES ($1, $2, $3, $4, $5, $6::jsonb)
        """;

    private static final String SELECT_STREAM_SQL = """
        SELECT id, stream_id, type, version, created, data::text AS data
        FROM events
        WHERE stream_id = $1
        ORDER BY version ASC
        """;

    private static final String SELECT_VERSION_SQL = """
        SELECT MAX(version) AS version FROM events WHERE stream_id = $1
        """;

    private final MessageCodec codec;

    public PgEventStore(MessageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "MessageCodec cannot be null");
    }

    @Override
    public Future<Void> append(SqlConnection tx, String aggregateId, List<? extends DomainEvent> events,
                               long currentVersion) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("event append"));
        }
        if (events == null || events.isEmpty()) {
            return Future.succeededFuture();
        }

        List<Tuple> batch = new ArrayList<>(events.size());
        try {
            for (StoredEvent row : EventStreams.toRows(codec, aggregateId, events, currentVersion)) {
                batch.add(Tuple.of(row.id(), row.streamId(), row.type(), row.version(),
                    OffsetDateTime.ofInstant(row.created(), ZoneOffset.UTC), new JsonObject(row.data())));
            }
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        long firstVersion = currentVersion + 1;
        return tx.preparedQuery(INSERT_SQL).executeBatch(batch)
            .<Void>map(rs -> null)
            .recover(error -> {
                if (PgErrors.isUniqueViolation(error, VERSION_CONSTRAINT)) {
                    return Future.failedFuture(new DuplicateVersionException(aggregateId, firstVersion, error));
                }
                return Future.failedFuture(error);
            })
            .onSuccess(v -> logger.debug("Appended {} events to stream {} from version {}",
                batch.size(), aggregateId, firstVersion))
            .onFailure(error -> {
                if (error instanceof DuplicateVersionException) {
                    logger.debug("Version conflict on stream {}: {}", aggregateId, error.getMessage());
                } else {
                    logger.error("Failed to append events to stream {}: {}", aggregateId, error.getMessage());
                }
            });
    }

    @Override
    public <A extends Aggregate> Future<A> get(SqlConnection tx, String aggregateId, AggregateFactory<A> factory) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("event read"));
        }
        return tx.preparedQuery(SELECT_STREAM_SQL).execute(Tuple.of(aggregateId))
            .map(rows -> {
                List<StoredEvent> stored = new ArrayList<>(rows.size());
                for (Row row : rows) {
                    stored.add(mapRow(row));
                }
                return EventStreams.replay(codec, aggregateId, stored, factory);
            });
    }

    @Override
    public Future<Boolean> exists(SqlConnection tx, String aggregateId) {
        return currentVersion(tx, aggregateId).map(version -> version > Aggregate.NO_VERSION);
    }

    @Override
    public Future<Long> currentVersion(SqlConnection tx, String aggregateId) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("event read"));
        }
        return tx.preparedQuery(SELECT_VERSION_SQL).execute(Tuple.of(aggregateId))
            .map(rows -> {
                Long version = rows.iterator().next().getLong("version");
                return version == null ? Aggregate.NO_VERSION : version;
            });
    }

    private StoredEvent mapRow(Row row) {
        return new StoredEvent(
            row.getString("id"),
            row.getString("stream_id"),
            row.getString("type"),
            row.getLong("version"),
            row.getOffsetDateTime("created").toInstant(),
            row.getString("data"));
    }
}
