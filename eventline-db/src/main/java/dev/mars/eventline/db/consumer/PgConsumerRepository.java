package dev.mars.eventline.db.consumer;

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

import dev.mars.eventline.api.consumer.Consumer;
import dev.mars.eventline.api.consumer.ConsumerRepository;
import dev.mars.eventline.api.consumer.ConsumerState;
import dev.mars.eventline.api.domain.ChangeSet;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.ConsumerNotFoundException;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Consumer progress rows in the {@code consumer} table.
 *
 * <p>Updates are built from the consumer's {@link ChangeSet}, so an iteration that only
 * moved {@code acked_id} writes that single column, and an unchanged consumer issues
 * no statement at all.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgConsumerRepository implements ConsumerRepository<SqlConnection> {
    private static final Logger logger = LoggerFactory.getLogger(PgConsumerRepository.class);

    private static final Set<String> UPDATABLE_COLUMNS = Set.of(
        ConsumerState.STREAM, ConsumerState.NAME, ConsumerState.ACKED_ID, ConsumerState.RETROACTIVE);

    private static final String SELECT_ONE_SQL = """
        SELECT id, stream, name, acked_id, retroactive FROM consumer WHERE id = $1
        """;

    private static final String SELECT_ALL_SQL = """
        SELECT id, stream, name, acked_id, retroactive FROM consumer ORDER BY name
        """;

    private static final String INSERT_SQL = """
        INSERT INTO consumer (id, stream, name, acked_id, retroactive)
        VALUES ($1, $2, $3, $4, $5)
        """;

    @Override
    public Future<Consumer> get(SqlConnection tx, String consumerId) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("consumer read"));
        }
        return tx.preparedQuery(SELECT_ONE_SQL).execute(Tuple.of(consumerId))
            .compose(rows -> {
                if (rows.size() == 0) {
                    return Future.failedFuture(new ConsumerNotFoundException(consumerId));
                }
                return Future.succeededFuture(mapRow(rows.iterator().next()));
            });
    }

    @Override
    public Future<List<Consumer>> list(SqlConnection tx) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("consumer read"));
        }
        return tx.query(SELECT_ALL_SQL).execute()
            .map(rows -> {
                List<Consumer> consumers = new ArrayList<>(rows.size());
                for (Row row : rows) {
                    consumers.add(mapRow(row));
                }
                return consumers;
            });
    }

    @Override
    public Future<Void> add(SqlConnection tx, Consumer consumer) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("consumer write"));
        }
        Tuple params = Tuple.of(consumer.getId(), consumer.getStream(), consumer.getName(),
            consumer.getAckedId(), consumer.isRetroactive());
        return tx.preparedQuery(INSERT_SQL).execute(params)
            .<Void>map(rs -> {
                consumer.markPersisted();
                return null;
            })
            .onSuccess(v -> logger.info("Registered consumer {} on stream {} at offset {}",
                consumer.getName(), consumer.getStream(), consumer.getAckedId()));
    }

    @Override
    public Future<Void> update(SqlConnection tx, Consumer consumer) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("consumer write"));
        }
        ChangeSet changes = consumer.changes();
        if (changes.isEmpty()) {
            return Future.succeededFuture();
        }

        StringBuilder sql = new StringBuilder("UPDATE consumer SET ");
        List<Object> values = new ArrayList<>();
        for (String column : changes.fields()) {
            if (!UPDATABLE_COLUMNS.contains(column)) {
                return Future.failedFuture(new IllegalArgumentException("Unknown consumer column: " + column));
            }
            if (!values.isEmpty()) {
                sql.append(", ");
            }
            values.add(changes.get(column));
            sql.append(column).append(" = $").append(values.size());
        }
        values.add(consumer.getId());
        sql.append(" WHERE id = $").append(values.size());

        return tx.preparedQuery(sql.toString()).execute(Tuple.from(values))
            .compose(rs -> {
                if (rs.rowCount() == 0) {
                    return Future.<Void>failedFuture(new ConsumerNotFoundException(consumer.getId()));
                }
                consumer.markPersisted();
                logger.debug("Updated consumer {} columns {}", consumer.getName(), changes.fields());
                return Future.<Void>succeededFuture();
            });
    }

    private static Consumer mapRow(Row row) {
        return Consumer.restore(
            row.getString("id"),
            row.getString("stream"),
            row.getString("name"),
            row.getString("acked_id"),
            Boolean.TRUE.equals(row.getBoolean("retroactive")));
    }
}
