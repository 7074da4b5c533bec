package dev.mars.eventline.db.ledger;

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

import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.DuplicateMessageException;
import dev.mars.eventline.api.ledger.ProcessedMessageLedger;
import dev.mars.eventline.db.PgErrors;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code processed_messages} backed ledger. The primary key makes a second mark of the
 * same id fail, so two racing deliveries cannot both commit.
 */
public class PgProcessedMessageLedger implements ProcessedMessageLedger<SqlConnection> {
    private static final Logger logger = LoggerFactory.getLogger(PgProcessedMessageLedger.class);

    private static final String EXISTS_SQL = """
        SELECT EXISTS (SELECT 1 FROM processed_messages WHERE id = $1) AS processed
        """;

    private static final String INSERT_SQL = """
        INSERT INTO processed_messages (id, processed_at) VALUES ($1, now())
        """;

    @Override
    public Future<Boolean> isProcessed(SqlConnection tx, String messageId) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("ledger read"));
        }
        return tx.preparedQuery(EXISTS_SQL).execute(Tuple.of(messageId))
            .map(rows -> rows.iterator().next().getBoolean("processed"));
    }

    @Override
    public Future<Void> markProcessed(SqlConnection tx, String messageId) {
        if (tx == null) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction("ledger write"));
        }
        return tx.preparedQuery(INSERT_SQL).execute(Tuple.of(messageId))
            .<Void>map(rs -> null)
            .recover(error -> {
                if (PgErrors.isUniqueViolation(error, "processed_messages_pkey")) {
                    logger.debug("Message {} already marked as processed", messageId);
                    return Future.failedFuture(new DuplicateMessageException(messageId, error));
                }
                return Future.failedFuture(error);
            });
    }
}
