package dev.mars.eventline.db.setup;

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

import dev.mars.eventline.db.EventlineDefaults;
import dev.mars.eventline.db.connection.PgConnectionManager;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Creates the Eventline tables from the bundled schema script. Every statement in the
 * script is {@code IF NOT EXISTS}, so running it against an initialized database is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class SchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(SchemaInitializer.class);

    private final PgConnectionManager connectionManager;
    private final String schema;
    private final String scriptResource;

    public SchemaInitializer(PgConnectionManager connectionManager, String schema) {
        this(connectionManager, schema, EventlineDefaults.SCHEMA_RESOURCE);
    }

    public SchemaInitializer(PgConnectionManager connectionManager, String schema, String scriptResource) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "PgConnectionManager cannot be null");
        this.schema = schema;
        this.scriptResource = Objects.requireNonNull(scriptResource, "scriptResource cannot be null");
    }

    public Future<Void> initializeSchema() {
        logger.info("Initializing Eventline schema from {}", scriptResource);

        return loadSchemaScript()
            .compose(this::executeSchemaScript)
            .onSuccess(v -> logger.info("Eventline schema initialized"))
            .onFailure(error -> logger.error("Failed to initialize Eventline schema", error));
    }

    private Future<String> loadSchemaScript() {
        try (InputStream is = getClass().getResourceAsStream(scriptResource)) {
            if (is == null) {
                return Future.failedFuture(new IllegalStateException("Schema script not found: " + scriptResource));
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return Future.succeededFuture(reader.lines().collect(Collectors.joining("\n")));
            }
        } catch (IOException e) {
            return Future.failedFuture(e);
        }
    }

    private Future<Void> executeSchemaScript(String sql) {
        List<String> statements = new ArrayList<>();
        if (schema != null && !schema.isBlank() && !"public".equalsIgnoreCase(schema.trim())) {
            String firstSchema = schema.split(",")[0].trim();
            statements.add("CREATE SCHEMA IF NOT EXISTS " + firstSchema);
        }
        statements.addAll(parseSqlStatements(sql));

        return connectionManager.withTransaction(conn -> {
            Future<Void> chain = Future.succeededFuture();
            for (String statement : statements) {
                chain = chain.compose(v -> {
                    logger.trace("Executing: {}...", statement.substring(0, Math.min(60, statement.length())));
                    return conn.query(statement).execute().<Void>mapEmpty();
                });
            }
            return chain;
        });
    }

    /**
     * Splits on semicolons, dropping {@code --} comment lines. The schema script holds no
     * function bodies, so dollar quoting is not handled.
     */
    static List<String> parseSqlStatements(String content) {
        String withoutComments = content.lines()
            .filter(line -> !line.trim().startsWith("--"))
            .collect(Collectors.joining("\n"));

        List<String> statements = new ArrayList<>();
        for (String part : withoutComments.split(";")) {
            String statement = part.trim();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }
}
