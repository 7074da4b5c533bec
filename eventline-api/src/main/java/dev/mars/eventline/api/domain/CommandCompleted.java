package dev.mars.eventline.api.domain;

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

import java.time.Instant;

/**
 * Written to the outbox after an idempotent command handler succeeds, so that
 * clients can observe completion of the command they issued.
 */
public record CommandCompleted(
    String messageId,
    Instant createdAt,
    String commandId,
    String commandName,
    String clientId,
    CommandStatus status
) implements Event {

    public static final String STREAM = "eventline.command_completed";

    public static CommandCompleted success(Command command) {
        return new CommandCompleted(Messages.newId(), Messages.now(), command.messageId(),
            command.messageType(), command.clientId(), CommandStatus.SUCCESS);
    }

    @Override
    public String stream() {
        return STREAM;
    }
}
