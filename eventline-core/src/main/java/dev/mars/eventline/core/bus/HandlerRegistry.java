package dev.mars.eventline.core.bus;

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

import dev.mars.eventline.api.domain.Command;
import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.EventlineErrorCodes;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handlers known to a {@link MessageBus}. Events fan out to every handler registered for
 * their type, in registration order; each command type has exactly one handler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class HandlerRegistry {

    private final Map<String, List<RegisteredHandler<EventHandler<Event>>>> eventHandlers = new ConcurrentHashMap<>();
    private final Map<Class<? extends Command>, RegisteredHandler<CommandHandler<Command>>> commandHandlers =
        new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <E extends Event> HandlerRegistry onEvent(String eventType, String handlerName, EventHandler<E> handler) {
        requireName(handlerName);
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        List<RegisteredHandler<EventHandler<Event>>> handlers =
            eventHandlers.computeIfAbsent(eventType, key -> new CopyOnWriteArrayList<>());
        if (handlers.stream().anyMatch(existing -> existing.name().equals(handlerName))) {
            throw new ConfigurationException(EventlineErrorCodes.HANDLER_ALREADY_REGISTERED,
                "Handler '" + handlerName + "' already registered for event type " + eventType);
        }
        handlers.add(new RegisteredHandler<>(handlerName, (EventHandler<Event>) handler));
        return this;
    }

    @SuppressWarnings("unchecked")
    public <C extends Command> HandlerRegistry onCommand(Class<C> commandType, String handlerName,
                                                         CommandHandler<C> handler) {
        requireName(handlerName);
        if (commandType == null || handler == null) {
            throw new IllegalArgumentException("Command type and handler cannot be null");
        }
        RegisteredHandler<CommandHandler<Command>> registered =
            new RegisteredHandler<>(handlerName, (CommandHandler<Command>) handler);
        if (commandHandlers.putIfAbsent(commandType, registered) != null) {
            throw new ConfigurationException(EventlineErrorCodes.HANDLER_ALREADY_REGISTERED,
                "A handler is already registered for command " + commandType.getSimpleName());
        }
        return this;
    }

    public List<RegisteredHandler<EventHandler<Event>>> eventHandlers(String eventType) {
        return List.copyOf(eventHandlers.getOrDefault(eventType, List.of()));
    }

    public Optional<RegisteredHandler<CommandHandler<Command>>> commandHandler(Class<? extends Command> commandType) {
        return Optional.ofNullable(commandHandlers.get(commandType));
    }

    public Set<String> eventTypes() {
        return Set.copyOf(eventHandlers.keySet());
    }

    private static void requireName(String handlerName) {
        if (handlerName == null || handlerName.isBlank()) {
            throw new IllegalArgumentException("Handler name cannot be null or blank");
        }
    }
}
