package dev.mars.eventline.api.error;

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

/**
 * Wraps a failure raised inside a registered command handler so the caller of the
 * bus can tell handler errors apart from dispatch errors. The original failure is
 * available as the cause.
 */
public class HandlerException extends EventlineException {

    private final String handlerName;
    private final String messageId;

    public HandlerException(String handlerName, String messageId, Throwable cause) {
        super(EventlineErrorCodes.HANDLER_FAILED,
            "Handler '" + handlerName + "' failed for message " + messageId + ": " + describe(cause), cause);
        this.handlerName = handlerName;
        this.messageId = messageId;
    }

    public String getHandlerName() {
        return handlerName;
    }

    public String getMessageId() {
        return messageId;
    }

    private static String describe(Throwable cause) {
        return cause == null ? "unknown" : cause.getMessage();
    }
}
