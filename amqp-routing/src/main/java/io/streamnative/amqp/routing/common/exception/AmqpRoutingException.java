/**
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
package io.streamnative.amqp.routing.common.exception;

import lombok.Getter;
import org.apache.qpid.server.protocol.ErrorCodes;

/**
 * Base class of the errors raised by the routing engine.
 * Every error carries the AMQP reply code a protocol layer should answer with.
 */
public class AmqpRoutingException extends RuntimeException {

    @Getter
    private final int errorCode;

    public AmqpRoutingException(int errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AmqpRoutingException(int errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static class UnknownExchangeException extends AmqpRoutingException {
        public UnknownExchangeException(String exchange) {
            super(ErrorCodes.NOT_FOUND, "no exchange '" + exchange + "'");
        }
    }

    public static class ExchangeTypeConflictException extends AmqpRoutingException {
        public ExchangeTypeConflictException(String message) {
            super(ErrorCodes.IN_USE, message);
        }
    }

    public static class InvalidCriterionException extends AmqpRoutingException {
        public InvalidCriterionException(String message) {
            super(ErrorCodes.ARGUMENT_INVALID, message);
        }
    }

    public static class ExchangeAccessRefusedException extends AmqpRoutingException {
        public ExchangeAccessRefusedException(String message) {
            super(ErrorCodes.ACCESS_REFUSED, message);
        }
    }

    public static class UnsupportedExchangeTypeException extends AmqpRoutingException {
        public UnsupportedExchangeTypeException(String message) {
            super(ErrorCodes.COMMAND_INVALID, message);
        }
    }

    public static class EngineClosedException extends AmqpRoutingException {
        public EngineClosedException(String message) {
            super(ErrorCodes.INTERNAL_ERROR, message);
        }
    }

    public static class DefinitionsLoadException extends AmqpRoutingException {
        public DefinitionsLoadException(String message) {
            super(ErrorCodes.INTERNAL_ERROR, message);
        }

        public DefinitionsLoadException(String message, Throwable cause) {
            super(ErrorCodes.INTERNAL_ERROR, message, cause);
        }
    }
}
