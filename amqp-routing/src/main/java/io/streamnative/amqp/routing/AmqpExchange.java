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
package io.streamnative.amqp.routing;

import io.streamnative.amqp.routing.utils.ExchangeType;

/**
 * Interface of the AMQP exchange.
 * The broker keeps exchanges in an {@link ExchangeRegistry}, an exchange is immutable once declared.
 */
public interface AmqpExchange {

    /**
     * Get the name of the exchange.
     * The exchange name is the identify of an exchange.
     * @return name of the exchange.
     */
    String getName();

    /**
     * Get the type {@link ExchangeType} of the exchange.
     * @return the type of the exchange.
     */
    ExchangeType getType();

    /**
     * Get the router evaluating the bindings of this exchange.
     * @return the message router for the exchange type.
     */
    AmqpMessageRouter getRouter();

    /**
     * Whether the exchange is declared by the broker itself, such as the default exchange
     * and the amq.* exchanges. Built-in exchanges cannot be deleted.
     */
    boolean isBuiltIn();

}
