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

import io.streamnative.amqp.routing.criterion.BindingCriterion;
import io.streamnative.amqp.routing.utils.ExchangeType;
import java.util.Map;
import java.util.Set;

/**
 * Logic of exchange.
 */
public interface ExchangeService {

    /**
     * Declare a exchange.
     *
     * @param exchange the name of the exchange
     * @param type the exchange type
     * @return the declared exchange
     */
    AmqpExchange declareExchange(String exchange, ExchangeType type);

    /**
     * Declare a exchange by the name of its type.
     *
     * @param exchange the name of the exchange
     * @param type the exchange type name: direct, fanout, topic or headers
     * @return the declared exchange
     */
    AmqpExchange declareExchange(String exchange, String type);

    /**
     * Delete a exchange and all of its bindings. Deleting an unknown exchange does nothing.
     *
     * @param exchange the name of the exchange
     */
    void deleteExchange(String exchange);

    /**
     * Declare a queue in the queue store.
     *
     * @param queue the name of the queue
     */
    void declareQueue(String queue);

    /**
     * Delete a queue and all bindings to it.
     *
     * @param queue the name of the queue
     */
    void deleteQueue(String queue);

    /**
     * Bind a queue to an exchange.
     *
     * @param exchange the name of the exchange
     * @param queue the name of the queue
     * @param bindingKey the binding key, ignored by fanout and headers exchanges
     * @param arguments the binding arguments, used by headers exchanges
     */
    void bind(String exchange, String queue, String bindingKey, Map<String, Object> arguments);

    void bind(String exchange, String queue, BindingCriterion criterion);

    /**
     * Remove a binding. Removing a binding that does not exist does nothing.
     *
     * @param exchange the name of the exchange
     * @param queue the name of the queue
     * @param bindingKey the binding key
     * @param arguments the binding arguments
     */
    void unbind(String exchange, String queue, String bindingKey, Map<String, Object> arguments);

    void unbind(String exchange, String queue, BindingCriterion criterion);

    /**
     * Compute the queues a message published to an exchange must be delivered to.
     *
     * @param exchange the name of the exchange
     * @param routingKey the routing key of the message
     * @param headers the headers of the message
     * @return the destination queues, each once; empty if the message is unroutable
     */
    Set<String> route(String exchange, String routingKey, Map<String, Object> headers);

    /**
     * Route a message and hand it to every destination queue.
     *
     * @param exchange the name of the exchange
     * @param message the message
     * @return the routing result
     */
    RoutingResult publish(String exchange, AmqpMessage message);

}
