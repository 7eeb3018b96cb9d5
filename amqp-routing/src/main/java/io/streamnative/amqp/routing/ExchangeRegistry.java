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

import io.streamnative.amqp.routing.common.exception.AmqpRoutingException;
import io.streamnative.amqp.routing.impl.InMemoryExchange;
import io.streamnative.amqp.routing.utils.ExchangeType;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Container for all exchanges in the broker.
 */
@Slf4j
public class ExchangeRegistry {

    private final Map<String, AmqpExchange> exchangeMap = new ConcurrentHashMap<>();
    private final BindingTable bindingTable;

    public ExchangeRegistry(BindingTable bindingTable) {
        this.bindingTable = bindingTable;
    }

    /**
     * Declare an exchange.
     *
     * @param exchangeName name of exchange
     * @param type         type of exchange: direct, fanout, topic and headers
     * @return the declared exchange, or the existing one if it was declared before with the same type
     * @throws AmqpRoutingException.ExchangeTypeConflictException if it was declared before with another type
     */
    public AmqpExchange declare(String exchangeName, ExchangeType type) {
        return declare(exchangeName, type, false);
    }

    synchronized AmqpExchange declare(String exchangeName, ExchangeType type, boolean builtIn) {
        AmqpExchange existing = exchangeMap.get(exchangeName);
        if (existing != null) {
            if (existing.getType() != type) {
                throw new AmqpRoutingException.ExchangeTypeConflictException(String.format(
                        "PRECONDITION_FAILED - inequivalent arg 'type' for exchange '%s': "
                                + "received '%s' but current is '%s'", exchangeName, type, existing.getType()));
            }
            return existing;
        }
        AmqpExchange exchange = new InMemoryExchange(exchangeName, type, builtIn);
        exchangeMap.put(exchangeName, exchange);
        log.info("Declared {} exchange '{}'", type, exchangeName);
        return exchange;
    }

    /**
     * Get a declared exchange.
     *
     * @throws AmqpRoutingException.UnknownExchangeException if the exchange is not declared
     */
    public AmqpExchange lookup(String exchangeName) {
        AmqpExchange exchange = exchangeMap.get(exchangeName);
        if (exchange == null) {
            throw new AmqpRoutingException.UnknownExchangeException(exchangeName);
        }
        return exchange;
    }

    public Optional<AmqpExchange> get(String exchangeName) {
        return Optional.ofNullable(exchangeMap.get(exchangeName));
    }

    /**
     * Delete an exchange together with its bindings. Deleting an unknown exchange does nothing.
     *
     * @return true if the exchange existed
     */
    public synchronized boolean delete(String exchangeName) {
        AmqpExchange removed = exchangeMap.remove(exchangeName);
        if (removed == null) {
            return false;
        }
        int bindings = bindingTable.removeExchange(exchangeName);
        log.info("Deleted {} exchange '{}' and {} binding(s)", removed.getType(), exchangeName, bindings);
        return true;
    }

    public Collection<AmqpExchange> getExchanges() {
        return Collections.unmodifiableCollection(exchangeMap.values());
    }

}
