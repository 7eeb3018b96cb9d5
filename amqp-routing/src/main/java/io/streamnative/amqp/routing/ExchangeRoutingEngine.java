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

import static io.streamnative.amqp.routing.utils.ExchangeUtil.formatExchangeName;
import static io.streamnative.amqp.routing.utils.ExchangeUtil.isBuildInExchange;
import static io.streamnative.amqp.routing.utils.ExchangeUtil.isDefaultExchange;
import static io.streamnative.amqp.routing.utils.ExchangeUtil.isReservedExchangeName;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import io.streamnative.amqp.routing.common.exception.AmqpRoutingException;
import io.streamnative.amqp.routing.criterion.BindingCriterion;
import io.streamnative.amqp.routing.definitions.DefinitionsLoader;
import io.streamnative.amqp.routing.utils.ExchangeType;
import io.streamnative.amqp.routing.utils.ExchangeUtil;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.qpid.server.exchange.ExchangeDefaults;

/**
 * Exchange routing engine: keeps the exchanges, queues and bindings of a broker and computes
 * the destination queues of published messages.
 *
 * <p>Topology changes serialize on the write lock. Routing holds the read lock only while it resolves the
 * exchange and takes the binding snapshot, matching runs without any lock.
 */
@Slf4j
public class ExchangeRoutingEngine implements ExchangeService, AutoCloseable {

    @Getter
    private final AmqpRoutingConfiguration config;
    private final MessageDispatcher dispatcher;
    private final BindingTable bindingTable;
    private final ExchangeRegistry exchangeRegistry;
    private final QueueRegistry queueRegistry;

    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final Lock readLock = rwLock.readLock();
    private final Lock writeLock = rwLock.writeLock();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean closed = false;

    public ExchangeRoutingEngine(AmqpRoutingConfiguration config) {
        this(config, MessageDispatcher.NO_OP);
    }

    public ExchangeRoutingEngine(AmqpRoutingConfiguration config, MessageDispatcher dispatcher) {
        this.config = Preconditions.checkNotNull(config, "config");
        this.dispatcher = Preconditions.checkNotNull(dispatcher, "dispatcher");
        this.bindingTable = new BindingTable();
        this.exchangeRegistry = new ExchangeRegistry(bindingTable);
        this.queueRegistry = new QueueRegistry(bindingTable);

        if (config.isAmqpDefaultExchangeEnabled()) {
            exchangeRegistry.declare(ExchangeDefaults.DEFAULT_EXCHANGE_NAME, ExchangeType.DIRECT, true);
        }
        if (config.isAmqpBuiltInExchangesEnabled()) {
            ExchangeUtil.getBuildInExchanges().forEach((name, type) -> exchangeRegistry.declare(name, type, true));
        }
    }

    /**
     * Declare the topology of the configured definitions file, if any.
     */
    public void start() {
        checkOpen();
        if (!started.compareAndSet(false, true)) {
            return;
        }
        String definitionsFile = config.getAmqpDefinitionsFile();
        if (StringUtils.isNotBlank(definitionsFile)) {
            DefinitionsLoader.importFile(definitionsFile, this);
        }
        log.info("Exchange routing engine started with {} exchange(s)", exchangeRegistry.getExchanges().size());
    }

    @Override
    public AmqpExchange declareExchange(String exchange, String type) {
        ExchangeType exchangeType = ExchangeType.value(type);
        if (exchangeType == null) {
            throw new AmqpRoutingException.UnsupportedExchangeTypeException(
                    "Unknown exchange type '" + type + "' for exchange '" + exchange + "'");
        }
        return declareExchange(exchange, exchangeType);
    }

    @Override
    public AmqpExchange declareExchange(String exchange, ExchangeType type) {
        Preconditions.checkNotNull(type, "type");
        String exchangeName = formatExchangeName(exchange);
        if (isDefaultExchange(exchangeName)) {
            throw new AmqpRoutingException.ExchangeAccessRefusedException(
                    "Attempt to redeclare default exchange: of type " + ExchangeDefaults.DIRECT_EXCHANGE_CLASS);
        }
        writeLock.lock();
        try {
            checkOpen();
            if (isReservedExchangeName(exchangeName) && exchangeRegistry.get(exchangeName).isEmpty()) {
                throw new AmqpRoutingException.ExchangeAccessRefusedException("Attempt to declare exchange '"
                        + exchangeName + "' which begins with reserved prefix '"
                        + ExchangeUtil.RESERVED_EXCHANGE_PREFIX + "'");
            }
            return exchangeRegistry.declare(exchangeName, type);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void deleteExchange(String exchange) {
        String exchangeName = formatExchangeName(exchange);
        if (isDefaultExchange(exchangeName)) {
            throw new AmqpRoutingException.ExchangeAccessRefusedException(
                    "Default Exchange [" + exchangeName + "] cannot be deleted.");
        }
        writeLock.lock();
        try {
            checkOpen();
            exchangeRegistry.get(exchangeName).ifPresent(ex -> {
                if (ex.isBuiltIn() || isBuildInExchange(exchangeName)) {
                    throw new AmqpRoutingException.ExchangeAccessRefusedException(
                            "BuildIn Exchange [" + exchangeName + "] cannot be deleted");
                }
            });
            exchangeRegistry.delete(exchangeName);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void declareQueue(String queue) {
        checkQueueName(queue);
        writeLock.lock();
        try {
            checkOpen();
            queueRegistry.declare(queue);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void deleteQueue(String queue) {
        checkQueueName(queue);
        writeLock.lock();
        try {
            checkOpen();
            queueRegistry.delete(queue);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void bind(String exchange, String queue, String bindingKey, Map<String, Object> arguments) {
        String exchangeName = checkBindingTarget(exchange, queue);
        writeLock.lock();
        try {
            checkOpen();
            AmqpExchange amqpExchange = exchangeRegistry.lookup(exchangeName);
            BindingCriterion criterion = amqpExchange.getRouter().parseCriterion(bindingKey, arguments);
            bindingTable.bind(new AmqpBinding(exchangeName, queue, criterion));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void bind(String exchange, String queue, BindingCriterion criterion) {
        Preconditions.checkNotNull(criterion, "criterion");
        String exchangeName = checkBindingTarget(exchange, queue);
        writeLock.lock();
        try {
            checkOpen();
            AmqpExchange amqpExchange = exchangeRegistry.lookup(exchangeName);
            bindingTable.bind(new AmqpBinding(exchangeName, queue, amqpExchange.getRouter().checkCriterion(criterion)));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void unbind(String exchange, String queue, String bindingKey, Map<String, Object> arguments) {
        String exchangeName = checkBindingTarget(exchange, queue);
        writeLock.lock();
        try {
            checkOpen();
            exchangeRegistry.get(exchangeName).ifPresent(amqpExchange -> bindingTable.unbind(new AmqpBinding(
                    exchangeName, queue, amqpExchange.getRouter().parseCriterion(bindingKey, arguments))));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void unbind(String exchange, String queue, BindingCriterion criterion) {
        Preconditions.checkNotNull(criterion, "criterion");
        String exchangeName = checkBindingTarget(exchange, queue);
        writeLock.lock();
        try {
            checkOpen();
            exchangeRegistry.get(exchangeName).ifPresent(amqpExchange -> bindingTable.unbind(new AmqpBinding(
                    exchangeName, queue, amqpExchange.getRouter().checkCriterion(criterion))));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Set<String> route(String exchange, String routingKey, Map<String, Object> headers) {
        String exchangeName = formatExchangeName(exchange);
        String key = routingKey == null ? "" : routingKey;
        Map<String, Object> messageHeaders = headers == null ? Collections.emptyMap() : headers;

        AmqpExchange amqpExchange;
        ImmutableSet<AmqpBinding> bindings;
        ImmutableSet<String> queues;
        readLock.lock();
        try {
            checkOpen();
            amqpExchange = exchangeRegistry.lookup(exchangeName);
            bindings = bindingTable.snapshot(exchangeName);
            queues = queueRegistry.snapshot();
        } finally {
            readLock.unlock();
        }

        boolean undeclaredAllowed = config.isAmqpRouteToUndeclaredQueues();
        Set<String> destinations;
        if (isDefaultExchange(exchangeName)) {
            destinations = queues.contains(key) || (undeclaredAllowed && !key.isEmpty())
                    ? ImmutableSet.of(key) : ImmutableSet.of();
        } else {
            AmqpMessageRouter router = amqpExchange.getRouter();
            destinations = bindings.stream()
                    .filter(binding -> undeclaredAllowed || queues.contains(binding.getDestination()))
                    .filter(binding -> router.isMatch(binding.getCriterion(), key, messageHeaders))
                    .map(AmqpBinding::getDestination)
                    .collect(ImmutableSet.toImmutableSet());
        }
        if (log.isDebugEnabled()) {
            log.debug("Routed message with key [{}] through {} exchange '{}' to {}",
                    key, amqpExchange.getType(), exchangeName, destinations);
        }
        return destinations;
    }

    @Override
    public RoutingResult publish(String exchange, AmqpMessage message) {
        Preconditions.checkNotNull(message, "message");
        Set<String> destinations = route(exchange, message.getRoutingKey(), message.getHeaders());
        for (String queue : destinations) {
            dispatcher.dispatch(queue, message);
        }
        return new RoutingResult(formatExchangeName(exchange), message.getRoutingKey(), destinations);
    }

    public AmqpExchange getExchange(String exchange) {
        return exchangeRegistry.lookup(formatExchangeName(exchange));
    }

    /**
     * Get the explicit bindings of an exchange.
     *
     * @throws AmqpRoutingException.UnknownExchangeException if the exchange is not declared
     */
    public Set<AmqpBinding> getBindings(String exchange) {
        String exchangeName = formatExchangeName(exchange);
        readLock.lock();
        try {
            exchangeRegistry.lookup(exchangeName);
            return bindingTable.snapshot(exchangeName);
        } finally {
            readLock.unlock();
        }
    }

    public boolean queueExists(String queue) {
        return queueRegistry.exists(queue);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            writeLock.unlock();
        }
        log.info("Exchange routing engine closed");
    }

    private String checkBindingTarget(String exchange, String queue) {
        checkQueueName(queue);
        String exchangeName = formatExchangeName(exchange);
        if (isDefaultExchange(exchangeName)) {
            throw new AmqpRoutingException.ExchangeAccessRefusedException(
                    "Cannot bind or unbind queue '" + queue + "' with the default exchange");
        }
        return exchangeName;
    }

    private void checkQueueName(String queue) {
        Preconditions.checkArgument(StringUtils.isNotBlank(queue), "queue name must not be blank");
    }

    private void checkOpen() {
        if (closed) {
            throw new AmqpRoutingException.EngineClosedException("Exchange routing engine is closed");
        }
    }

}
