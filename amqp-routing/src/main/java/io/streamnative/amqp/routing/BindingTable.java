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

import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Bindings of all exchanges, keyed by exchange name.
 *
 * <p>The binding set of an exchange is an immutable snapshot replaced on every change, so a reader
 * holding a snapshot never sees a later bind or unbind.
 */
@Slf4j
public class BindingTable {

    private final Map<String, ImmutableSet<AmqpBinding>> bindingMap = new ConcurrentHashMap<>();

    /**
     * Add a binding.
     *
     * @return false if an identical binding already exists
     */
    public synchronized boolean bind(AmqpBinding binding) {
        ImmutableSet<AmqpBinding> current = snapshot(binding.getSource());
        if (current.contains(binding)) {
            return false;
        }
        bindingMap.put(binding.getSource(), ImmutableSet.<AmqpBinding>builder()
                .addAll(current)
                .add(binding)
                .build());
        if (log.isDebugEnabled()) {
            log.debug("Bound queue {} to exchange {} with {}",
                    binding.getDestination(), binding.getSource(), binding.getCriterion());
        }
        return true;
    }

    /**
     * Remove a binding.
     *
     * @return false if the binding does not exist
     */
    public synchronized boolean unbind(AmqpBinding binding) {
        ImmutableSet<AmqpBinding> current = snapshot(binding.getSource());
        if (!current.contains(binding)) {
            return false;
        }
        replace(binding.getSource(), current.stream().filter(b -> !b.equals(binding)));
        if (log.isDebugEnabled()) {
            log.debug("Unbound queue {} from exchange {} with {}",
                    binding.getDestination(), binding.getSource(), binding.getCriterion());
        }
        return true;
    }

    /**
     * Get the bindings of an exchange as they are now.
     *
     * @param exchange name of the exchange
     * @return a lazy stream over the current snapshot, empty if the exchange has no binding
     */
    public Stream<AmqpBinding> bindingsFor(String exchange) {
        return snapshot(exchange).stream();
    }

    public ImmutableSet<AmqpBinding> snapshot(String exchange) {
        ImmutableSet<AmqpBinding> bindings = bindingMap.get(exchange);
        return bindings == null ? ImmutableSet.of() : bindings;
    }

    public int bindingCount(String exchange) {
        return snapshot(exchange).size();
    }

    /**
     * Remove every binding of an exchange.
     *
     * @return the number of bindings removed
     */
    public synchronized int removeExchange(String exchange) {
        ImmutableSet<AmqpBinding> removed = bindingMap.remove(exchange);
        return removed == null ? 0 : removed.size();
    }

    /**
     * Remove every binding whose destination is the queue.
     *
     * @return the number of bindings removed
     */
    public synchronized int removeQueue(String queue) {
        int removed = 0;
        for (Map.Entry<String, ImmutableSet<AmqpBinding>> entry : bindingMap.entrySet()) {
            Set<AmqpBinding> bindings = entry.getValue();
            long matched = bindings.stream().filter(b -> b.getDestination().equals(queue)).count();
            if (matched > 0) {
                replace(entry.getKey(), bindings.stream().filter(b -> !b.getDestination().equals(queue)));
                removed += (int) matched;
            }
        }
        return removed;
    }

    private void replace(String exchange, Stream<AmqpBinding> remaining) {
        ImmutableSet<AmqpBinding> bindings = remaining.collect(ImmutableSet.toImmutableSet());
        if (bindings.isEmpty()) {
            bindingMap.remove(exchange);
        } else {
            bindingMap.put(exchange, bindings);
        }
    }

    @Override
    public String toString() {
        return bindingMap.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().size())
                .collect(Collectors.joining(", ", "BindingTable{", "}"));
    }
}
