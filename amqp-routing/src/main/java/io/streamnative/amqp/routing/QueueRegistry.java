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
import lombok.extern.slf4j.Slf4j;

/**
 * Names of the queues known to exist in the queue store.
 */
@Slf4j
public class QueueRegistry {

    private volatile ImmutableSet<String> queues = ImmutableSet.of();
    private final BindingTable bindingTable;

    public QueueRegistry(BindingTable bindingTable) {
        this.bindingTable = bindingTable;
    }

    /**
     * @return false if the queue was already declared
     */
    public synchronized boolean declare(String queueName) {
        if (queues.contains(queueName)) {
            return false;
        }
        queues = ImmutableSet.<String>builder().addAll(queues).add(queueName).build();
        log.info("Declared queue '{}'", queueName);
        return true;
    }

    /**
     * Delete a queue and every binding to it. Bindings to a queue that was never declared are
     * removed as well.
     *
     * @return true if the queue existed
     */
    public synchronized boolean delete(String queueName) {
        boolean existed = queues.contains(queueName);
        if (existed) {
            queues = queues.stream().filter(q -> !q.equals(queueName)).collect(ImmutableSet.toImmutableSet());
        }
        int bindings = bindingTable.removeQueue(queueName);
        if (existed || bindings > 0) {
            log.info("Deleted queue '{}' and {} binding(s)", queueName, bindings);
        }
        return existed;
    }

    public boolean exists(String queueName) {
        return queues.contains(queueName);
    }

    public ImmutableSet<String> snapshot() {
        return queues;
    }

}
