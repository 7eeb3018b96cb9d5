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
package io.streamnative.amqp.routing.definitions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.streamnative.amqp.routing.ExchangeService;
import io.streamnative.amqp.routing.common.exception.AmqpRoutingException;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;

/**
 * Imports topology definitions through the management operations of an {@link ExchangeService}.
 * Exchanges are declared first, then queues, then bindings.
 */
@Slf4j
public class DefinitionsLoader {

    public static final ObjectMapper JSON_MAPPER = new JsonMapper();

    public static Definitions parse(InputStream inputStream) {
        try {
            Definitions definitions = JSON_MAPPER.readValue(inputStream, Definitions.class);
            return definitions == null ? new Definitions() : definitions;
        } catch (IOException e) {
            throw new AmqpRoutingException.DefinitionsLoadException("Failed to parse definitions", e);
        }
    }

    public static void importFile(String definitionsFile, ExchangeService service) {
        try (InputStream inputStream = new FileInputStream(definitionsFile)) {
            apply(parse(inputStream), service);
        } catch (IOException e) {
            throw new AmqpRoutingException.DefinitionsLoadException(
                    "Failed to read definitions file " + definitionsFile, e);
        }
        log.info("Imported definitions from {}", definitionsFile);
    }

    public static void apply(Definitions definitions, ExchangeService service) {
        if (CollectionUtils.isNotEmpty(definitions.getExchanges())) {
            for (ExchangeDefinition exchange : definitions.getExchanges()) {
                service.declareExchange(exchange.getName(), exchange.getType());
            }
        }
        if (CollectionUtils.isNotEmpty(definitions.getQueues())) {
            for (QueueDefinition queue : definitions.getQueues()) {
                service.declareQueue(queue.getName());
            }
        }
        if (CollectionUtils.isNotEmpty(definitions.getBindings())) {
            for (BindingDefinition binding : definitions.getBindings()) {
                if (!BindingDefinition.DESTINATION_TYPE_QUEUE.equals(binding.getDestinationType())) {
                    throw new AmqpRoutingException.DefinitionsLoadException("Binding from '" + binding.getSource()
                            + "' to " + binding.getDestinationType() + " '" + binding.getDestination()
                            + "' is not supported, only queues can be bound");
                }
                service.bind(binding.getSource(), binding.getDestination(), binding.getRoutingKey(),
                        binding.getArguments());
            }
        }
    }

    private DefinitionsLoader() {}
}
