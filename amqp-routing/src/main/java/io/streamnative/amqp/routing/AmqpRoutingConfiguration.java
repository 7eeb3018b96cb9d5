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

import lombok.Getter;
import lombok.Setter;
import org.apache.pulsar.common.configuration.Category;
import org.apache.pulsar.common.configuration.FieldContext;

/**
 * Exchange routing engine configuration object.
 */
@Getter
@Setter
public class AmqpRoutingConfiguration {

    @Category
    private static final String CATEGORY_AMQP_EXCHANGE = "AMQP Exchange";
    @Category
    private static final String CATEGORY_AMQP_TOPOLOGY = "AMQP Topology";

    //
    // --- AMQP exchange configuration ---
    //

    @FieldContext(
            category = CATEGORY_AMQP_EXCHANGE,
            doc = "Whether the nameless default exchange is available. It routes a message to the queue"
                    + " named by the routing key"
    )
    private boolean amqpDefaultExchangeEnabled = true;

    @FieldContext(
            category = CATEGORY_AMQP_EXCHANGE,
            doc = "Whether the built-in exchanges amq.direct, amq.fanout, amq.topic and amq.match are declared"
                    + " when the engine is created"
    )
    private boolean amqpBuiltInExchangesEnabled = true;

    @FieldContext(
            category = CATEGORY_AMQP_EXCHANGE,
            doc = "Route messages to bound queues even if the queue store has not declared them"
    )
    private boolean amqpRouteToUndeclaredQueues = false;

    //
    // --- AMQP topology configuration ---
    //

    @FieldContext(
            category = CATEGORY_AMQP_TOPOLOGY,
            doc = "Path of a definitions file (JSON) with exchanges, queues and bindings to declare on start"
    )
    private String amqpDefinitionsFile;

}
