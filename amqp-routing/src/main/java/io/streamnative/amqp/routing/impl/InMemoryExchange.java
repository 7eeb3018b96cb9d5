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
package io.streamnative.amqp.routing.impl;

import io.streamnative.amqp.routing.AbstractAmqpMessageRouter;
import io.streamnative.amqp.routing.AmqpExchange;
import io.streamnative.amqp.routing.AmqpMessageRouter;
import io.streamnative.amqp.routing.utils.ExchangeType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * In memory exchange.
 */
@Getter
@ToString(exclude = "router")
@EqualsAndHashCode(exclude = "router")
public class InMemoryExchange implements AmqpExchange {

    private final String name;
    private final ExchangeType type;
    private final boolean builtIn;
    private final AmqpMessageRouter router;

    public InMemoryExchange(@NonNull String name, @NonNull ExchangeType type, boolean builtIn) {
        this.name = name;
        this.type = type;
        this.builtIn = builtIn;
        this.router = AbstractAmqpMessageRouter.generateRouter(type);
    }

}
