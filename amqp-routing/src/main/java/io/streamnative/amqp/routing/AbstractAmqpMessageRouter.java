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
import io.streamnative.amqp.routing.criterion.BindingCriterion;
import io.streamnative.amqp.routing.impl.DirectMessageRouter;
import io.streamnative.amqp.routing.impl.FanoutMessageRouter;
import io.streamnative.amqp.routing.impl.HeadersMessageRouter;
import io.streamnative.amqp.routing.impl.TopicMessageRouter;
import io.streamnative.amqp.routing.utils.ExchangeType;
import java.util.Map;

/**
 * Base class for AMQP message router.
 *
 * @param <C> the criterion type evaluated by the router
 */
public abstract class AbstractAmqpMessageRouter<C extends BindingCriterion> implements AmqpMessageRouter {

    protected final ExchangeType routerType;
    private final Class<C> criterionClass;

    protected AbstractAmqpMessageRouter(ExchangeType routerType, Class<C> criterionClass) {
        this.routerType = routerType;
        this.criterionClass = criterionClass;
    }

    @Override
    public ExchangeType getType() {
        return routerType;
    }

    public static AmqpMessageRouter generateRouter(ExchangeType type) {
        return switch (type) {
            case DIRECT -> new DirectMessageRouter();
            case FANOUT -> new FanoutMessageRouter();
            case TOPIC -> new TopicMessageRouter();
            case HEADERS -> new HeadersMessageRouter();
        };
    }

    @Override
    public BindingCriterion checkCriterion(BindingCriterion criterion) {
        return normalize(cast(criterion));
    }

    @Override
    public boolean isMatch(BindingCriterion criterion, String routingKey, Map<String, Object> headers) {
        return match(cast(criterion), routingKey, headers);
    }

    /**
     * Bring a criterion into the form stored in the binding table.
     */
    protected C normalize(C criterion) {
        return criterion;
    }

    protected abstract boolean match(C criterion, String routingKey, Map<String, Object> headers);

    private C cast(BindingCriterion criterion) {
        if (!criterionClass.isInstance(criterion)) {
            throw new AmqpRoutingException.InvalidCriterionException("Criterion " + criterion
                    + " cannot be used with a " + routerType + " exchange");
        }
        return criterionClass.cast(criterion);
    }

}
