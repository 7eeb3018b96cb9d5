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
import io.streamnative.amqp.routing.criterion.BindingCriterion;
import io.streamnative.amqp.routing.criterion.FanoutCriterion;
import io.streamnative.amqp.routing.utils.ExchangeType;
import java.util.Map;

/**
 * Fanout message router, the binding key and the arguments are ignored.
 */
public class FanoutMessageRouter extends AbstractAmqpMessageRouter<FanoutCriterion> {

    public FanoutMessageRouter() {
        super(ExchangeType.FANOUT, FanoutCriterion.class);
    }

    @Override
    public BindingCriterion parseCriterion(String bindingKey, Map<String, Object> arguments) {
        return FanoutCriterion.INSTANCE;
    }

    @Override
    protected boolean match(FanoutCriterion criterion, String routingKey, Map<String, Object> headers) {
        return true;
    }

}
