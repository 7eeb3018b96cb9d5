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

/**
 * Message router decides whether a binding of an exchange matches a published message.
 * There is one router per {@link ExchangeType}; routers hold no state.
 */
public interface AmqpMessageRouter {

    /**
     * Get the type of this message router.
     *
     * @return {@link ExchangeType} type of this message router
     */
    ExchangeType getType();

    /**
     * Parse and validate the binding key and the binding arguments into a criterion.
     *
     * @param bindingKey the binding key given when the binding is created
     * @param arguments  the binding arguments, may be null
     * @return the criterion this router evaluates
     * @throws io.streamnative.amqp.routing.common.exception.AmqpRoutingException.InvalidCriterionException
     *         if the key or the arguments are malformed for this exchange type
     */
    BindingCriterion parseCriterion(String bindingKey, Map<String, Object> arguments);

    /**
     * Check that a criterion built elsewhere can be evaluated by this router.
     *
     * @param criterion the criterion
     * @return the criterion in the normal form this router stores
     */
    BindingCriterion checkCriterion(BindingCriterion criterion);

    /**
     * Evaluate one binding criterion against the routing metadata of a message.
     *
     * @param criterion  the criterion of the binding
     * @param routingKey the routing key of the message, never null
     * @param headers    the headers of the message, never null
     * @return true if the message should be delivered through the binding
     */
    boolean isMatch(BindingCriterion criterion, String routingKey, Map<String, Object> headers);

}
