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
package io.streamnative.amqp.routing.criterion;

import io.streamnative.amqp.routing.utils.ExchangeType;

/**
 * The matching criterion of a binding, parsed from the binding key and arguments
 * for the type of the exchange the binding is made against.
 * Implementations are immutable and define value equality, so that identical
 * bindings collapse to one.
 */
public interface BindingCriterion {

    /**
     * Get the exchange type this criterion belongs to.
     *
     * @return the {@link ExchangeType} that can evaluate this criterion
     */
    ExchangeType getExchangeType();

}
