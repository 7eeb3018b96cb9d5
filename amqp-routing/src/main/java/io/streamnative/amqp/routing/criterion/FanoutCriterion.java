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
 * Fanout bindings carry no criterion, so every fanout binding of a queue is the same binding.
 */
public final class FanoutCriterion implements BindingCriterion {

    public static final FanoutCriterion INSTANCE = new FanoutCriterion();

    private FanoutCriterion() {
    }

    @Override
    public ExchangeType getExchangeType() {
        return ExchangeType.FANOUT;
    }

    @Override
    public String toString() {
        return "FanoutCriterion";
    }
}
