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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Exact routing key of a direct binding.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RoutingKeyCriterion implements BindingCriterion {

    private final String bindingKey;

    public RoutingKeyCriterion(@NonNull String bindingKey) {
        this.bindingKey = bindingKey;
    }

    @Override
    public ExchangeType getExchangeType() {
        return ExchangeType.DIRECT;
    }
}
