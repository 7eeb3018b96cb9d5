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
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A binding from an exchange to a queue, identified by all of its fields.
 */
@Data
@AllArgsConstructor
public final class AmqpBinding {

    private final String source;
    private final String destination;
    private final BindingCriterion criterion;

}
