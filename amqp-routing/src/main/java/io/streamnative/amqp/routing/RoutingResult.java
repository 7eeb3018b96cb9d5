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

import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of publishing one message to an exchange.
 */
@Getter
@ToString
@AllArgsConstructor
public class RoutingResult {

    private final String exchange;
    private final String routingKey;
    private final Set<String> destinations;

    /**
     * A message nobody receives is unroutable; it is dropped without error.
     */
    public boolean isRoutable() {
        return !destinations.isEmpty();
    }

}
