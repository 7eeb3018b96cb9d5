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

import java.util.Collections;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * The routing envelope of a published message. The body is never looked at by the routing engine.
 */
@Getter
@ToString(exclude = "body")
public class AmqpMessage {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final String routingKey;
    private final Map<String, Object> headers;
    private final byte[] body;

    public AmqpMessage(String routingKey, Map<String, Object> headers, byte[] body) {
        this.routingKey = routingKey == null ? "" : routingKey;
        this.headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(headers);
        this.body = body == null ? EMPTY_BODY : body;
    }

    public AmqpMessage(String routingKey, byte[] body) {
        this(routingKey, null, body);
    }

}
