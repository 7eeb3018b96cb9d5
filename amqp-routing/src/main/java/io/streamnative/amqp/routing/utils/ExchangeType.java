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
package io.streamnative.amqp.routing.utils;

import org.apache.qpid.server.exchange.ExchangeDefaults;

/**
 * Exchange types supported by the routing engine.
 */
public enum ExchangeType {

    DIRECT(ExchangeDefaults.DIRECT_EXCHANGE_CLASS),
    FANOUT(ExchangeDefaults.FANOUT_EXCHANGE_CLASS),
    TOPIC(ExchangeDefaults.TOPIC_EXCHANGE_CLASS),
    HEADERS(ExchangeDefaults.HEADERS_EXCHANGE_CLASS);

    private final String value;

    ExchangeType(String value) {
        this.value = value;
    }

    /**
     * Resolve the exchange type from its AMQP class name.
     *
     * @param type the type name, case-insensitive
     * @return the exchange type, or null if the name is empty or unknown
     */
    public static ExchangeType value(String type) {
        if (type == null || type.length() == 0) {
            return null;
        }
        type = type.toLowerCase();
        switch (type) {
            case "direct":
                return DIRECT;
            case "fanout":
                return FANOUT;
            case "topic":
                return TOPIC;
            case "headers":
                return HEADERS;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return value;
    }

}
