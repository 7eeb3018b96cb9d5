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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.apache.qpid.server.exchange.ExchangeDefaults;

public class ExchangeUtil {

    public static final String RESERVED_EXCHANGE_PREFIX = "amq.";

    private static final Map<String, ExchangeType> BUILD_IN_EXCHANGES = ImmutableMap.of(
            ExchangeDefaults.DIRECT_EXCHANGE_NAME, ExchangeType.DIRECT,
            ExchangeDefaults.FANOUT_EXCHANGE_NAME, ExchangeType.FANOUT,
            ExchangeDefaults.TOPIC_EXCHANGE_NAME, ExchangeType.TOPIC,
            ExchangeDefaults.HEADERS_EXCHANGE_NAME, ExchangeType.HEADERS);

    public static boolean isBuildInExchange(final String exchangeName) {
        return BUILD_IN_EXCHANGES.containsKey(exchangeName);
    }

    public static Map<String, ExchangeType> getBuildInExchanges() {
        return BUILD_IN_EXCHANGES;
    }

    public static boolean isReservedExchangeName(final String exchangeName) {
        return exchangeName.startsWith(RESERVED_EXCHANGE_PREFIX);
    }

    public static String formatExchangeName(String s) {
        if (s == null) {
            return ExchangeDefaults.DEFAULT_EXCHANGE_NAME;
        }
        return s.replaceAll("\r", "").
                replaceAll("\n", "").trim();
    }

    public static boolean isDefaultExchange(final String exchangeName) {
        return exchangeName == null || ExchangeDefaults.DEFAULT_EXCHANGE_NAME.equals(exchangeName);
    }

}
