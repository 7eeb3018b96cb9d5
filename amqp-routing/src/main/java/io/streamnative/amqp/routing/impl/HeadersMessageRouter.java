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
import io.streamnative.amqp.routing.common.exception.AmqpRoutingException;
import io.streamnative.amqp.routing.criterion.BindingCriterion;
import io.streamnative.amqp.routing.criterion.HeadersCriterion;
import io.streamnative.amqp.routing.criterion.HeadersCriterion.MatchMode;
import io.streamnative.amqp.routing.utils.ExchangeType;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Headers message router.
 */
@Slf4j
public class HeadersMessageRouter extends AbstractAmqpMessageRouter<HeadersCriterion> {

    public HeadersMessageRouter() {
        super(ExchangeType.HEADERS, HeadersCriterion.class);
    }

    @Override
    public BindingCriterion parseCriterion(String bindingKey, Map<String, Object> arguments) {
        MatchMode matchMode = MatchMode.ALL;
        Map<String, Object> required = new HashMap<>();
        if (arguments != null) {
            for (Map.Entry<String, Object> entry : arguments.entrySet()) {
                String propertyName = entry.getKey();
                Object value = entry.getValue();
                if (propertyName == null) {
                    throw new AmqpRoutingException.InvalidCriterionException("Headers binding argument without name");
                }
                if (isSpecial(propertyName)) {
                    if (HeadersCriterion.X_MATCH.equalsIgnoreCase(propertyName)) {
                        matchMode = matchMode(value);
                    } else {
                        log.warn("Ignoring special header: {}", propertyName);
                    }
                } else {
                    required.put(propertyName, requiredValue(propertyName, value));
                }
            }
        }
        return new HeadersCriterion(matchMode, required);
    }

    @Override
    protected HeadersCriterion normalize(HeadersCriterion criterion) {
        Map<String, Object> required = new HashMap<>();
        for (Map.Entry<String, Object> entry : criterion.getRequiredHeaders().entrySet()) {
            String propertyName = entry.getKey();
            if (propertyName == null) {
                throw new AmqpRoutingException.InvalidCriterionException("Headers binding argument without name");
            }
            if (isSpecial(propertyName)) {
                if (HeadersCriterion.X_MATCH.equalsIgnoreCase(propertyName)) {
                    throw new AmqpRoutingException.InvalidCriterionException(
                            "Match type belongs to the match mode, not to the required headers");
                }
                log.warn("Ignoring special header: {}", propertyName);
                continue;
            }
            required.put(propertyName, requiredValue(propertyName, entry.getValue()));
        }
        return new HeadersCriterion(criterion.getMatchMode(), required);
    }

    @Override
    protected boolean match(HeadersCriterion criterion, String routingKey, Map<String, Object> headers) {
        Map<String, Object> required = criterion.getRequiredHeaders();
        return switch (criterion.getMatchMode()) {
            case ALL -> and(required, headers);
            case ANY -> or(required, headers);
        };
    }

    private boolean and(Map<String, Object> required, Map<String, Object> headers) {
        for (Map.Entry<String, Object> e : required.entrySet()) {
            if (!passes(e, headers)) {
                return false;
            }
        }
        return true;
    }

    private boolean or(Map<String, Object> required, Map<String, Object> headers) {
        for (Map.Entry<String, Object> e : required.entrySet()) {
            if (passes(e, headers)) {
                return true;
            }
        }
        return false;
    }

    private boolean passes(Map.Entry<String, Object> requirement, Map<String, Object> headers) {
        Object actual = headers.get(requirement.getKey());
        return actual != null && requirement.getValue().equals(normalizeValue(actual));
    }

    private boolean isSpecial(String key) {
        return key.startsWith("X-") || key.startsWith("x-");
    }

    private MatchMode matchMode(Object value) {
        MatchMode matchMode = value instanceof String ? MatchMode.value((String) value) : null;
        if (matchMode == null) {
            throw new AmqpRoutingException.InvalidCriterionException("Unrecognised match type: " + value);
        }
        return matchMode;
    }

    private Object requiredValue(String propertyName, Object value) {
        if (value == null || value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            throw new AmqpRoutingException.InvalidCriterionException("Header '" + propertyName
                    + "' of a headers binding must have a scalar value, got " + value);
        }
        return normalizeValue(value);
    }

    /**
     * Integral numbers compare as longs and floating point numbers as doubles, so that the width a
     * client happened to encode a number with does not change the routing.
     */
    static Object normalizeValue(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }
}
