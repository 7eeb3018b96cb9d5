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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Required headers of a headers binding and the way they are combined.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class HeadersCriterion implements BindingCriterion {

    public static final String X_MATCH = "x-match";

    /**
     * How the required headers are combined.
     */
    public enum MatchMode {
        ALL("all"),
        ANY("any");

        private final String value;

        MatchMode(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public static MatchMode value(String mode) {
            if (mode == null) {
                return null;
            }
            for (MatchMode matchMode : values()) {
                if (matchMode.value.equalsIgnoreCase(mode)) {
                    return matchMode;
                }
            }
            return null;
        }
    }

    private final MatchMode matchMode;
    private final Map<String, Object> requiredHeaders;

    public HeadersCriterion(@NonNull MatchMode matchMode, @NonNull Map<String, Object> requiredHeaders) {
        this.matchMode = matchMode;
        // may hold null values, the headers router rejects them
        this.requiredHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(requiredHeaders));
    }

    @Override
    public ExchangeType getExchangeType() {
        return ExchangeType.HEADERS;
    }
}
