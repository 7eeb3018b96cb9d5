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

import com.google.common.collect.ImmutableList;
import io.streamnative.amqp.routing.utils.ExchangeType;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Normalized topic pattern of a topic binding, kept together with its segments.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class TopicCriterion implements BindingCriterion {

    public static final String SINGLE_WORD = "*";
    public static final String ZERO_OR_MORE_WORDS = "#";
    public static final String SEPARATOR = ".";

    @ToString.Include
    @EqualsAndHashCode.Include
    private final String pattern;

    private final List<String> segments;

    public TopicCriterion(String pattern, List<String> segments) {
        this.pattern = pattern;
        this.segments = ImmutableList.copyOf(segments);
    }

    @Override
    public ExchangeType getExchangeType() {
        return ExchangeType.TOPIC;
    }
}
