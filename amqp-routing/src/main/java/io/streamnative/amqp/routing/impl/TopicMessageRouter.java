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

import static io.streamnative.amqp.routing.criterion.TopicCriterion.SEPARATOR;
import static io.streamnative.amqp.routing.criterion.TopicCriterion.SINGLE_WORD;
import static io.streamnative.amqp.routing.criterion.TopicCriterion.ZERO_OR_MORE_WORDS;

import com.google.common.base.Splitter;
import io.streamnative.amqp.routing.AbstractAmqpMessageRouter;
import io.streamnative.amqp.routing.common.exception.AmqpRoutingException;
import io.streamnative.amqp.routing.criterion.BindingCriterion;
import io.streamnative.amqp.routing.criterion.TopicCriterion;
import io.streamnative.amqp.routing.utils.ExchangeType;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.qpid.server.exchange.topic.TopicNormalizer;

/**
 * Topic message router.
 *
 * <p>Binding keys and routing keys are lists of words separated by '.'. In a binding key
 * '*' stands for exactly one word and '#' for zero or more words. An empty key has no words,
 * while an empty word between two dots is a word like any other.
 */
public class TopicMessageRouter extends AbstractAmqpMessageRouter<TopicCriterion> {

    private static final Splitter WORD_SPLITTER = Splitter.on(SEPARATOR);

    public TopicMessageRouter() {
        super(ExchangeType.TOPIC, TopicCriterion.class);
    }

    @Override
    public BindingCriterion parseCriterion(String bindingKey, Map<String, Object> arguments) {
        if (bindingKey == null) {
            throw new AmqpRoutingException.InvalidCriterionException("Topic binding requires a binding key");
        }
        return normalize(bindingKey);
    }

    @Override
    protected TopicCriterion normalize(TopicCriterion criterion) {
        return normalize(criterion.getPattern());
    }

    private TopicCriterion normalize(String bindingKey) {
        List<String> words = splitWords(bindingKey);
        for (String word : words) {
            if (word.length() > 1 && (word.contains(SINGLE_WORD) || word.contains(ZERO_OR_MORE_WORDS))) {
                throw new AmqpRoutingException.InvalidCriterionException("Invalid topic binding key '"
                        + bindingKey + "': wildcard '" + word + "' must be a whole word");
            }
        }
        // the normalizer tokenizes without keeping empty words
        if (words.contains("")) {
            return new TopicCriterion(bindingKey, words);
        }
        String normalized = TopicNormalizer.normalize(bindingKey);
        return new TopicCriterion(normalized, splitWords(normalized));
    }

    @Override
    protected boolean match(TopicCriterion criterion, String routingKey, Map<String, Object> headers) {
        return matches(criterion.getSegments(), splitWords(routingKey));
    }

    /**
     * Match the words of a binding key against the words of a routing key.
     *
     * <p>{@code next[j]} holds whether the binding key words after the current one match the routing key
     * words from {@code j} on; the rows are filled from the last binding key word backwards, which keeps
     * the backtracking of '#' linear in the number of words.
     */
    static boolean matches(List<String> pattern, List<String> words) {
        int m = pattern.size();
        int n = words.size();
        boolean[] next = new boolean[n + 1];
        boolean[] current = new boolean[n + 1];
        next[n] = true;
        for (int i = m - 1; i >= 0; i--) {
            String token = pattern.get(i);
            current[n] = ZERO_OR_MORE_WORDS.equals(token) && next[n];
            for (int j = n - 1; j >= 0; j--) {
                if (ZERO_OR_MORE_WORDS.equals(token)) {
                    current[j] = next[j] || current[j + 1];
                } else if (SINGLE_WORD.equals(token)) {
                    current[j] = next[j + 1];
                } else {
                    current[j] = token.equals(words.get(j)) && next[j + 1];
                }
            }
            boolean[] swap = next;
            next = current;
            current = swap;
        }
        return next[0];
    }

    static List<String> splitWords(String key) {
        if (key == null || key.isEmpty()) {
            return Collections.emptyList();
        }
        return WORD_SPLITTER.splitToList(key);
    }

}
