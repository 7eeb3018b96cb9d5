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
package io.streamnative.amqp.routing.test;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.google.common.collect.ImmutableMap;
import io.streamnative.amqp.routing.AmqpMessage;
import io.streamnative.amqp.routing.AmqpRoutingConfiguration;
import io.streamnative.amqp.routing.ExchangeRoutingEngine;
import io.streamnative.amqp.routing.MessageDispatcher;
import io.streamnative.amqp.routing.RoutingResult;
import io.streamnative.amqp.routing.common.exception.AmqpRoutingException;
import io.streamnative.amqp.routing.criterion.HeadersCriterion;
import io.streamnative.amqp.routing.criterion.RoutingKeyCriterion;
import io.streamnative.amqp.routing.utils.ExchangeType;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import org.apache.qpid.server.protocol.ErrorCodes;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Unit test for the exchange routing engine.
 */
public class ExchangeRoutingEngineTest {

    private MessageDispatcher dispatcher;
    private ExchangeRoutingEngine engine;

    @BeforeMethod
    public void setup() {
        dispatcher = mock(MessageDispatcher.class);
        engine = new ExchangeRoutingEngine(new AmqpRoutingConfiguration(), dispatcher);
        engine.start();
    }

    @AfterMethod(alwaysRun = true)
    public void cleanup() {
        engine.close();
    }

    private void declareQueues(String... queues) {
        for (String queue : queues) {
            engine.declareQueue(queue);
        }
    }

    @Test
    public void testDirectExchange() {
        declareQueues("direct_queue");
        engine.declareExchange("my_custom_exchange", ExchangeType.DIRECT);
        engine.bind("my_custom_exchange", "direct_queue", "error", null);

        Assert.assertEquals(engine.route("my_custom_exchange", "error", null), Set.of("direct_queue"));
        Assert.assertEquals(engine.route("my_custom_exchange", "info", null), Set.of());
    }

    @Test
    public void testFanoutExchange() {
        declareQueues("fanout_queue_1", "fanout_queue_2");
        engine.declareExchange("events", "fanout");
        engine.bind("events", "fanout_queue_1", "", null);
        engine.bind("events", "fanout_queue_2", "", null);

        Set<String> expected = Set.of("fanout_queue_1", "fanout_queue_2");
        Assert.assertEquals(engine.route("events", "", null), expected);
        Assert.assertEquals(engine.route("events", "some.key", Map.of("format", "pdf")), expected);
    }

    @Test
    public void testTopicExchange() {
        declareQueues("topic_queue_info", "topic_queue_all", "topic_queue_star");
        engine.declareExchange("topic_logs", ExchangeType.TOPIC);
        engine.bind("topic_logs", "topic_queue_info", "logs.info", null);
        engine.bind("topic_logs", "topic_queue_all", "logs.#", null);
        engine.bind("topic_logs", "topic_queue_star", "logs.*", null);

        Assert.assertEquals(engine.route("topic_logs", "logs.info", null),
                Set.of("topic_queue_info", "topic_queue_all", "topic_queue_star"));
        Assert.assertEquals(engine.route("topic_logs", "logs.error.critical", null), Set.of("topic_queue_all"));
        Assert.assertEquals(engine.route("topic_logs", "logs", null), Set.of("topic_queue_all"));
        Assert.assertEquals(engine.route("topic_logs", "audit", null), Set.of());
    }

    @Test
    public void testHeadersExchange() {
        declareQueues("headers_queue", "any_queue");
        engine.declareExchange("header_exchange", ExchangeType.HEADERS);
        engine.bind("header_exchange", "headers_queue", "",
                ImmutableMap.of("x-match", "all", "format", "pdf", "type", "report"));
        engine.bind("header_exchange", "any_queue", "",
                ImmutableMap.of("x-match", "any", "format", "pdf", "type", "report"));

        Assert.assertEquals(engine.route("header_exchange", "", Map.of("format", "pdf", "type", "report")),
                Set.of("headers_queue", "any_queue"));
        Assert.assertEquals(engine.route("header_exchange", "", Map.of("format", "pdf")), Set.of("any_queue"));
        Assert.assertEquals(engine.route("header_exchange", "", Map.of("format", "zip")), Set.of());
    }

    @Test
    public void testIdempotentBinding() {
        declareQueues("q");
        engine.declareExchange("e", ExchangeType.DIRECT);
        engine.bind("e", "q", "error", null);
        engine.bind("e", "q", "error", null);
        engine.bind("e", "q", new RoutingKeyCriterion("error"));

        Assert.assertEquals(engine.getBindings("e").size(), 1);
        RoutingResult result = engine.publish("e", new AmqpMessage("error", "m".getBytes(StandardCharsets.UTF_8)));
        Assert.assertEquals(result.getDestinations(), Set.of("q"));
        verify(dispatcher, times(1)).dispatch(eq("q"), any(AmqpMessage.class));
    }

    @Test
    public void testQueueBoundTwiceIsRoutedOnce() {
        declareQueues("q");
        engine.declareExchange("t", ExchangeType.TOPIC);
        engine.bind("t", "q", "logs.*", null);
        engine.bind("t", "q", "#.error", null);
        Assert.assertEquals(engine.getBindings("t").size(), 2);

        AmqpMessage message = new AmqpMessage("logs.error", new byte[]{1});
        RoutingResult result = engine.publish("t", message);
        Assert.assertEquals(result.getDestinations(), Set.of("q"));
        verify(dispatcher, times(1)).dispatch("q", message);
    }

    @Test
    public void testFanoutBindingsCollapse() {
        declareQueues("q");
        engine.declareExchange("f", ExchangeType.FANOUT);
        engine.bind("f", "q", "a", null);
        engine.bind("f", "q", "b", null);
        Assert.assertEquals(engine.getBindings("f").size(), 1);
    }

    @Test
    public void testDeclareConflict() {
        engine.declareExchange("E", ExchangeType.DIRECT);
        engine.declareExchange("E", "direct");
        try {
            engine.declareExchange("E", ExchangeType.TOPIC);
            Assert.fail("should have failed with a type conflict");
        } catch (AmqpRoutingException.ExchangeTypeConflictException e) {
            Assert.assertEquals(e.getErrorCode(), ErrorCodes.IN_USE);
        }
        Assert.assertEquals(engine.getExchange("E").getType(), ExchangeType.DIRECT);
    }

    @Test
    public void testUnknownExchange() {
        try {
            engine.route("missing", "key", null);
            Assert.fail("routing should have failed");
        } catch (AmqpRoutingException.UnknownExchangeException e) {
            Assert.assertEquals(e.getErrorCode(), ErrorCodes.NOT_FOUND);
        }
        Assert.expectThrows(AmqpRoutingException.UnknownExchangeException.class,
                () -> engine.bind("missing", "q", "key", null));
        Assert.expectThrows(AmqpRoutingException.UnknownExchangeException.class,
                () -> engine.publish("missing", new AmqpMessage("key", null)));
        verify(dispatcher, never()).dispatch(anyString(), any(AmqpMessage.class));
    }

    @Test
    public void testUnsupportedExchangeType() {
        Assert.expectThrows(AmqpRoutingException.UnsupportedExchangeTypeException.class,
                () -> engine.declareExchange("hash", "x-consistent-hash"));
        Assert.expectThrows(AmqpRoutingException.UnknownExchangeException.class, () -> engine.getExchange("hash"));
    }

    @Test
    public void testInvalidCriterionLeavesBindingsUntouched() {
        engine.declareExchange("h", ExchangeType.HEADERS);
        engine.bind("h", "q", "", Map.of("format", "pdf"));
        Assert.expectThrows(AmqpRoutingException.InvalidCriterionException.class,
                () -> engine.bind("h", "q", "", Map.of("x-match", "most")));
        Assert.expectThrows(AmqpRoutingException.InvalidCriterionException.class,
                () -> engine.bind("h", "q", new RoutingKeyCriterion("key")));
        Assert.assertEquals(engine.getBindings("h").size(), 1);
    }

    @Test
    public void testUnbind() {
        declareQueues("q1", "q2");
        engine.declareExchange("h", ExchangeType.HEADERS);
        engine.bind("h", "q1", "", Map.of("format", "pdf"));
        engine.bind("h", "q2", new HeadersCriterion(HeadersCriterion.MatchMode.ALL, Map.of("format", "pdf")));

        engine.unbind("h", "q1", "ignored", Map.of("format", "pdf", "x-match", "all"));
        Assert.assertEquals(engine.route("h", "", Map.of("format", "pdf")), Set.of("q2"));

        engine.unbind("h", "q1", "", Map.of("format", "pdf"));
        engine.unbind("missing", "q1", "", null);
        engine.unbind("h", "q2", new HeadersCriterion(HeadersCriterion.MatchMode.ALL, Map.of("format", "pdf")));
        Assert.assertEquals(engine.route("h", "", Map.of("format", "pdf")), Set.of());
    }

    @Test
    public void testDeleteExchangeRemovesBindings() {
        declareQueues("q");
        engine.declareExchange("e", ExchangeType.FANOUT);
        engine.bind("e", "q", "", null);
        engine.deleteExchange("e");
        engine.deleteExchange("e");

        Assert.expectThrows(AmqpRoutingException.UnknownExchangeException.class, () -> engine.route("e", "", null));
        engine.declareExchange("e", ExchangeType.TOPIC);
        Assert.assertTrue(engine.getBindings("e").isEmpty());
        Assert.assertEquals(engine.route("e", "a", null), Set.of());
    }

    @Test
    public void testBindingToUndeclaredQueue() {
        engine.declareExchange("e", ExchangeType.DIRECT);
        engine.bind("e", "later", "key", null);
        Assert.assertEquals(engine.route("e", "key", null), Set.of());

        engine.declareQueue("later");
        Assert.assertEquals(engine.route("e", "key", null), Set.of("later"));
    }

    @Test
    public void testDeleteUndeclaredQueueRemovesBindings() {
        engine.declareExchange("e", ExchangeType.DIRECT);
        engine.bind("e", "q", "k", null);
        engine.deleteQueue("q");
        Assert.assertTrue(engine.getBindings("e").isEmpty());

        engine.declareQueue("q");
        Assert.assertEquals(engine.route("e", "k", null), Set.of());
    }

    @Test
    public void testDeleteQueueRemovesBindings() {
        declareQueues("q1", "q2");
        engine.declareExchange("f", ExchangeType.FANOUT);
        engine.declareExchange("d", ExchangeType.DIRECT);
        engine.bind("f", "q1", "", null);
        engine.bind("f", "q2", "", null);
        engine.bind("d", "q1", "key", null);

        engine.deleteQueue("q1");
        Assert.assertFalse(engine.queueExists("q1"));
        Assert.assertEquals(engine.getBindings("f").size(), 1);
        Assert.assertTrue(engine.getBindings("d").isEmpty());

        engine.declareQueue("q1");
        Assert.assertEquals(engine.route("f", "", null), Set.of("q2"));
    }

    @Test
    public void testDefaultExchange() {
        declareQueues("my_queue");
        Assert.assertEquals(engine.route("", "my_queue", null), Set.of("my_queue"));
        Assert.assertEquals(engine.route(null, "my_queue", null), Set.of("my_queue"));
        Assert.assertEquals(engine.route("", "other_queue", null), Set.of());

        Assert.expectThrows(AmqpRoutingException.ExchangeAccessRefusedException.class,
                () -> engine.declareExchange("", ExchangeType.DIRECT));
        Assert.expectThrows(AmqpRoutingException.ExchangeAccessRefusedException.class,
                () -> engine.deleteExchange(""));
        Assert.expectThrows(AmqpRoutingException.ExchangeAccessRefusedException.class,
                () -> engine.bind("", "my_queue", "key", null));
    }

    @Test
    public void testBuiltInExchanges() {
        declareQueues("q");
        Assert.assertEquals(engine.getExchange("amq.topic").getType(), ExchangeType.TOPIC);
        Assert.assertEquals(engine.getExchange("amq.match").getType(), ExchangeType.HEADERS);
        engine.declareExchange("amq.direct", ExchangeType.DIRECT);
        Assert.expectThrows(AmqpRoutingException.ExchangeTypeConflictException.class,
                () -> engine.declareExchange("amq.fanout", ExchangeType.DIRECT));
        try {
            engine.deleteExchange("amq.direct");
            Assert.fail("built-in exchange must not be deleted");
        } catch (AmqpRoutingException.ExchangeAccessRefusedException e) {
            Assert.assertEquals(e.getErrorCode(), ErrorCodes.ACCESS_REFUSED);
        }
        Assert.expectThrows(AmqpRoutingException.ExchangeAccessRefusedException.class,
                () -> engine.declareExchange("amq.custom", ExchangeType.DIRECT));

        engine.bind("amq.topic", "q", "a.#", null);
        Assert.assertEquals(engine.route("amq.topic", "a.b", null), Set.of("q"));
    }

    @Test
    public void testExchangeNameIsFormatted() {
        declareQueues("q");
        engine.declareExchange(" logs\r\n", ExchangeType.DIRECT);
        engine.bind("logs", "q", "k", null);
        Assert.assertEquals(engine.route("logs\n", "k", null), Set.of("q"));
    }

    @Test
    public void testPublishUnroutable() {
        engine.declareExchange("e", ExchangeType.DIRECT);
        RoutingResult result = engine.publish("e", new AmqpMessage("nobody", Collections.emptyMap(), null));
        Assert.assertFalse(result.isRoutable());
        Assert.assertEquals(result.getExchange(), "e");
        Assert.assertEquals(result.getRoutingKey(), "nobody");
        verify(dispatcher, never()).dispatch(anyString(), any(AmqpMessage.class));
    }

    @Test
    public void testDispatcherFailurePropagates() {
        declareQueues("q");
        engine.declareExchange("e", ExchangeType.FANOUT);
        engine.bind("e", "q", "", null);
        doThrow(new IllegalStateException("queue store down")).when(dispatcher).dispatch(anyString(), any());
        Assert.expectThrows(IllegalStateException.class, () -> engine.publish("e", new AmqpMessage("", null)));
    }

    @Test
    public void testClosedEngine() {
        engine.declareExchange("e", ExchangeType.DIRECT);
        engine.close();
        Assert.assertTrue(engine.isClosed());
        Assert.expectThrows(AmqpRoutingException.EngineClosedException.class, () -> engine.route("e", "", null));
        Assert.expectThrows(AmqpRoutingException.EngineClosedException.class,
                () -> engine.declareExchange("x", ExchangeType.TOPIC));
        engine.close();
    }

    @Test
    public void testRouteToUndeclaredQueuesWhenConfigured() {
        AmqpRoutingConfiguration config = new AmqpRoutingConfiguration();
        config.setAmqpRouteToUndeclaredQueues(true);
        config.setAmqpBuiltInExchangesEnabled(false);
        config.setAmqpDefaultExchangeEnabled(false);
        try (ExchangeRoutingEngine lenient = new ExchangeRoutingEngine(config)) {
            lenient.declareExchange("e", ExchangeType.DIRECT);
            lenient.bind("e", "q", "k", null);
            Assert.assertEquals(lenient.route("e", "k", null), Set.of("q"));
            Assert.expectThrows(AmqpRoutingException.UnknownExchangeException.class,
                    () -> lenient.route("", "q", null));
            Assert.expectThrows(AmqpRoutingException.UnknownExchangeException.class,
                    () -> lenient.getExchange("amq.direct"));
        }
    }
}
