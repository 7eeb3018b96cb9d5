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

import io.streamnative.amqp.routing.AmqpRoutingConfiguration;
import io.streamnative.amqp.routing.utils.ConfigurationUtils;
import java.io.InputStream;
import java.util.Properties;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ConfigurationUtilsTest {

    @Test
    public void testDefaults() {
        AmqpRoutingConfiguration config = ConfigurationUtils.create(new Properties(), AmqpRoutingConfiguration.class);
        Assert.assertTrue(config.isAmqpDefaultExchangeEnabled());
        Assert.assertTrue(config.isAmqpBuiltInExchangesEnabled());
        Assert.assertFalse(config.isAmqpRouteToUndeclaredQueues());
        Assert.assertNull(config.getAmqpDefinitionsFile());
    }

    @Test
    public void testLoadFromProperties() throws Exception {
        AmqpRoutingConfiguration config;
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream("routing.properties")) {
            config = ConfigurationUtils.create(inputStream, AmqpRoutingConfiguration.class);
        }
        Assert.assertFalse(config.isAmqpBuiltInExchangesEnabled());
        Assert.assertTrue(config.isAmqpRouteToUndeclaredQueues());
        Assert.assertTrue(config.isAmqpDefaultExchangeEnabled());
        Assert.assertEquals(config.getAmqpDefinitionsFile(), "/tmp/definitions.json");
    }
}
