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

import static java.lang.String.format;

import com.google.common.collect.Maps;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.apache.pulsar.common.configuration.FieldContext;
import org.apache.pulsar.common.util.FieldParser;

/**
 * Loads configuration objects from properties.
 */
public final class ConfigurationUtils {

    /**
     * Creates a configuration from a properties file.
     *
     * @param configFile path of the properties file
     * @param clazz      configuration class, with a no-arg constructor
     */
    public static <T> T create(String configFile, Class<? extends T> clazz) throws IOException {
        try (InputStream inputStream = new FileInputStream(configFile)) {
            return create(inputStream, clazz);
        }
    }

    public static <T> T create(InputStream inStream, Class<? extends T> clazz) throws IOException {
        Properties properties = new Properties();
        properties.load(inStream);
        return create(properties, clazz);
    }

    public static <T> T create(Properties properties, Class<? extends T> clazz) {
        T obj;
        try {
            obj = clazz.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate " + clazz.getName(), e);
        }
        update(Maps.fromProperties(properties), obj);
        return obj;
    }

    /**
     * Sets the fields annotated with {@link FieldContext} from the matching keys of the map.
     * Keys without a matching field are ignored, blank values keep the default.
     */
    public static <T> void update(Map<String, String> properties, T obj) {
        for (Field f : obj.getClass().getDeclaredFields()) {
            if (Modifier.isStatic(f.getModifiers()) || !f.isAnnotationPresent(FieldContext.class)) {
                continue;
            }
            String value = properties.get(f.getName());
            if (StringUtils.isBlank(value)) {
                continue;
            }
            try {
                f.setAccessible(true);
                f.set(obj, FieldParser.value(value.trim(), f));
            } catch (Exception e) {
                throw new IllegalArgumentException(
                        format("failed to initialize %s field while setting value %s", f.getName(), value), e);
            }
        }
    }

    private ConfigurationUtils() {}

}
