/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.issueoperator.k8s.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.SneakyThrows;

public class SerializationUtil {

    private static final ObjectMapper mapper =
            new ObjectMapper()
                    .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                    .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private SerializationUtil() {}

    @SneakyThrows
    public static <T> T deepCloneObject(T object) {
        if (object == null) {
            return null;
        }
        return (T) mapper.readValue(mapper.writeValueAsString(object), object.getClass());
    }

    @SneakyThrows
    public static String writeAsJson(Object object) {
        return mapper.writeValueAsString(object);
    }

    @SneakyThrows
    public static <T> T readJson(String string, Class<T> objectClass) {
        return mapper.readValue(string, objectClass);
    }

    @SneakyThrows
    public static <T> T readJson(String string, TypeReference<T> type) {
        return mapper.readValue(string, type);
    }
}
