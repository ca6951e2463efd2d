package io.github.goodees.es.core.store.jdbc;

/*-
 * #%L
 * es-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.es.core.TestEvent;
import io.github.goodees.es.core.store.Serialization;

import java.time.Instant;

public class TestEventSerialization implements Serialization<TestEvent> {
    private boolean storeHex = false;

    public void setStoreHex(boolean storeHex) {
        this.storeHex = storeHex;
    }

    @Override
    public int payloadVersion(TestEvent object) {
        return storeHex ? 2 : 1;
    }

    @Override
    public String serialize(TestEvent object) {
        String payload = storeHex ? Integer.toHexString(object.getPayload()) : Integer.toString(object.getPayload());
        return String.format("%s|%s|%s", object.streamId(), object.getOccurredAt().toString(), payload);
    }

    @Override
    public TestEvent deserialize(int payloadVersion, String payload, String type) {
        if (!"Test".equals(type)) {
            return null;
        }
        String[] parts = payload.split("\\|");
        return new TestEvent(parts[0], Instant.parse(parts[1]), Integer.parseInt(parts[2], payloadVersion == 1 ? 10
                : 16));
    }

    @Override
    public TestEvent toSerializable(Object o) {
        return o instanceof TestEvent ? (TestEvent) o : null;
    }
}
