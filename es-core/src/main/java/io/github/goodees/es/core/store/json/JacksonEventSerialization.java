package io.github.goodees.es.core.store.json;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.es.core.Event;
import io.github.goodees.es.core.EventType;
import io.github.goodees.es.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serialization of events into JSON. Every event class needs to be {@linkplain #register(Class) registered} under its
 * kind, so that the store can map the kind it kept next to the payload back to a class.
 *
 * <p>Deserialization returns {@code null} for a kind that was not registered, and for a payload version newer than
 * the one this serialization writes. Both mean that the history was written by a system this one does not know.</p>
 *
 * @param <E> base type of the events
 */
public class JacksonEventSerialization<E extends Event> implements Serialization<E> {
    private static final Logger logger = LoggerFactory.getLogger(JacksonEventSerialization.class);

    private final Class<E> baseType;
    private final ObjectMapper mapper;
    private final int payloadVersion;
    private final Map<String, Class<? extends E>> types = new ConcurrentHashMap<>();

    public JacksonEventSerialization(Class<E> baseType) {
        this(baseType, ObjectMappers.create(), 1);
    }

    public JacksonEventSerialization(Class<E> baseType, ObjectMapper mapper, int payloadVersion) {
        this.baseType = baseType;
        this.mapper = mapper;
        this.payloadVersion = payloadVersion;
    }

    /**
     * Make an event class known to this serialization.
     * @param eventType the abstract value type of an event, or its implementation
     * @return this
     * @throws IllegalArgumentException when another class is registered under the same kind
     */
    public JacksonEventSerialization<E> register(Class<? extends E> eventType) {
        String kind = EventType.ofValueType(eventType);
        Class<? extends E> previous = types.putIfAbsent(kind, eventType);
        if (previous != null && previous != eventType) {
            throw new IllegalArgumentException("Kind " + kind + " is already used by " + previous.getName());
        }
        return this;
    }

    @Override
    public int payloadVersion(E object) {
        return payloadVersion;
    }

    @Override
    public String serialize(E object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object.getType(), e);
        }
    }

    @Override
    public E deserialize(int payloadVersion, String payload, String type) {
        if (payloadVersion > this.payloadVersion) {
            logger.warn("Payload version {} of {} is newer than supported {}", payloadVersion, type,
                this.payloadVersion);
            return null;
        }
        Class<? extends E> eventClass = types.get(type);
        if (eventClass == null) {
            return null;
        }
        try {
            return mapper.readValue(payload, eventClass);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed payload of " + type, e);
        }
    }

    @Override
    public E toSerializable(Object o) {
        return baseType.isInstance(o) ? baseType.cast(o) : null;
    }
}
