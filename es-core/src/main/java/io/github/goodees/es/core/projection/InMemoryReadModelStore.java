package io.github.goodees.es.core.projection;

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
import io.github.goodees.es.core.store.json.ObjectMappers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Read model store keeping rows as JSON documents in memory. Every read deserializes a fresh copy, so callers never
 * share mutable state with the store nor with each other.
 */
public class InMemoryReadModelStore implements ReadModelStore {
    private final ObjectMapper mapper;
    private final ConcurrentMap<Class<?>, ConcurrentNavigableMap<String, String>> tables = new ConcurrentHashMap<>();

    public InMemoryReadModelStore() {
        this(ObjectMappers.create());
    }

    public InMemoryReadModelStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    private ConcurrentNavigableMap<String, String> table(Class<?> type) {
        return tables.computeIfAbsent(type, t -> new ConcurrentSkipListMap<>());
    }

    @Override
    public <T> Optional<T> find(Class<T> type, String id) {
        String json = table(type).get(id);
        return json == null ? Optional.empty() : Optional.of(read(type, json));
    }

    @Override
    public <T> void store(Class<T> type, String id, T readModel) {
        try {
            table(type).put(id, mapper.writeValueAsString(readModel));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot store " + type.getSimpleName() + " " + id, e);
        }
    }

    @Override
    public boolean delete(Class<?> type, String id) {
        return table(type).remove(id) != null;
    }

    @Override
    public <T> List<T> findAll(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (String json : table(type).values()) {
            result.add(read(type, json));
        }
        return result;
    }

    @Override
    public void clear() {
        tables.clear();
    }

    private <T> T read(Class<T> type, String json) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored " + type.getSimpleName() + " cannot be read", e);
        }
    }
}
