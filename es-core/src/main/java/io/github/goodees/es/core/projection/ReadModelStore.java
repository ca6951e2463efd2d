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

import io.github.goodees.es.core.InconsistencyException;

import java.util.List;
import java.util.Optional;

/**
 * Keyed storage of read models. Rows are addressed by their type and id; the same id may be used for rows of
 * different types.
 *
 * <p>Implementations return detached copies, modifying a found row has no effect until it is
 * {@linkplain #store(Class, String, Object) stored} again.</p>
 */
public interface ReadModelStore {

    <T> Optional<T> find(Class<T> type, String id);

    /**
     * Create or replace a row.
     */
    <T> void store(Class<T> type, String id, T readModel);

    /**
     * @return true when the row existed
     */
    boolean delete(Class<?> type, String id);

    /**
     * @return all rows of given type ordered by id
     */
    <T> List<T> findAll(Class<T> type);

    /**
     * Remove all rows of all types.
     */
    void clear();

    /**
     * Find a row that must exist.
     * @throws InconsistencyException when the row is missing
     */
    default <T> T require(Class<T> type, String id) {
        return find(type, id).orElseThrow(() -> InconsistencyException.missingReadModel(type, id));
    }
}
