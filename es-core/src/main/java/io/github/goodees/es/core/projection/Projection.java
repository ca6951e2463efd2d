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

import io.github.goodees.es.core.Event;

/**
 * Folds events into one or more read models.
 *
 * <p>Projection receives events in commit order. It must apply them deterministically, so that a rebuild from the
 * full history yields the same read models as incremental application. A read model that is required but missing is
 * reported with {@link io.github.goodees.es.core.InconsistencyException}.</p>
 *
 * @param <E> events the projection consumes
 */
@FunctionalInterface
public interface Projection<E extends Event> {

    void handle(E event);
}
