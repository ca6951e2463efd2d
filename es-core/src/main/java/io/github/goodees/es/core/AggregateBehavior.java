package io.github.goodees.es.core;

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

/**
 * Decision made on a rehydrated aggregate. A behavior validates the state, and either returns a failed {@link Result}
 * without touching the aggregate, or invokes aggregate methods that enqueue events and returns a success.
 *
 * @param <A> aggregate type
 */
@FunctionalInterface
public interface AggregateBehavior<A> {

    Result<?> execute(A aggregate);
}
