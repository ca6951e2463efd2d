package io.github.goodees.es.core.immutables;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.goodees.es.core.Event;
import io.github.goodees.es.core.EventType;
import org.immutables.value.Value;

/**
 * Base of events defined with <a href="http://immutables.github.io">Immutables library</a>. An aggregate using this
 * approach defines its own base interface of events extending this one, and every event as an {@code @Value.Immutable}
 * interface annotated for Jackson with its generated implementation:
 * <pre>
 * &#64;Value.Immutable
 * &#64;JsonSerialize(as = ImmutableOrderShipped.class)
 * &#64;JsonDeserialize(as = ImmutableOrderShipped.class)
 * public interface OrderShipped extends OrderEvent { ... }
 * </pre>
 * <p>The package of the events must carry {@link ImmutablesSupport} in its {@code package-info.java}.</p>
 *
 * <p>The kind is not part of the payload, stores keep it next to it.</p>
 */
// allow for future additions to an event
@JsonIgnoreProperties(ignoreUnknown = true)
// Put key values at the front
@JsonPropertyOrder({ "streamId", "occurredAt" })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ImmutableEvent extends Event {

    @Override
    @Value.Auxiliary
    @JsonIgnore
    default String getType() {
        return EventType.ofValueType(getClass());
    }
}
