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
 * Fatal error signalling corrupted history or a projection bug: an event of unknown kind reached a fold, a stored
 * payload cannot be decoded, or a read model required by an event is missing. It is not recoverable by retrying, and
 * must never be swallowed.
 */
public class InconsistencyException extends RuntimeException {

    protected InconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }

    public static InconsistencyException unknownEvent(Object aggregate, Event event) {
        return new InconsistencyException("Unknown event kind " + (event == null ? null : event.getType())
                + " for " + aggregate.getClass().getSimpleName() + ": " + event, null);
    }

    public static InconsistencyException undecodableEvent(String streamId, long version, String type, Throwable cause) {
        return new InconsistencyException("Stream " + streamId + " contains event " + version + " of kind " + type
                + " that cannot be decoded", cause);
    }

    public static InconsistencyException missingReadModel(Class<?> readModelType, String id) {
        return new InconsistencyException("Read model " + readModelType.getSimpleName() + " " + id
                + " is required but missing", null);
    }

    public static InconsistencyException impossibleTransition(String streamId, String description) {
        return new InconsistencyException("Stream " + streamId + " cannot apply event: " + description, null);
    }
}
