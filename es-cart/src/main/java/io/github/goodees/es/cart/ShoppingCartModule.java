package io.github.goodees.es.cart;

/*-
 * #%L
 * es-cart
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

import io.github.goodees.es.cart.event.ShoppingCartEvent;
import io.github.goodees.es.cart.projection.ClientShoppingSummaryProjection;
import io.github.goodees.es.cart.projection.ShoppingCartDetailsProjection;
import io.github.goodees.es.cart.projection.ShoppingCartQueries;
import io.github.goodees.es.cart.projection.ShoppingCartShortInfoProjection;
import io.github.goodees.es.core.CommandHandler;
import io.github.goodees.es.core.projection.InMemoryReadModelStore;
import io.github.goodees.es.core.projection.ProjectionEngine;
import io.github.goodees.es.core.projection.ReadModelStore;
import io.github.goodees.es.core.store.EventStore;
import io.github.goodees.es.core.store.EventStoreException;
import io.github.goodees.es.core.store.inmemory.InMemoryEventStore;

import java.time.Clock;
import java.util.Objects;

/**
 * Wiring of shopping carts: event store, command side, projections and queries. Collaborators not set on the
 * {@link Builder} default to in-memory implementations and system UTC clock.
 */
public final class ShoppingCartModule {
    private final EventStore<ShoppingCartEvent> eventStore;
    private final ReadModelStore readModels;
    private final ProjectionEngine<ShoppingCartEvent> projections;
    private final ShoppingCartService service;
    private final ShoppingCartQueries queries;

    private ShoppingCartModule(Builder builder) {
        this.eventStore = builder.eventStore;
        this.readModels = builder.readModels;
        this.projections = new ProjectionEngine<ShoppingCartEvent>()
                .register(new ShoppingCartDetailsProjection(readModels))
                .register(new ShoppingCartShortInfoProjection(readModels))
                .register(new ClientShoppingSummaryProjection(readModels));
        CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(eventStore,
                ShoppingCart::initial, projections);
        this.service = new ShoppingCartService(commandHandler, builder.priceCalculator, builder.clock);
        this.queries = new ShoppingCartQueries(readModels);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ShoppingCartService getService() {
        return service;
    }

    public ShoppingCartQueries getQueries() {
        return queries;
    }

    public EventStore<ShoppingCartEvent> getEventStore() {
        return eventStore;
    }

    public ProjectionEngine<ShoppingCartEvent> getProjections() {
        return projections;
    }

    /**
     * Drop all read models and project them again from the full history.
     * @return number of events replayed
     * @throws EventStoreException when the history cannot be read
     */
    public long rebuildProjections() throws EventStoreException {
        synchronized (projections) {
            readModels.clear();
            return projections.rebuild(eventStore.readAll());
        }
    }

    public static class Builder {
        private EventStore<ShoppingCartEvent> eventStore;
        private ReadModelStore readModels;
        private ProductPriceCalculator priceCalculator;
        private Clock clock;

        Builder() {
        }

        public Builder eventStore(EventStore<ShoppingCartEvent> eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder readModelStore(ReadModelStore readModels) {
            this.readModels = readModels;
            return this;
        }

        public Builder priceCalculator(ProductPriceCalculator priceCalculator) {
            this.priceCalculator = priceCalculator;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ShoppingCartModule build() {
            Objects.requireNonNull(priceCalculator, "Price calculator is required");
            if (eventStore == null) {
                eventStore = new InMemoryEventStore<>();
            }
            if (readModels == null) {
                readModels = new InMemoryReadModelStore();
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            return new ShoppingCartModule(this);
        }
    }
}
