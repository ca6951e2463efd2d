package io.github.goodees.es.cart.event;

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

import io.github.goodees.es.core.immutables.ImmutableEvent;

/**
 * Base of all events of a shopping cart. The stream id is the id of the cart.
 */
public interface ShoppingCartEvent extends ImmutableEvent {

    /**
     * Dispatch to the branch of the handler matching this kind.
     * @param handler branches for every kind
     * @param <R> result of the handler
     * @return what the branch returned
     */
    <R> R accept(Handler<R> handler);

    /**
     * Exhaustive handling of shopping cart events. Adding a new kind of event adds a method here, so every fold site
     * has to handle it.
     */
    interface Handler<R> {
        R opened(ShoppingCartOpened event);

        R productItemAdded(ProductItemAdded event);

        R productItemRemoved(ProductItemRemoved event);

        R confirmed(ShoppingCartConfirmed event);

        R canceled(ShoppingCartCanceled event);
    }
}
