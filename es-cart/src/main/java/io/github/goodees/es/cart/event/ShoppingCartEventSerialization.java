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

import io.github.goodees.es.core.store.json.JacksonEventSerialization;

/**
 * JSON payloads of shopping cart events, as kept by persistent event stores.
 */
public class ShoppingCartEventSerialization extends JacksonEventSerialization<ShoppingCartEvent> {

    public ShoppingCartEventSerialization() {
        super(ShoppingCartEvent.class);
        register(ShoppingCartOpened.class);
        register(ProductItemAdded.class);
        register(ProductItemRemoved.class);
        register(ShoppingCartConfirmed.class);
        register(ShoppingCartCanceled.class);
    }
}
