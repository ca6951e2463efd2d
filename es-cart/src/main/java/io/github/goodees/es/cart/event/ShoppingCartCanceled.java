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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.time.Instant;

@Value.Immutable
@JsonSerialize(as = ImmutableShoppingCartCanceled.class)
@JsonDeserialize(as = ImmutableShoppingCartCanceled.class)
public interface ShoppingCartCanceled extends ShoppingCartEvent {

    @Override
    default <R> R accept(Handler<R> handler) {
        return handler.canceled(this);
    }

    static ShoppingCartCanceled of(String shoppingCartId, Instant occurredAt) {
        return new Builder().streamId(shoppingCartId).occurredAt(occurredAt).build();
    }

    class Builder extends ImmutableShoppingCartCanceled.Builder {

    }
}
