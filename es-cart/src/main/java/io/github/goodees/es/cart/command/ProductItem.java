package io.github.goodees.es.cart.command;

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

import org.immutables.value.Value;

/**
 * Product and quantity requested by a client, not yet priced.
 */
@Value.Immutable
public interface ProductItem {
    String getProductId();

    int getQuantity();

    @Value.Check
    default void check() {
        if (getQuantity() <= 0) {
            throw new IllegalStateException("Quantity of " + getProductId() + " must be positive, was "
                    + getQuantity());
        }
    }

    static ProductItem of(String productId, int quantity) {
        return new Builder().productId(productId).quantity(quantity).build();
    }

    class Builder extends ImmutableProductItem.Builder {

    }
}
