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

import java.math.BigDecimal;

/**
 * Product line with the unit price valid at time it was added to a cart.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePricedProductItem.class)
@JsonDeserialize(as = ImmutablePricedProductItem.class)
public interface PricedProductItem {
    String getProductId();

    int getQuantity();

    BigDecimal getUnitPrice();

    default BigDecimal totalPrice() {
        return getUnitPrice().multiply(BigDecimal.valueOf(getQuantity()));
    }

    @Value.Check
    default void check() {
        if (getQuantity() <= 0) {
            throw new IllegalStateException("Quantity of " + getProductId() + " must be positive, was "
                    + getQuantity());
        }
        if (getUnitPrice().signum() < 0) {
            throw new IllegalStateException("Unit price of " + getProductId() + " cannot be negative");
        }
    }

    static PricedProductItem of(String productId, int quantity, BigDecimal unitPrice) {
        return new Builder().productId(productId).quantity(quantity).unitPrice(unitPrice).build();
    }

    class Builder extends ImmutablePricedProductItem.Builder {

    }
}
