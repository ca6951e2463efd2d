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

import io.github.goodees.es.cart.command.ProductItem;
import io.github.goodees.es.cart.event.PricedProductItem;

import java.util.Optional;

/**
 * Prices products being added to a cart.
 */
@FunctionalInterface
public interface ProductPriceCalculator {

    /**
     * @param productItem requested product and quantity
     * @return the item with current unit price, or empty when the product has no price
     */
    Optional<PricedProductItem> calculate(ProductItem productItem);
}
