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

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price list held in memory.
 */
public class CatalogPriceCalculator implements ProductPriceCalculator {
    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    public CatalogPriceCalculator withPrice(String productId, BigDecimal unitPrice) {
        if (unitPrice.signum() < 0) {
            throw new IllegalArgumentException("Price of " + productId + " cannot be negative");
        }
        prices.put(productId, unitPrice);
        return this;
    }

    @Override
    public Optional<PricedProductItem> calculate(ProductItem productItem) {
        BigDecimal price = prices.get(productItem.getProductId());
        return price == null ? Optional.empty()
                : Optional.of(PricedProductItem.of(productItem.getProductId(), productItem.getQuantity(), price));
    }
}
