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

import java.util.OptionalLong;

@Value.Immutable
public interface AddProductItem {
    String getShoppingCartId();

    ProductItem getProductItem();

    OptionalLong getExpectedVersion();

    static AddProductItem of(String shoppingCartId, ProductItem productItem) {
        return new Builder().shoppingCartId(shoppingCartId).productItem(productItem).build();
    }

    static AddProductItem of(String shoppingCartId, ProductItem productItem, long expectedVersion) {
        return new Builder().shoppingCartId(shoppingCartId).productItem(productItem).expectedVersion(expectedVersion)
                .build();
    }

    class Builder extends ImmutableAddProductItem.Builder {

    }
}
