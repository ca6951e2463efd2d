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

@Value.Immutable
public interface OpenShoppingCart {
    String getShoppingCartId();

    String getClientId();

    static OpenShoppingCart of(String shoppingCartId, String clientId) {
        return new Builder().shoppingCartId(shoppingCartId).clientId(clientId).build();
    }

    class Builder extends ImmutableOpenShoppingCart.Builder {

    }
}
