package io.github.goodees.es.cart.projection;

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

import io.github.goodees.es.core.Result;
import io.github.goodees.es.core.projection.ReadModelStore;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side of shopping carts. Answers come from read models, and lag behind the event store only for the duration of
 * a command.
 */
public class ShoppingCartQueries {
    private final ReadModelStore readModels;

    public ShoppingCartQueries(ReadModelStore readModels) {
        this.readModels = readModels;
    }

    public Result<ShoppingCartDetails> getDetails(String shoppingCartId) {
        return readModels.find(ShoppingCartDetails.class, shoppingCartId).map(Result::success)
                .orElseGet(() -> Result.notFound("Shopping cart " + shoppingCartId + " not found"));
    }

    public Result<ShoppingCartShortInfo> getShortInfo(String shoppingCartId) {
        return readModels.find(ShoppingCartShortInfo.class, shoppingCartId).map(Result::success)
                .orElseGet(() -> Result.notFound("No pending shopping cart " + shoppingCartId));
    }

    /**
     * @return short info of all pending carts, ordered by cart id
     */
    public List<ShoppingCartShortInfo> getPendingCarts() {
        return readModels.findAll(ShoppingCartShortInfo.class);
    }

    public List<ShoppingCartShortInfo> getPendingCarts(String clientId) {
        return getPendingCarts().stream().filter(info -> clientId.equals(info.getClientId()))
                .collect(Collectors.toList());
    }

    public Result<ClientShoppingSummary> getClientSummary(String clientId) {
        return readModels.find(ClientShoppingSummary.class, clientId).map(Result::success)
                .orElseGet(() -> Result.notFound("Client " + clientId + " has no shopping carts"));
    }
}
