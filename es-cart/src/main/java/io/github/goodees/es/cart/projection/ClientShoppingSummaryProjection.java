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

import io.github.goodees.es.cart.event.ProductItemAdded;
import io.github.goodees.es.cart.event.ProductItemRemoved;
import io.github.goodees.es.cart.event.ShoppingCartCanceled;
import io.github.goodees.es.cart.event.ShoppingCartConfirmed;
import io.github.goodees.es.cart.event.ShoppingCartEvent;
import io.github.goodees.es.cart.event.ShoppingCartOpened;
import io.github.goodees.es.core.projection.Projection;
import io.github.goodees.es.core.projection.ReadModelStore;

import java.math.BigDecimal;

/**
 * Maintains {@link ClientShoppingSummary} across all carts of a client. Pending carts are tracked by
 * {@link CartOwnership} rows, dropped when the cart closes.
 */
public class ClientShoppingSummaryProjection implements Projection<ShoppingCartEvent>,
        ShoppingCartEvent.Handler<Void> {
    private final ReadModelStore readModels;

    public ClientShoppingSummaryProjection(ReadModelStore readModels) {
        this.readModels = readModels;
    }

    @Override
    public void handle(ShoppingCartEvent event) {
        event.accept(this);
    }

    @Override
    public Void opened(ShoppingCartOpened event) {
        CartOwnership ownership = new CartOwnership();
        ownership.setCartId(event.streamId());
        ownership.setClientId(event.getClientId());
        readModels.store(CartOwnership.class, ownership.getCartId(), ownership);

        ClientShoppingSummary summary = readModels.find(ClientShoppingSummary.class, event.getClientId())
                .orElseGet(() -> newSummary(event.getClientId()));
        summary.setPendingCount(summary.getPendingCount() + 1);
        store(summary);
        return null;
    }

    @Override
    public Void productItemAdded(ProductItemAdded event) {
        changePendingTotal(event.streamId(), event.getProductItem().totalPrice());
        return null;
    }

    @Override
    public Void productItemRemoved(ProductItemRemoved event) {
        changePendingTotal(event.streamId(), event.getProductItem().totalPrice().negate());
        return null;
    }

    @Override
    public Void confirmed(ShoppingCartConfirmed event) {
        CartOwnership ownership = close(event);
        ClientShoppingSummary summary = readModels.require(ClientShoppingSummary.class, ownership.getClientId());
        summary.setPendingCount(summary.getPendingCount() - 1);
        summary.setPendingTotal(summary.getPendingTotal().subtract(ownership.getTotalPrice()));
        summary.setConfirmedCount(summary.getConfirmedCount() + 1);
        summary.setConfirmedTotal(summary.getConfirmedTotal().add(ownership.getTotalPrice()));
        store(summary);
        return null;
    }

    @Override
    public Void canceled(ShoppingCartCanceled event) {
        CartOwnership ownership = close(event);
        ClientShoppingSummary summary = readModels.require(ClientShoppingSummary.class, ownership.getClientId());
        summary.setPendingCount(summary.getPendingCount() - 1);
        summary.setPendingTotal(summary.getPendingTotal().subtract(ownership.getTotalPrice()));
        summary.setCanceledCount(summary.getCanceledCount() + 1);
        store(summary);
        return null;
    }

    private void changePendingTotal(String cartId, BigDecimal change) {
        CartOwnership ownership = readModels.require(CartOwnership.class, cartId);
        ownership.setTotalPrice(ownership.getTotalPrice().add(change));
        readModels.store(CartOwnership.class, cartId, ownership);

        ClientShoppingSummary summary = readModels.require(ClientShoppingSummary.class, ownership.getClientId());
        summary.setPendingTotal(summary.getPendingTotal().add(change));
        store(summary);
    }

    private CartOwnership close(ShoppingCartEvent event) {
        CartOwnership ownership = readModels.require(CartOwnership.class, event.streamId());
        readModels.delete(CartOwnership.class, event.streamId());
        return ownership;
    }

    private ClientShoppingSummary newSummary(String clientId) {
        ClientShoppingSummary summary = new ClientShoppingSummary();
        summary.setClientId(clientId);
        return summary;
    }

    private void store(ClientShoppingSummary summary) {
        readModels.store(ClientShoppingSummary.class, summary.getClientId(), summary);
    }
}
