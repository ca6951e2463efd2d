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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains {@link ShoppingCartShortInfo} of pending carts, and removes it once a cart is closed.
 */
public class ShoppingCartShortInfoProjection implements Projection<ShoppingCartEvent>, ShoppingCartEvent.Handler<Void> {
    private static final Logger logger = LoggerFactory.getLogger(ShoppingCartShortInfoProjection.class);

    private final ReadModelStore readModels;

    public ShoppingCartShortInfoProjection(ReadModelStore readModels) {
        this.readModels = readModels;
    }

    @Override
    public void handle(ShoppingCartEvent event) {
        event.accept(this);
    }

    @Override
    public Void opened(ShoppingCartOpened event) {
        ShoppingCartShortInfo info = new ShoppingCartShortInfo();
        info.setId(event.streamId());
        info.setClientId(event.getClientId());
        store(info);
        return null;
    }

    @Override
    public Void productItemAdded(ProductItemAdded event) {
        ShoppingCartShortInfo info = readModels.require(ShoppingCartShortInfo.class, event.streamId());
        info.setTotalPrice(info.getTotalPrice().add(event.getProductItem().totalPrice()));
        info.setTotalItemsCount(info.getTotalItemsCount() + event.getProductItem().getQuantity());
        store(info);
        return null;
    }

    @Override
    public Void productItemRemoved(ProductItemRemoved event) {
        ShoppingCartShortInfo info = readModels.require(ShoppingCartShortInfo.class, event.streamId());
        info.setTotalPrice(info.getTotalPrice().subtract(event.getProductItem().totalPrice()));
        info.setTotalItemsCount(info.getTotalItemsCount() - event.getProductItem().getQuantity());
        store(info);
        return null;
    }

    @Override
    public Void confirmed(ShoppingCartConfirmed event) {
        remove(event);
        return null;
    }

    @Override
    public Void canceled(ShoppingCartCanceled event) {
        remove(event);
        return null;
    }

    private void store(ShoppingCartShortInfo info) {
        readModels.store(ShoppingCartShortInfo.class, info.getId(), info);
    }

    private void remove(ShoppingCartEvent event) {
        if (!readModels.delete(ShoppingCartShortInfo.class, event.streamId())) {
            logger.warn("Closed cart {} had no short info", event.streamId());
        }
    }
}
