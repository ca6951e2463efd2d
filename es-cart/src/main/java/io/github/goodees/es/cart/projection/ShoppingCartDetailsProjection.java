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

import io.github.goodees.es.cart.ShoppingCartStatus;
import io.github.goodees.es.cart.event.PricedProductItem;
import io.github.goodees.es.cart.event.ProductItemAdded;
import io.github.goodees.es.cart.event.ProductItemRemoved;
import io.github.goodees.es.cart.event.ShoppingCartCanceled;
import io.github.goodees.es.cart.event.ShoppingCartConfirmed;
import io.github.goodees.es.cart.event.ShoppingCartEvent;
import io.github.goodees.es.cart.event.ShoppingCartOpened;
import io.github.goodees.es.core.InconsistencyException;
import io.github.goodees.es.core.projection.Projection;
import io.github.goodees.es.core.projection.ReadModelStore;

import java.util.List;

/**
 * Maintains {@link ShoppingCartDetails} of every cart.
 */
public class ShoppingCartDetailsProjection implements Projection<ShoppingCartEvent>,
        ShoppingCartEvent.Handler<ShoppingCartDetails> {
    private final ReadModelStore readModels;

    public ShoppingCartDetailsProjection(ReadModelStore readModels) {
        this.readModels = readModels;
    }

    @Override
    public void handle(ShoppingCartEvent event) {
        ShoppingCartDetails details = event.accept(this);
        details.setVersion(details.getVersion() + 1);
        readModels.store(ShoppingCartDetails.class, details.getId(), details);
    }

    @Override
    public ShoppingCartDetails opened(ShoppingCartOpened event) {
        ShoppingCartDetails details = new ShoppingCartDetails();
        details.setId(event.streamId());
        details.setClientId(event.getClientId());
        details.setStatus(ShoppingCartStatus.PENDING);
        details.setOpenedAt(event.getOccurredAt());
        return details;
    }

    @Override
    public ShoppingCartDetails productItemAdded(ProductItemAdded event) {
        ShoppingCartDetails details = readModels.require(ShoppingCartDetails.class, event.streamId());
        PricedProductItem added = event.getProductItem();
        List<PricedProductItem> items = details.getProductItems();
        int index = indexOf(items, added.getProductId());
        if (index < 0) {
            items.add(added);
        } else {
            PricedProductItem current = items.get(index);
            items.set(index, PricedProductItem.of(current.getProductId(), current.getQuantity() + added.getQuantity(),
                current.getUnitPrice()));
        }
        details.recalculateTotals();
        return details;
    }

    @Override
    public ShoppingCartDetails productItemRemoved(ProductItemRemoved event) {
        ShoppingCartDetails details = readModels.require(ShoppingCartDetails.class, event.streamId());
        PricedProductItem removed = event.getProductItem();
        List<PricedProductItem> items = details.getProductItems();
        int index = indexOf(items, removed.getProductId());
        if (index < 0 || items.get(index).getQuantity() < removed.getQuantity()) {
            throw InconsistencyException.impossibleTransition(event.streamId(), "details have no "
                    + removed.getQuantity() + " of " + removed.getProductId() + " to remove");
        }
        PricedProductItem current = items.get(index);
        if (current.getQuantity() == removed.getQuantity()) {
            items.remove(index);
        } else {
            items.set(index, PricedProductItem.of(current.getProductId(), current.getQuantity() - removed.getQuantity(),
                current.getUnitPrice()));
        }
        details.recalculateTotals();
        return details;
    }

    @Override
    public ShoppingCartDetails confirmed(ShoppingCartConfirmed event) {
        ShoppingCartDetails details = readModels.require(ShoppingCartDetails.class, event.streamId());
        details.setStatus(ShoppingCartStatus.CONFIRMED);
        details.setConfirmedAt(event.getOccurredAt());
        return details;
    }

    @Override
    public ShoppingCartDetails canceled(ShoppingCartCanceled event) {
        ShoppingCartDetails details = readModels.require(ShoppingCartDetails.class, event.streamId());
        details.setStatus(ShoppingCartStatus.CANCELED);
        details.setCanceledAt(event.getOccurredAt());
        return details;
    }

    private static int indexOf(List<PricedProductItem> items, String productId) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getProductId().equals(productId)) {
                return i;
            }
        }
        return -1;
    }
}
