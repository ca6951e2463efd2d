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
import io.github.goodees.es.cart.event.ProductItemAdded;
import io.github.goodees.es.cart.event.ProductItemRemoved;
import io.github.goodees.es.cart.event.ShoppingCartCanceled;
import io.github.goodees.es.cart.event.ShoppingCartConfirmed;
import io.github.goodees.es.cart.event.ShoppingCartEvent;
import io.github.goodees.es.cart.event.ShoppingCartOpened;
import io.github.goodees.es.core.EventSourcedAggregate;
import io.github.goodees.es.core.InconsistencyException;
import io.github.goodees.es.core.Result;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shopping cart of a client. The cart is opened empty, products are added and removed while it is pending, and it is
 * finally either confirmed or canceled. Closed cart cannot change anymore.
 *
 * <p>Products are kept as lines keyed by product id. Adding a product already in the cart increases the quantity of
 * its line, the line keeps the unit price it was first added with. A line whose quantity drops to zero is removed.</p>
 */
public class ShoppingCart extends EventSourcedAggregate<ShoppingCartEvent> {
    private String id;
    private String clientId;
    private ShoppingCartStatus status = ShoppingCartStatus.PENDING;
    private final Map<String, PricedProductItem> productItems = new LinkedHashMap<>();
    private Instant openedAt;
    private Instant confirmedAt;
    private Instant canceledAt;

    private final ShoppingCartEvent.Handler<Void> evolution = new Evolution();

    /**
     * Zero state, before the cart was opened.
     */
    public static ShoppingCart initial() {
        return new ShoppingCart();
    }

    protected ShoppingCart() {
    }

    public String getId() {
        return id;
    }

    public String getClientId() {
        return clientId;
    }

    public ShoppingCartStatus getStatus() {
        return status;
    }

    public boolean isClosed() {
        return status.isClosed();
    }

    public List<PricedProductItem> getProductItems() {
        return new ArrayList<>(productItems.values());
    }

    public int quantityOf(String productId) {
        PricedProductItem line = productItems.get(productId);
        return line == null ? 0 : line.getQuantity();
    }

    public BigDecimal getTotalPrice() {
        return productItems.values().stream().map(PricedProductItem::totalPrice).reduce(BigDecimal.ZERO,
            BigDecimal::add);
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public Optional<Instant> getConfirmedAt() {
        return Optional.ofNullable(confirmedAt);
    }

    public Optional<Instant> getCanceledAt() {
        return Optional.ofNullable(canceledAt);
    }

    public Result<Void> open(String shoppingCartId, String clientId, Instant now) {
        if (id != null) {
            return Result.validation("Shopping cart " + id + " is already opened");
        }
        enqueue(ShoppingCartOpened.of(shoppingCartId, clientId, now));
        return Result.success(null);
    }

    public Result<PricedProductItem> addProductItem(ProductPriceCalculator priceCalculator, ProductItem productItem,
            Instant now) {
        if (isClosed()) {
            return Result.validation("Adding product item to cart in '" + status + "' status is not allowed");
        }
        Optional<PricedProductItem> priced = priceCalculator.calculate(productItem);
        if (!priced.isPresent()) {
            return Result.notFound("Product " + productItem.getProductId() + " has no price");
        }
        long itemsCount = productItems.values().stream().mapToLong(PricedProductItem::getQuantity).sum();
        if (itemsCount + productItem.getQuantity() > Integer.MAX_VALUE) {
            return Result.validation("Cart " + id + " cannot hold " + productItem.getQuantity() + " more items");
        }
        PricedProductItem line = productItems.get(productItem.getProductId());
        // a product already in the cart keeps its unit price
        PricedProductItem added = line == null ? priced.get()
                : PricedProductItem.of(line.getProductId(), productItem.getQuantity(), line.getUnitPrice());
        enqueue(ProductItemAdded.of(id, added, now));
        return Result.success(added);
    }

    public Result<PricedProductItem> removeProductItem(ProductItem productItem, Instant now) {
        if (isClosed()) {
            return Result.validation("Removing product item from cart in '" + status + "' status is not allowed");
        }
        PricedProductItem line = productItems.get(productItem.getProductId());
        if (line == null || line.getQuantity() < productItem.getQuantity()) {
            return Result.validation("Not enough items of product " + productItem.getProductId() + " to remove "
                    + productItem.getQuantity());
        }
        PricedProductItem removed = PricedProductItem.of(line.getProductId(), productItem.getQuantity(),
            line.getUnitPrice());
        enqueue(ProductItemRemoved.of(id, removed, now));
        return Result.success(removed);
    }

    public Result<Void> confirm(Instant now) {
        if (isClosed()) {
            return Result.validation("Confirming cart in '" + status + "' status is not allowed");
        }
        if (productItems.isEmpty()) {
            return Result.validation("Cannot confirm empty shopping cart");
        }
        enqueue(ShoppingCartConfirmed.of(id, now));
        return Result.success(null);
    }

    public Result<Void> cancel(Instant now) {
        if (isClosed()) {
            return Result.validation("Canceling cart in '" + status + "' status is not allowed");
        }
        enqueue(ShoppingCartCanceled.of(id, now));
        return Result.success(null);
    }

    @Override
    protected void updateState(ShoppingCartEvent event) {
        if (event == null) {
            throw InconsistencyException.unknownEvent(this, null);
        }
        event.accept(evolution);
    }

    private class Evolution implements ShoppingCartEvent.Handler<Void> {

        @Override
        public Void opened(ShoppingCartOpened event) {
            id = event.streamId();
            clientId = event.getClientId();
            status = ShoppingCartStatus.PENDING;
            openedAt = event.getOccurredAt();
            return null;
        }

        @Override
        public Void productItemAdded(ProductItemAdded event) {
            PricedProductItem added = event.getProductItem();
            productItems.merge(added.getProductId(), added, (current, more) -> PricedProductItem.of(
                current.getProductId(), current.getQuantity() + more.getQuantity(), current.getUnitPrice()));
            return null;
        }

        @Override
        public Void productItemRemoved(ProductItemRemoved event) {
            PricedProductItem removed = event.getProductItem();
            PricedProductItem current = productItems.get(removed.getProductId());
            if (current == null || current.getQuantity() < removed.getQuantity()) {
                throw InconsistencyException.impossibleTransition(event.streamId(), "removal of "
                        + removed.getQuantity() + " " + removed.getProductId() + " from " + current);
            }
            if (current.getQuantity() == removed.getQuantity()) {
                productItems.remove(removed.getProductId());
            } else {
                productItems.put(removed.getProductId(), PricedProductItem.of(current.getProductId(),
                    current.getQuantity() - removed.getQuantity(), current.getUnitPrice()));
            }
            return null;
        }

        @Override
        public Void confirmed(ShoppingCartConfirmed event) {
            status = ShoppingCartStatus.CONFIRMED;
            confirmedAt = event.getOccurredAt();
            return null;
        }

        @Override
        public Void canceled(ShoppingCartCanceled event) {
            status = ShoppingCartStatus.CANCELED;
            canceledAt = event.getOccurredAt();
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ShoppingCart that = (ShoppingCart) o;
        return getVersion() == that.getVersion() && Objects.equals(id, that.id)
                && Objects.equals(clientId, that.clientId) && status == that.status
                && Objects.equals(productItems, that.productItems) && Objects.equals(openedAt, that.openedAt)
                && Objects.equals(confirmedAt, that.confirmedAt) && Objects.equals(canceledAt, that.canceledAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, clientId, status, productItems, openedAt, confirmedAt, canceledAt, getVersion());
    }

    @Override
    public String toString() {
        return "ShoppingCart{" + "id=" + id + ", clientId=" + clientId + ", status=" + status + ", productItems="
                + productItems.values() + ", version=" + getVersion() + '}';
    }
}
