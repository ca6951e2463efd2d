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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Full view of a single cart, kept for its whole life.
 */
public class ShoppingCartDetails {
    private String id;
    private String clientId;
    private ShoppingCartStatus status;
    private List<PricedProductItem> productItems = new ArrayList<>();
    private Instant openedAt;
    private Instant confirmedAt;
    private Instant canceledAt;
    private BigDecimal totalPrice = BigDecimal.ZERO;
    private int totalItemsCount;
    private long version;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public ShoppingCartStatus getStatus() {
        return status;
    }

    public void setStatus(ShoppingCartStatus status) {
        this.status = status;
    }

    public List<PricedProductItem> getProductItems() {
        return productItems;
    }

    public void setProductItems(List<PricedProductItem> productItems) {
        this.productItems = productItems;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public void setOpenedAt(Instant openedAt) {
        this.openedAt = openedAt;
    }

    public Instant getConfirmedAt() {
        return confirmedAt;
    }

    public void setConfirmedAt(Instant confirmedAt) {
        this.confirmedAt = confirmedAt;
    }

    public Instant getCanceledAt() {
        return canceledAt;
    }

    public void setCanceledAt(Instant canceledAt) {
        this.canceledAt = canceledAt;
    }

    public BigDecimal getTotalPrice() {
        return totalPrice;
    }

    public void setTotalPrice(BigDecimal totalPrice) {
        this.totalPrice = totalPrice;
    }

    public int getTotalItemsCount() {
        return totalItemsCount;
    }

    public void setTotalItemsCount(int totalItemsCount) {
        this.totalItemsCount = totalItemsCount;
    }

    /**
     * @return number of events applied to this row, equal to the version of the cart stream
     */
    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    void recalculateTotals() {
        BigDecimal price = BigDecimal.ZERO;
        int count = 0;
        for (PricedProductItem item : productItems) {
            price = price.add(item.totalPrice());
            count += item.getQuantity();
        }
        this.totalPrice = price;
        this.totalItemsCount = count;
    }
}
