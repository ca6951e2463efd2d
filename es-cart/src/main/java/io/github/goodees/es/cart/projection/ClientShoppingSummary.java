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

import java.math.BigDecimal;

/**
 * Shopping of a single client across all of their carts.
 */
public class ClientShoppingSummary {
    private String clientId;
    private int pendingCount;
    private int confirmedCount;
    private int canceledCount;
    private BigDecimal pendingTotal = BigDecimal.ZERO;
    private BigDecimal confirmedTotal = BigDecimal.ZERO;

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public int getPendingCount() {
        return pendingCount;
    }

    public void setPendingCount(int pendingCount) {
        this.pendingCount = pendingCount;
    }

    public int getConfirmedCount() {
        return confirmedCount;
    }

    public void setConfirmedCount(int confirmedCount) {
        this.confirmedCount = confirmedCount;
    }

    public int getCanceledCount() {
        return canceledCount;
    }

    public void setCanceledCount(int canceledCount) {
        this.canceledCount = canceledCount;
    }

    /**
     * @return sum of prices of carts still pending
     */
    public BigDecimal getPendingTotal() {
        return pendingTotal;
    }

    public void setPendingTotal(BigDecimal pendingTotal) {
        this.pendingTotal = pendingTotal;
    }

    public BigDecimal getConfirmedTotal() {
        return confirmedTotal;
    }

    public void setConfirmedTotal(BigDecimal confirmedTotal) {
        this.confirmedTotal = confirmedTotal;
    }
}
