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
import io.github.goodees.es.cart.event.ShoppingCartEvent;
import io.github.goodees.es.cart.event.ShoppingCartOpened;
import io.github.goodees.es.core.EventSourcedAggregate;
import io.github.goodees.es.core.Result;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ShoppingCartTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final CatalogPriceCalculator prices = new CatalogPriceCalculator().withPrice("A", HUNDRED)
            .withPrice("B", new BigDecimal("50"));

    private ShoppingCart opened() {
        ShoppingCart cart = ShoppingCart.initial();
        assertTrue(cart.open("cart", "client", NOW).isSuccess());
        return cart;
    }

    @Test
    public void initial_state_has_no_identity() {
        ShoppingCart cart = ShoppingCart.initial();
        assertEquals(null, cart.getId());
        assertEquals(0, cart.getVersion());
        assertThat(cart.getProductItems(), is(empty()));
    }

    @Test
    public void open_produces_opened_event() {
        ShoppingCart cart = opened();
        assertEquals("cart", cart.getId());
        assertEquals("client", cart.getClientId());
        assertEquals(ShoppingCartStatus.PENDING, cart.getStatus());
        assertEquals(NOW, cart.getOpenedAt());
        assertThat(cart.getPendingEvents(), contains(instanceOf(ShoppingCartOpened.class)));
    }

    @Test
    public void cart_cannot_be_opened_twice() {
        ShoppingCart cart = opened();
        Result<Void> result = cart.open("cart", "other", NOW);
        assertEquals(Result.Fault.VALIDATION, result.getFault());
        assertEquals("client", cart.getClientId());
        assertEquals(1, cart.getPendingEvents().size());
    }

    @Test
    public void adding_same_product_sums_quantity_at_original_price() {
        ShoppingCart cart = opened();
        cart.addProductItem(prices, ProductItem.of("A", 2), NOW);
        prices.withPrice("A", new BigDecimal("120"));
        cart.addProductItem(prices, ProductItem.of("A", 1), NOW);

        assertThat(cart.getProductItems(), contains(PricedProductItem.of("A", 3, HUNDRED)));
        assertEquals(3, cart.quantityOf("A"));
        assertEquals(0, new BigDecimal("300").compareTo(cart.getTotalPrice()));
        ProductItemAdded second = (ProductItemAdded) cart.getPendingEvents().get(2);
        assertEquals(PricedProductItem.of("A", 1, HUNDRED), second.getProductItem());
    }

    @Test
    public void item_count_overflow_is_rejected_before_event() {
        ShoppingCart cart = opened();
        assertTrue(cart.addProductItem(prices, ProductItem.of("A", Integer.MAX_VALUE), NOW).isSuccess());

        assertEquals(Result.Fault.VALIDATION, cart.addProductItem(prices, ProductItem.of("A", 1), NOW).getFault());
        assertEquals(Result.Fault.VALIDATION, cart.addProductItem(prices, ProductItem.of("B", 1), NOW).getFault());
        assertEquals(2, cart.getPendingEvents().size());
        assertEquals(Integer.MAX_VALUE, cart.quantityOf("A"));
    }

    @Test
    public void product_without_price_is_not_found() {
        ShoppingCart cart = opened();
        Result<PricedProductItem> result = cart.addProductItem(prices, ProductItem.of("unknown", 1), NOW);
        assertEquals(Result.Fault.NOT_FOUND, result.getFault());
        assertEquals(1, cart.getPendingEvents().size());
    }

    @Test
    public void removing_all_items_deletes_line_and_empty_cart_cannot_be_confirmed() {
        ShoppingCart cart = opened();
        cart.addProductItem(prices, ProductItem.of("A", 2), NOW);
        cart.addProductItem(prices, ProductItem.of("A", 1), NOW);

        Result<PricedProductItem> removed = cart.removeProductItem(ProductItem.of("A", 3), NOW);
        assertEquals(PricedProductItem.of("A", 3, HUNDRED), removed.get());
        assertThat(cart.getProductItems(), is(empty()));

        assertEquals(Result.Fault.VALIDATION, cart.confirm(NOW).getFault());
        assertEquals(ShoppingCartStatus.PENDING, cart.getStatus());
    }

    @Test
    public void partial_removal_decrements_quantity() {
        ShoppingCart cart = opened();
        cart.addProductItem(prices, ProductItem.of("A", 3), NOW);
        cart.removeProductItem(ProductItem.of("A", 1), NOW);
        assertThat(cart.getProductItems(), contains(PricedProductItem.of("A", 2, HUNDRED)));
    }

    @Test
    public void over_removal_is_rejected_before_event() {
        ShoppingCart cart = opened();
        cart.addProductItem(prices, ProductItem.of("A", 1), NOW);
        List<ShoppingCartEvent> before = new ArrayList<>(cart.getPendingEvents());

        assertEquals(Result.Fault.VALIDATION, cart.removeProductItem(ProductItem.of("A", 2), NOW).getFault());
        assertEquals(Result.Fault.VALIDATION, cart.removeProductItem(ProductItem.of("B", 1), NOW).getFault());
        assertEquals(before, cart.getPendingEvents());
        assertEquals(1, cart.quantityOf("A"));
    }

    @Test
    public void confirmed_cart_is_closed() {
        ShoppingCart cart = opened();
        cart.addProductItem(prices, ProductItem.of("A", 1), NOW);
        assertTrue(cart.confirm(NOW).isSuccess());
        assertEquals(ShoppingCartStatus.CONFIRMED, cart.getStatus());
        assertEquals(NOW, cart.getConfirmedAt().get());
        int events = cart.getPendingEvents().size();

        assertEquals(Result.Fault.VALIDATION, cart.cancel(NOW).getFault());
        assertEquals(Result.Fault.VALIDATION, cart.confirm(NOW).getFault());
        assertEquals(Result.Fault.VALIDATION, cart.addProductItem(prices, ProductItem.of("B", 1), NOW).getFault());
        assertEquals(Result.Fault.VALIDATION, cart.removeProductItem(ProductItem.of("A", 1), NOW).getFault());
        assertEquals(ShoppingCartStatus.CONFIRMED, cart.getStatus());
        assertEquals(events, cart.getPendingEvents().size());
    }

    @Test
    public void canceled_cart_is_closed() {
        ShoppingCart cart = opened();
        assertTrue(cart.cancel(NOW).isSuccess());
        assertEquals(ShoppingCartStatus.CANCELED, cart.getStatus());
        assertEquals(NOW, cart.getCanceledAt().get());
        assertFalse(cart.getConfirmedAt().isPresent());
        assertEquals(Result.Fault.VALIDATION, cart.confirm(NOW).getFault());
        assertEquals(Result.Fault.VALIDATION, cart.cancel(NOW).getFault());
    }

    @Test
    public void replay_of_produced_events_recovers_state() {
        ShoppingCart cart = opened();
        cart.addProductItem(prices, ProductItem.of("A", 2), NOW);
        cart.addProductItem(prices, ProductItem.of("B", 4), NOW);
        cart.removeProductItem(ProductItem.of("B", 1), NOW);
        cart.confirm(NOW);

        ShoppingCart replayed = EventSourcedAggregate.replay(ShoppingCart::initial, cart.getPendingEvents());
        ShoppingCart again = EventSourcedAggregate.replay(ShoppingCart::initial, cart.getPendingEvents());

        assertEquals(replayed, again);
        assertEquals(5, replayed.getVersion());
        assertEquals(cart.getStatus(), replayed.getStatus());
        assertEquals(cart.getProductItems(), replayed.getProductItems());
        assertEquals(cart.getConfirmedAt(), replayed.getConfirmedAt());
        assertThat(replayed.getPendingEvents(), is(empty()));
    }

    @Test
    public void prefix_fold_equals_full_replay() {
        List<ShoppingCartEvent> events = new ArrayList<>();
        events.add(ShoppingCartOpened.of("cart", "client", NOW));
        events.add(ProductItemAdded.of("cart", PricedProductItem.of("A", 1, HUNDRED), NOW));
        events.add(ProductItemAdded.of("cart", PricedProductItem.of("A", 2, HUNDRED), NOW));

        ShoppingCart prefix = EventSourcedAggregate.replay(ShoppingCart::initial, events.subList(0, 2));
        EventSourcedAggregate.fold(prefix, events.get(2));
        assertEquals(EventSourcedAggregate.replay(ShoppingCart::initial, events), prefix);
    }

    @Test
    public void quantities_stay_positive() {
        ShoppingCart cart = opened();
        cart.addProductItem(prices, ProductItem.of("A", 2), NOW);
        cart.addProductItem(prices, ProductItem.of("B", 1), NOW);
        cart.removeProductItem(ProductItem.of("A", 2), NOW);
        cart.removeProductItem(ProductItem.of("B", 1), NOW);
        cart.removeProductItem(ProductItem.of("B", 1), NOW);
        for (PricedProductItem item : cart.getProductItems()) {
            assertTrue(item.getQuantity() > 0);
        }
        assertThat(cart.getProductItems(), is(empty()));
    }

    @Test(expected = IllegalStateException.class)
    public void non_positive_quantity_cannot_be_requested() {
        ProductItem.of("A", 0);
    }
}
