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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.goodees.es.cart.CatalogPriceCalculator;
import io.github.goodees.es.cart.ShoppingCartModule;
import io.github.goodees.es.cart.ShoppingCartService;
import io.github.goodees.es.cart.ShoppingCartStatus;
import io.github.goodees.es.cart.command.AddProductItem;
import io.github.goodees.es.cart.command.CancelShoppingCart;
import io.github.goodees.es.cart.command.ConfirmShoppingCart;
import io.github.goodees.es.cart.command.OpenShoppingCart;
import io.github.goodees.es.cart.command.ProductItem;
import io.github.goodees.es.cart.command.RemoveProductItem;
import io.github.goodees.es.cart.event.PricedProductItem;
import io.github.goodees.es.core.Result;
import io.github.goodees.es.core.projection.InMemoryReadModelStore;
import io.github.goodees.es.core.store.EventStoreException;
import io.github.goodees.es.core.store.json.ObjectMappers;
import org.junit.Before;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.comparesEqualTo;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class ShoppingCartProjectionsTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final List<String> CARTS = Arrays.asList("cart-1", "cart-2", "cart-3", "cart-4", "cart-5");

    private final ObjectMapper mapper = ObjectMappers.create();
    private InMemoryReadModelStore readModels;
    private CatalogPriceCalculator prices;
    private ShoppingCartModule module;
    private ShoppingCartService service;
    private ShoppingCartQueries queries;

    @Before
    public void setUp() {
        readModels = new InMemoryReadModelStore();
        prices = new CatalogPriceCalculator()
                .withPrice("shoes", new BigDecimal("100"))
                .withPrice("tShirt", new BigDecimal("50"))
                .withPrice("dress", new BigDecimal("150"))
                .withPrice("trousers", new BigDecimal("300"));
        module = ShoppingCartModule.builder().readModelStore(readModels).priceCalculator(prices)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC)).build();
        service = module.getService();
        queries = module.getQueries();
    }

    private void shopping() throws EventStoreException {
        service.open(OpenShoppingCart.of("cart-1", "anna"));
        service.addProductItem(AddProductItem.of("cart-1", ProductItem.of("shoes", 2)));
        service.addProductItem(AddProductItem.of("cart-1", ProductItem.of("tShirt", 1)));
        service.removeProductItem(RemoveProductItem.of("cart-1", ProductItem.of("shoes", 1)));
        service.confirm(ConfirmShoppingCart.of("cart-1"));

        service.open(OpenShoppingCart.of("cart-2", "anna"));
        service.addProductItem(AddProductItem.of("cart-2", ProductItem.of("dress", 3)));
        service.cancel(CancelShoppingCart.of("cart-2"));

        service.open(OpenShoppingCart.of("cart-3", "bob"));
        service.addProductItem(AddProductItem.of("cart-3", ProductItem.of("dress", 3)));
        service.confirm(ConfirmShoppingCart.of("cart-3"));

        service.open(OpenShoppingCart.of("cart-4", "anna"));
        service.addProductItem(AddProductItem.of("cart-4", ProductItem.of("trousers", 1)));
        service.confirm(ConfirmShoppingCart.of("cart-4"));

        service.open(OpenShoppingCart.of("cart-5", "anna"));
        service.addProductItem(AddProductItem.of("cart-5", ProductItem.of("tShirt", 1)));
    }

    @Test
    public void details_follow_every_cart() throws EventStoreException {
        shopping();

        ShoppingCartDetails first = queries.getDetails("cart-1").get();
        assertEquals("anna", first.getClientId());
        assertEquals(ShoppingCartStatus.CONFIRMED, first.getStatus());
        assertEquals(5, first.getVersion());
        assertThat(first.getProductItems(), contains(PricedProductItem.of("shoes", 1, new BigDecimal("100")),
            PricedProductItem.of("tShirt", 1, new BigDecimal("50"))));
        assertThat(first.getTotalPrice(), comparesEqualTo(new BigDecimal("150")));
        assertEquals(2, first.getTotalItemsCount());
        assertEquals(NOW, first.getConfirmedAt());
        assertNull(first.getCanceledAt());

        ShoppingCartDetails canceled = queries.getDetails("cart-2").get();
        assertEquals(ShoppingCartStatus.CANCELED, canceled.getStatus());
        assertEquals(NOW, canceled.getCanceledAt());

        ShoppingCartDetails pending = queries.getDetails("cart-5").get();
        assertEquals(ShoppingCartStatus.PENDING, pending.getStatus());
        assertEquals(2, pending.getVersion());
        assertThat(pending.getTotalPrice(), comparesEqualTo(new BigDecimal("50")));

        for (String cart : CARTS) {
            assertEquals(service.get(cart).get().getVersion(), queries.getDetails(cart).get().getVersion());
        }
    }

    @Test
    public void short_info_only_for_pending_carts() throws EventStoreException {
        shopping();

        List<String> pending = queries.getPendingCarts().stream().map(ShoppingCartShortInfo::getId)
                .collect(Collectors.toList());
        assertThat(pending, contains("cart-5"));
        assertEquals(Result.Fault.NOT_FOUND, queries.getShortInfo("cart-1").getFault());

        ShoppingCartShortInfo info = queries.getShortInfo("cart-5").get();
        assertEquals("anna", info.getClientId());
        assertEquals(1, info.getTotalItemsCount());
        assertThat(info.getTotalPrice(), comparesEqualTo(new BigDecimal("50")));
        assertEquals(1, queries.getPendingCarts("anna").size());
        assertEquals(0, queries.getPendingCarts("bob").size());
    }

    @Test
    public void client_summaries_aggregate_carts() throws EventStoreException {
        shopping();

        ClientShoppingSummary anna = queries.getClientSummary("anna").get();
        assertEquals(1, anna.getPendingCount());
        assertEquals(2, anna.getConfirmedCount());
        assertEquals(1, anna.getCanceledCount());
        assertThat(anna.getPendingTotal(), comparesEqualTo(new BigDecimal("50")));
        assertThat(anna.getConfirmedTotal(), comparesEqualTo(new BigDecimal("450")));

        ClientShoppingSummary bob = queries.getClientSummary("bob").get();
        assertEquals(0, bob.getPendingCount());
        assertEquals(1, bob.getConfirmedCount());
        assertEquals(0, bob.getCanceledCount());
        assertThat(bob.getPendingTotal(), comparesEqualTo(BigDecimal.ZERO));
        assertThat(bob.getConfirmedTotal(), comparesEqualTo(new BigDecimal("450")));

        assertEquals(Result.Fault.NOT_FOUND, queries.getClientSummary("carol").getFault());
    }

    @Test
    public void rebuild_reproduces_read_models() throws Exception {
        shopping();
        List<String> before = snapshot();

        long replayed = module.rebuildProjections();

        assertEquals(16, replayed);
        assertEquals(before, snapshot());
    }

    @Test
    public void missing_read_model_is_reported_and_repaired_by_rebuild() throws Exception {
        shopping();
        List<String> before = snapshot();
        readModels.delete(ShoppingCartDetails.class, "cart-5");

        Result<Long> result = service.addProductItem(AddProductItem.of("cart-5", ProductItem.of("shoes", 1)));

        assertEquals(Result.Fault.INCONSISTENCY, result.getFault());
        // the event is already part of history
        assertEquals(3, service.get("cart-5").get().getVersion());

        module.rebuildProjections();
        ShoppingCartDetails details = queries.getDetails("cart-5").get();
        assertEquals(3, details.getVersion());
        assertThat(details.getTotalPrice(), comparesEqualTo(new BigDecimal("150")));
        assertThat(queries.getClientSummary("anna").get().getPendingTotal(), comparesEqualTo(new BigDecimal("150")));
        assertEquals(before.size(), snapshot().size());
    }

    @Test
    public void price_change_between_adds_keeps_views_in_line_with_cart() throws EventStoreException {
        service.open(OpenShoppingCart.of("cart", "anna"));
        service.addProductItem(AddProductItem.of("cart", ProductItem.of("shoes", 1)));
        prices.withPrice("shoes", new BigDecimal("150"));
        service.addProductItem(AddProductItem.of("cart", ProductItem.of("shoes", 1)));

        assertThat(service.get("cart").get().getTotalPrice(), comparesEqualTo(new BigDecimal("200")));
        assertThat(queries.getDetails("cart").get().getTotalPrice(), comparesEqualTo(new BigDecimal("200")));
        assertThat(queries.getShortInfo("cart").get().getTotalPrice(), comparesEqualTo(new BigDecimal("200")));
        assertThat(queries.getClientSummary("anna").get().getPendingTotal(), comparesEqualTo(new BigDecimal("200")));

        service.removeProductItem(RemoveProductItem.of("cart", ProductItem.of("shoes", 2)));

        ShoppingCartShortInfo info = queries.getShortInfo("cart").get();
        assertEquals(0, info.getTotalItemsCount());
        assertThat(info.getTotalPrice(), comparesEqualTo(BigDecimal.ZERO));
        assertThat(queries.getClientSummary("anna").get().getPendingTotal(), comparesEqualTo(BigDecimal.ZERO));
    }

    @Test
    public void concurrent_carts_of_one_client_are_all_counted() throws Exception {
        int carts = 16;
        CyclicBarrier start = new CyclicBarrier(carts);
        ExecutorService executor = Executors.newFixedThreadPool(carts);
        try {
            List<Future<Result<Long>>> results = new ArrayList<>();
            for (int i = 0; i < carts; i++) {
                String cartId = "cart-" + i;
                results.add(executor.submit(() -> {
                    start.await(10, TimeUnit.SECONDS);
                    service.open(OpenShoppingCart.of(cartId, "anna"));
                    return service.addProductItem(AddProductItem.of(cartId, ProductItem.of("tShirt", 1)));
                }));
            }
            for (Future<Result<Long>> result : results) {
                assertEquals(Long.valueOf(2), result.get(20, TimeUnit.SECONDS).get());
            }
        } finally {
            executor.shutdownNow();
        }

        ClientShoppingSummary anna = queries.getClientSummary("anna").get();
        assertEquals(carts, anna.getPendingCount());
        assertThat(anna.getPendingTotal(), comparesEqualTo(new BigDecimal("800")));
        assertEquals(carts, queries.getPendingCarts("anna").size());
    }

    private List<String> snapshot() throws JsonProcessingException {
        List<String> rows = new ArrayList<>();
        for (ShoppingCartDetails details : readModels.findAll(ShoppingCartDetails.class)) {
            rows.add(mapper.writeValueAsString(details));
        }
        for (ShoppingCartShortInfo info : readModels.findAll(ShoppingCartShortInfo.class)) {
            rows.add(mapper.writeValueAsString(info));
        }
        for (CartOwnership ownership : readModels.findAll(CartOwnership.class)) {
            rows.add(mapper.writeValueAsString(ownership));
        }
        for (ClientShoppingSummary summary : readModels.findAll(ClientShoppingSummary.class)) {
            rows.add(mapper.writeValueAsString(summary));
        }
        return rows;
    }
}
