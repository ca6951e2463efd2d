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

import io.github.goodees.es.cart.command.AddProductItem;
import io.github.goodees.es.cart.command.ConfirmShoppingCart;
import io.github.goodees.es.cart.command.OpenShoppingCart;
import io.github.goodees.es.cart.command.ProductItem;
import io.github.goodees.es.cart.command.RemoveProductItem;
import io.github.goodees.es.cart.event.ShoppingCartEvent;
import io.github.goodees.es.cart.event.ShoppingCartEventSerialization;
import io.github.goodees.es.cart.projection.ShoppingCartDetails;
import io.github.goodees.es.core.Result;
import io.github.goodees.es.core.store.EventStoreException;
import io.github.goodees.es.core.store.jdbc.DefaultJdbcSchema;
import io.github.goodees.es.core.store.jdbc.JdbcEventStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.comparesEqualTo;
import static org.junit.Assert.assertEquals;

public class JdbcShoppingCartTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static JdbcDataSource ds;
    private static JdbcTemplate template;

    private ShoppingCartModule module;
    private ShoppingCartService service;

    @BeforeClass
    public static void initDb() {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:carttest;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        template = new JdbcTemplate(ds);
        template.execute("create table cart_event (GLOBAL_POSITION bigint generated by default as identity primary key, "
                + "STREAM_ID varchar(255) not null, VERSION bigint not null, OCCURRED_AT timestamp not null, "
                + "TYPE varchar(255) not null, PAYLOAD_VERSION int not null, PAYLOAD clob, unique (STREAM_ID, VERSION))");
        template.execute("create table cart_stream (STREAM_ID varchar(255) primary key, VERSION bigint not null)");
    }

    @AfterClass
    public static void dropDb() {
        template.execute("drop table cart_event");
        template.execute("drop table cart_stream");
    }

    @Before
    public void setUp() {
        template.update("delete from cart_event");
        template.update("delete from cart_stream");
        CatalogPriceCalculator prices = new CatalogPriceCalculator()
                .withPrice("shoes", new BigDecimal("100"))
                .withPrice("tShirt", new BigDecimal("49.90"));
        JdbcEventStore<ShoppingCartEvent> store = new JdbcEventStore<>(ds,
                new DefaultJdbcSchema("cart_event", "cart_stream"), new ShoppingCartEventSerialization());
        module = ShoppingCartModule.builder().eventStore(store).priceCalculator(prices)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC)).build();
        service = module.getService();
    }

    @Test
    public void cart_is_persisted_and_replayed() throws EventStoreException {
        service.open(OpenShoppingCart.of("cart", "client"));
        service.addProductItem(AddProductItem.of("cart", ProductItem.of("shoes", 2), 1));
        service.addProductItem(AddProductItem.of("cart", ProductItem.of("tShirt", 1), 2));
        service.removeProductItem(RemoveProductItem.of("cart", ProductItem.of("shoes", 1), 3));
        assertEquals(Long.valueOf(5), service.confirm(ConfirmShoppingCart.of("cart", 4)).get());

        assertEquals(5L, template.queryForObject("select count(*) from cart_event where STREAM_ID = ?", Long.class,
            "cart").longValue());
        assertEquals(5L, template.queryForObject("select VERSION from cart_stream where STREAM_ID = ?", Long.class,
            "cart").longValue());

        ShoppingCart cart = service.get("cart").get();
        assertEquals(ShoppingCartStatus.CONFIRMED, cart.getStatus());
        assertEquals(1, cart.quantityOf("shoes"));
        assertThat(cart.getTotalPrice(), comparesEqualTo(new BigDecimal("149.90")));
        assertEquals(NOW, cart.getOpenedAt());
    }

    @Test
    public void stale_version_does_not_reach_database() throws EventStoreException {
        service.open(OpenShoppingCart.of("cart", "client"));
        service.addProductItem(AddProductItem.of("cart", ProductItem.of("shoes", 1), 1));

        Result<Long> stale = service.addProductItem(AddProductItem.of("cart", ProductItem.of("tShirt", 1), 1));

        assertEquals(Result.Fault.CONCURRENCY_CONFLICT, stale.getFault());
        assertEquals(2L, template.queryForObject("select count(*) from cart_event", Long.class).longValue());
    }

    @Test
    public void second_open_is_rejected() throws EventStoreException {
        service.open(OpenShoppingCart.of("cart", "client"));
        assertEquals(Result.Fault.VALIDATION, service.open(OpenShoppingCart.of("cart", "other")).getFault());
        assertEquals(1L, template.queryForObject("select count(*) from cart_event", Long.class).longValue());
    }

    @Test
    public void projections_rebuild_from_database() throws EventStoreException {
        service.open(OpenShoppingCart.of("first", "client"));
        service.addProductItem(AddProductItem.of("first", ProductItem.of("tShirt", 2)));
        service.open(OpenShoppingCart.of("second", "client"));
        service.addProductItem(AddProductItem.of("second", ProductItem.of("shoes", 1)));
        service.confirm(ConfirmShoppingCart.of("second"));

        assertEquals(5, module.rebuildProjections());

        ShoppingCartDetails details = module.getQueries().getDetails("first").get();
        assertEquals(2, details.getVersion());
        assertThat(details.getTotalPrice(), comparesEqualTo(new BigDecimal("99.80")));
        assertEquals(1, module.getQueries().getPendingCarts().size());
        assertThat(module.getQueries().getClientSummary("client").get().getConfirmedTotal(),
            comparesEqualTo(new BigDecimal("100")));
    }
}
