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
import io.github.goodees.es.cart.command.CancelShoppingCart;
import io.github.goodees.es.cart.command.ConfirmShoppingCart;
import io.github.goodees.es.cart.command.OpenShoppingCart;
import io.github.goodees.es.cart.command.RemoveProductItem;
import io.github.goodees.es.cart.event.ShoppingCartEvent;
import io.github.goodees.es.core.CommandHandler;
import io.github.goodees.es.core.CommandOutcome;
import io.github.goodees.es.core.Result;
import io.github.goodees.es.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Application service of shopping carts. Every successful command returns the new version of the cart, which the
 * caller passes as expected version of its next command.
 */
public class ShoppingCartService {
    private static final Logger logger = LoggerFactory.getLogger(ShoppingCartService.class);

    private final CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler;
    private final ProductPriceCalculator priceCalculator;
    private final Clock clock;

    public ShoppingCartService(CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler,
            ProductPriceCalculator priceCalculator, Clock clock) {
        this.commandHandler = commandHandler;
        this.priceCalculator = priceCalculator;
        this.clock = clock;
    }

    public Result<Long> open(OpenShoppingCart command) throws EventStoreException {
        Instant now = clock.instant();
        return logged("open", command.getShoppingCartId(), commandHandler.create(command.getShoppingCartId(),
            cart -> cart.open(command.getShoppingCartId(), command.getClientId(), now)));
    }

    public Result<Long> addProductItem(AddProductItem command) throws EventStoreException {
        Instant now = clock.instant();
        return logged("addProductItem", command.getShoppingCartId(), commandHandler.update(
            command.getShoppingCartId(), command.getExpectedVersion(),
            cart -> cart.addProductItem(priceCalculator, command.getProductItem(), now)));
    }

    public Result<Long> removeProductItem(RemoveProductItem command) throws EventStoreException {
        Instant now = clock.instant();
        return logged("removeProductItem", command.getShoppingCartId(), commandHandler.update(
            command.getShoppingCartId(), command.getExpectedVersion(),
            cart -> cart.removeProductItem(command.getProductItem(), now)));
    }

    public Result<Long> confirm(ConfirmShoppingCart command) throws EventStoreException {
        Instant now = clock.instant();
        return logged("confirm", command.getShoppingCartId(), commandHandler.update(command.getShoppingCartId(),
            command.getExpectedVersion(), cart -> cart.confirm(now)));
    }

    public Result<Long> cancel(CancelShoppingCart command) throws EventStoreException {
        Instant now = clock.instant();
        return logged("cancel", command.getShoppingCartId(), commandHandler.update(command.getShoppingCartId(),
            command.getExpectedVersion(), cart -> cart.cancel(now)));
    }

    /**
     * Current state of a cart, replayed from its events.
     * @param shoppingCartId id of the cart
     * @return the cart or NOT_FOUND
     * @throws EventStoreException when the store cannot be read
     */
    public Result<ShoppingCart> get(String shoppingCartId) throws EventStoreException {
        return commandHandler.load(shoppingCartId);
    }

    private Result<Long> logged(String operation, String shoppingCartId,
            Result<CommandOutcome<ShoppingCartEvent>> outcome) {
        if (outcome.isFailure()) {
            logger.info("{} of cart {} failed: {} {}", operation, shoppingCartId, outcome.getFault(),
                outcome.getMessage());
        }
        return outcome.map(CommandOutcome::getVersion);
    }
}
