package io.txevents.demo.orders;

import io.txevents.EventPublisher;
import io.txevents.EventSubscriber;
import io.txevents.demo.orders.application.AddItem;
import io.txevents.demo.orders.application.CancelOrder;
import io.txevents.demo.orders.application.CreateOrder;
import io.txevents.demo.orders.application.GetOrder;
import io.txevents.demo.orders.application.ListUserOrders;
import io.txevents.demo.orders.application.RemoveItem;
import io.txevents.demo.orders.application.SubmitOrder;
import io.txevents.demo.orders.application.UserDeletedHandler;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.shared.contracts.UserEvents;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.ReadWriteTransactionScope;

/**
 * Entry point of the orders module. Subscribes to {@code users.UserDeleted} on the
 * transactional registry at construction.
 */
public final class OrdersModule {
    private final CreateOrder createOrder;
    private final AddItem addItem;
    private final RemoveItem removeItem;
    private final SubmitOrder submitOrder;
    private final CancelOrder cancelOrder;
    private final GetOrder getOrder;
    private final ListUserOrders listUserOrders;

    public OrdersModule(OrderRepository repository,
            ReadWriteTransactionScope txScope,
            ReadOnlyTransactionScope readScope,
            TransactionalEventDispatchers dispatchers,
            EventSubscriber transactionalSubscriber,
            EventPublisher afterCommit) {
        this.createOrder = new CreateOrder(repository, txScope, dispatchers);
        this.addItem = new AddItem(repository, txScope);
        this.removeItem = new RemoveItem(repository, txScope);
        this.submitOrder = new SubmitOrder(repository, txScope, dispatchers, afterCommit);
        this.cancelOrder = new CancelOrder(repository, txScope, dispatchers);
        this.getOrder = new GetOrder(repository, readScope);
        this.listUserOrders = new ListUserOrders(repository, readScope);

        transactionalSubscriber.subscribe(UserEvents.USER_DELETED, new UserDeletedHandler(repository));
    }

    public CreateOrder createOrder() {
        return createOrder;
    }

    public AddItem addItem() {
        return addItem;
    }

    public RemoveItem removeItem() {
        return removeItem;
    }

    public SubmitOrder submitOrder() {
        return submitOrder;
    }

    public CancelOrder cancelOrder() {
        return cancelOrder;
    }

    public GetOrder getOrder() {
        return getOrder;
    }

    public ListUserOrders listUserOrders() {
        return listUserOrders;
    }
}
