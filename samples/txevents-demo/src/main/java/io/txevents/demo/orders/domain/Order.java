package io.txevents.demo.orders.domain;

import io.txevents.AggregateRoot;
import io.txevents.demo.shared.contracts.OrderSubmittedEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Order aggregate.
 *
 * <pre>
 * draft --submit--> pending --confirm--> confirmed --complete--> completed
 *   \                  \                     \
 *    +------------------+---------cancel------+--> cancelled
 * </pre>
 *
 * Items can only change while the order is a draft. Illegal transitions throw
 * {@link IllegalStateException}.
 */
public final class Order extends AggregateRoot {
    private final OrderId id;
    private final UserRef userRef;
    private final List<OrderItem> items;
    private OrderStatus status;
    private Money total;
    private final Instant createdAt;
    private Instant updatedAt;

    private Order(OrderId id, UserRef userRef, List<OrderItem> items, OrderStatus status, Money total,
            Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.userRef = Objects.requireNonNull(userRef, "userRef");
        this.items = new ArrayList<>(items);
        this.status = Objects.requireNonNull(status, "status");
        this.total = Objects.requireNonNull(total, "total");
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Opens an empty draft order and records {@code orders.OrderCreated}.
     */
    public static Order create(UserRef userRef) {
        Instant now = Instant.now();
        Order order = new Order(OrderId.newId(), userRef, List.of(), OrderStatus.DRAFT,
                Money.zero(Money.DEFAULT_CURRENCY), now, now);
        order.addDomainEvent(new OrderCreatedEvent(order.id, userRef));
        return order;
    }

    public static Order reconstitute(OrderId id, UserRef userRef, List<OrderItem> items, OrderStatus status,
            Money total, Instant createdAt, Instant updatedAt) {
        return new Order(id, userRef, items, status, total, createdAt, updatedAt);
    }

    /**
     * Adds a line, or raises the quantity of the line for the same product.
     */
    public void addItem(String productId, String productName, int quantity, Money unitPrice) {
        requireStatus(OrderStatus.DRAFT, "order is not in draft status");
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive, got: " + quantity);
        }
        if (!items.isEmpty() && !items.get(0).unitPrice().currency().equals(unitPrice.currency())) {
            throw new IllegalArgumentException("order is priced in " + total.currency()
                    + ", got " + unitPrice.currency());
        }
        for (int i = 0; i < items.size(); i++) {
            OrderItem item = items.get(i);
            if (item.productId().equals(productId)) {
                items.set(i, item.withQuantity(item.quantity() + quantity));
                recalculateTotal();
                touch();
                return;
            }
        }
        items.add(new OrderItem(productId, productName, quantity, unitPrice));
        recalculateTotal();
        touch();
    }

    public void removeItem(String productId) {
        requireStatus(OrderStatus.DRAFT, "order is not in draft status");
        boolean removed = items.removeIf(item -> item.productId().equals(productId));
        if (!removed) {
            throw new IllegalArgumentException("item not found in order: " + productId);
        }
        recalculateTotal();
        touch();
    }

    /**
     * Moves a non-empty draft to pending and records {@code orders.OrderSubmitted}.
     */
    public void submit() {
        requireStatus(OrderStatus.DRAFT, "order is not in draft status");
        if (items.isEmpty()) {
            throw new IllegalStateException("order has no items");
        }
        status = OrderStatus.PENDING;
        touch();
        addDomainEvent(new OrderSubmittedEvent(id.value(), userRef.value(), total.amount(), total.currency()));
    }

    public void confirm() {
        requireStatus(OrderStatus.PENDING, "order is not pending");
        status = OrderStatus.CONFIRMED;
        touch();
    }

    /**
     * Cancels any order that is neither cancelled nor completed and records
     * {@code orders.OrderCancelled}.
     */
    public void cancel() {
        if (status == OrderStatus.CANCELLED) {
            throw new IllegalStateException("order is already cancelled");
        }
        if (status == OrderStatus.COMPLETED) {
            throw new IllegalStateException("order is already completed");
        }
        status = OrderStatus.CANCELLED;
        touch();
        addDomainEvent(new OrderCancelledEvent(id, userRef));
    }

    public void complete() {
        requireStatus(OrderStatus.CONFIRMED, "order is not confirmed");
        status = OrderStatus.COMPLETED;
        touch();
    }

    /** Draft and pending orders can still be cancelled by their owner going away. */
    public boolean isOpen() {
        return status == OrderStatus.DRAFT || status == OrderStatus.PENDING;
    }

    public OrderId id() {
        return id;
    }

    public UserRef userRef() {
        return userRef;
    }

    public List<OrderItem> items() {
        return Collections.unmodifiableList(items);
    }

    public OrderStatus status() {
        return status;
    }

    public Money total() {
        return total;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    private void recalculateTotal() {
        if (items.isEmpty()) {
            total = Money.zero(total.currency());
            return;
        }
        Money sum = Money.zero(items.get(0).unitPrice().currency());
        for (OrderItem item : items) {
            sum = sum.add(item.subtotal());
        }
        total = sum;
    }

    private void requireStatus(OrderStatus expected, String message) {
        if (status != expected) {
            throw new IllegalStateException(message + ": " + id + " is " + status.value());
        }
    }

    private void touch() {
        updatedAt = Instant.now();
    }
}
