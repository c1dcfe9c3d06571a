package io.txevents.demo.orders.infrastructure;

import io.txevents.demo.orders.domain.Money;
import io.txevents.demo.orders.domain.Order;
import io.txevents.demo.orders.domain.OrderId;
import io.txevents.demo.orders.domain.OrderItem;
import io.txevents.demo.orders.domain.OrderRepository;
import io.txevents.demo.orders.domain.OrderStatus;
import io.txevents.demo.orders.domain.UserRef;
import io.txevents.jdbc.TransactionAwareJdbc;
import io.txevents.tx.RowMapper;
import io.txevents.tx.TxContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link OrderRepository} over the {@code orders} and {@code order_items} tables.
 *
 * <p>{@link #save} rewrites all item rows of the order; call it inside a read-write
 * transaction so the rewrite is atomic.
 */
public final class JdbcOrderRepository implements OrderRepository {
    private static final String ORDER_COLUMNS =
            "id, user_id, status, total_amount, total_currency, created_at, updated_at";

    private static final RowMapper<OrderRow> ORDER_MAPPER = rs -> new OrderRow(
            new OrderId(rs.getString("id")),
            new UserRef(rs.getString("user_id")),
            OrderStatus.fromValue(rs.getString("status")),
            new Money(rs.getLong("total_amount"), rs.getString("total_currency")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant());

    private static final RowMapper<OrderItem> ITEM_MAPPER = rs -> new OrderItem(
            rs.getString("product_id"),
            rs.getString("product_name"),
            rs.getInt("quantity"),
            new Money(rs.getLong("unit_amount"), rs.getString("currency")));

    private final TransactionAwareJdbc jdbc;

    public JdbcOrderRepository(TransactionAwareJdbc jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    }

    @Override
    public void save(TxContext ctx, Order order) {
        String orderId = order.id().value();
        jdbc.update(ctx,
                "MERGE INTO orders (" + ORDER_COLUMNS + ") KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?)",
                orderId,
                order.userRef().value(),
                order.status().value(),
                order.total().amount(),
                order.total().currency(),
                order.createdAt(),
                order.updatedAt());

        jdbc.update(ctx, "DELETE FROM order_items WHERE order_id = ?", orderId);
        List<OrderItem> items = order.items();
        if (items.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            OrderItem item = items.get(i);
            rows.add(new Object[]{
                    orderId, i, item.productId(), item.productName(), item.quantity(),
                    item.unitPrice().amount(), item.unitPrice().currency()});
        }
        jdbc.batchUpdate(ctx,
                "INSERT INTO order_items (order_id, item_index, product_id, product_name, quantity, "
                        + "unit_amount, currency) VALUES (?, ?, ?, ?, ?, ?, ?)",
                rows);
    }

    @Override
    public Optional<Order> findById(TxContext ctx, OrderId id) {
        return jdbc.queryFirst(ctx,
                        "SELECT " + ORDER_COLUMNS + " FROM orders WHERE id = ?", ORDER_MAPPER, id.value())
                .map(row -> row.toOrder(itemsOf(ctx, row.id())));
    }

    @Override
    public List<Order> findByUserRef(TxContext ctx, UserRef userRef, int offset, int limit) {
        List<OrderRow> rows = jdbc.query(ctx,
                "SELECT " + ORDER_COLUMNS + " FROM orders WHERE user_id = ? "
                        + "ORDER BY created_at, id LIMIT ? OFFSET ?",
                ORDER_MAPPER, userRef.value(), limit, offset);
        List<Order> orders = new ArrayList<>(rows.size());
        for (OrderRow row : rows) {
            orders.add(row.toOrder(itemsOf(ctx, row.id())));
        }
        return orders;
    }

    @Override
    public int countByUserRef(TxContext ctx, UserRef userRef) {
        return jdbc.queryFirst(ctx, "SELECT COUNT(*) FROM orders WHERE user_id = ?",
                rs -> rs.getInt(1), userRef.value()).orElse(0);
    }

    private List<OrderItem> itemsOf(TxContext ctx, OrderId orderId) {
        return jdbc.query(ctx,
                "SELECT product_id, product_name, quantity, unit_amount, currency "
                        + "FROM order_items WHERE order_id = ? ORDER BY item_index",
                ITEM_MAPPER, orderId.value());
    }

    private record OrderRow(OrderId id, UserRef userRef, OrderStatus status, Money total,
            Instant createdAt, Instant updatedAt) {

        Order toOrder(List<OrderItem> items) {
            return Order.reconstitute(id, userRef, items, status, total, createdAt, updatedAt);
        }
    }
}
