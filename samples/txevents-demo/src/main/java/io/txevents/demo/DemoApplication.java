package io.txevents.demo;

import io.txevents.demo.orders.application.AddItem;
import io.txevents.demo.orders.application.CreateOrder;
import io.txevents.demo.orders.application.OrderView;
import io.txevents.demo.orders.application.SubmitOrder;
import io.txevents.demo.users.application.CreateUser;
import io.txevents.demo.users.application.DeleteUser;
import io.txevents.demo.users.domain.UserId;
import io.txevents.tx.TxContext;
import org.h2.jdbcx.JdbcDataSource;

import java.util.List;

/**
 * Runs the user-deletion cascade on an in-memory H2 database.
 * <p>
 * Run with: mvn -pl samples/txevents-demo exec:java -Dexec.mainClass=io.txevents.demo.DemoApplication
 */
public final class DemoApplication {

    public static void main(String[] args) {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:txevents-demo;DB_CLOSE_DELAY=-1");
        DemoSchema.create(dataSource);

        ModularMonolith app = new ModularMonolith(dataSource);
        TxContext ctx = TxContext.background();

        System.out.println("=== txevents demo ===\n");

        UserId alice = app.users().createUser().handle(ctx,
                new CreateUser.Command("alice@example.com", "Alice", "Liddell"));
        System.out.println("Created user " + alice);

        for (String product : List.of("book", "lamp")) {
            String orderId = app.orders().createOrder().handle(ctx, new CreateOrder.Command(alice.value())).value();
            app.orders().addItem().handle(ctx,
                    new AddItem.Command(orderId, product, "A " + product, 2, 1250, "USD"));
            app.orders().submitOrder().handle(ctx, new SubmitOrder.Command(orderId));
            System.out.println("Submitted order " + orderId + " for " + product);
        }
        System.out.println("Confirmations sent: " + app.notifications().orderSubmittedNotifier().sent().size());

        System.out.println("\nDeleting user " + alice + " ...");
        app.users().deleteUser().handle(ctx, new DeleteUser.Command(alice.value()));

        System.out.println("User status: " + app.users().getUser().handle(ctx, alice.value()).status());
        for (OrderView order : app.orders().listUserOrders().handle(ctx, alice.value(), 0, 0).orders()) {
            System.out.println("Order " + order.id() + ": " + order.status());
        }

        System.out.println("\nDemo complete.");
    }

    private DemoApplication() {
    }
}
