package io.txevents.demo.notifications;

import io.txevents.Event;
import io.txevents.EventHandler;
import io.txevents.demo.shared.contracts.OrderSubmittedEvent;
import io.txevents.tx.TxContext;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Sends an order confirmation to the customer. The mail is simulated by a log line and
 * the record kept in {@link #sent()}.
 *
 * <p>Subscribed on the after-commit bus: it is an external effect and must not run inside
 * a transaction that may still roll back.
 */
public final class OrderSubmittedNotifier implements EventHandler {
    private static final Logger logger = Logger.getLogger(OrderSubmittedNotifier.class.getName());

    private final List<String> sent = new CopyOnWriteArrayList<>();

    @Override
    public void handle(TxContext ctx, Event event) {
        if (!(event instanceof OrderSubmittedEvent submitted)) {
            return;
        }
        // TODO: deduplicate on eventId once delivery can repeat
        logger.info("Sending order confirmation for order " + submitted.orderId()
                + " to user " + submitted.userId()
                + " (" + submitted.totalAmount() + " " + submitted.currency() + ")");
        sent.add(submitted.orderId());
    }

    /** Order ids confirmations were sent for, in order. */
    public List<String> sent() {
        return List.copyOf(sent);
    }
}
