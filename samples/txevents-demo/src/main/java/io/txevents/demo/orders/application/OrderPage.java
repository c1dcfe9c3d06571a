package io.txevents.demo.orders.application;

import java.util.List;

public record OrderPage(List<OrderView> orders, int totalCount, int offset, int limit) {
}
