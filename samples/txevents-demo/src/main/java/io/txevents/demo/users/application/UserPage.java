package io.txevents.demo.users.application;

import java.util.List;

public record UserPage(List<UserView> users, int totalCount, int offset, int limit) {
}
