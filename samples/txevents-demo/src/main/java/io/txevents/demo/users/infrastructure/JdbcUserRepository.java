package io.txevents.demo.users.infrastructure;

import io.txevents.demo.users.domain.Email;
import io.txevents.demo.users.domain.Name;
import io.txevents.demo.users.domain.User;
import io.txevents.demo.users.domain.UserId;
import io.txevents.demo.users.domain.UserRepository;
import io.txevents.demo.users.domain.UserStatus;
import io.txevents.jdbc.TransactionAwareJdbc;
import io.txevents.tx.RowMapper;
import io.txevents.tx.TxContext;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link UserRepository} over the {@code users} table.
 */
public final class JdbcUserRepository implements UserRepository {
    private static final String COLUMNS =
            "id, email, first_name, last_name, status, created_at, updated_at";

    private static final RowMapper<User> USER_MAPPER = rs -> User.reconstitute(
            new UserId(rs.getString("id")),
            new Email(rs.getString("email")),
            new Name(rs.getString("first_name"), rs.getString("last_name")),
            UserStatus.fromValue(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant());

    private final TransactionAwareJdbc jdbc;

    public JdbcUserRepository(TransactionAwareJdbc jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    }

    @Override
    public void save(TxContext ctx, User user) {
        jdbc.update(ctx,
                "MERGE INTO users (" + COLUMNS + ") KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?)",
                user.id().value(),
                user.email().value(),
                user.name().firstName(),
                user.name().lastName(),
                user.status().value(),
                user.createdAt(),
                user.updatedAt());
    }

    @Override
    public Optional<User> findById(TxContext ctx, UserId id) {
        return jdbc.queryFirst(ctx,
                "SELECT " + COLUMNS + " FROM users WHERE id = ?", USER_MAPPER, id.value());
    }

    @Override
    public Optional<User> findByEmail(TxContext ctx, Email email) {
        return jdbc.queryFirst(ctx,
                "SELECT " + COLUMNS + " FROM users WHERE email = ?", USER_MAPPER, email.value());
    }

    @Override
    public boolean existsByEmail(TxContext ctx, Email email) {
        return jdbc.queryFirst(ctx, "SELECT 1 FROM users WHERE email = ?",
                rs -> Boolean.TRUE, email.value()).isPresent();
    }

    @Override
    public List<User> findAll(TxContext ctx, int offset, int limit) {
        return jdbc.query(ctx,
                "SELECT " + COLUMNS + " FROM users ORDER BY created_at, id LIMIT ? OFFSET ?",
                USER_MAPPER, limit, offset);
    }

    @Override
    public int count(TxContext ctx) {
        return jdbc.queryFirst(ctx, "SELECT COUNT(*) FROM users", rs -> rs.getInt(1)).orElse(0);
    }
}
