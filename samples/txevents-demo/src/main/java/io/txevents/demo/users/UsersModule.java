package io.txevents.demo.users;

import io.txevents.demo.users.application.CreateUser;
import io.txevents.demo.users.application.DeleteUser;
import io.txevents.demo.users.application.GetUser;
import io.txevents.demo.users.application.ListUsers;
import io.txevents.demo.users.application.UpdateUser;
import io.txevents.demo.users.domain.UserRepository;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.ReadWriteTransactionScope;

/**
 * Entry point of the users module: its commands and queries, nothing else.
 */
public final class UsersModule {
    private final CreateUser createUser;
    private final UpdateUser updateUser;
    private final DeleteUser deleteUser;
    private final GetUser getUser;
    private final ListUsers listUsers;

    public UsersModule(UserRepository repository,
            ReadWriteTransactionScope txScope,
            ReadOnlyTransactionScope readScope,
            TransactionalEventDispatchers dispatchers) {
        this.createUser = new CreateUser(repository, txScope, dispatchers);
        this.updateUser = new UpdateUser(repository, txScope, dispatchers);
        this.deleteUser = new DeleteUser(repository, txScope, dispatchers);
        this.getUser = new GetUser(repository);
        this.listUsers = new ListUsers(repository, readScope);
    }

    public CreateUser createUser() {
        return createUser;
    }

    public UpdateUser updateUser() {
        return updateUser;
    }

    public DeleteUser deleteUser() {
        return deleteUser;
    }

    public GetUser getUser() {
        return getUser;
    }

    public ListUsers listUsers() {
        return listUsers;
    }
}
