package io.ehsdesk.identity;

import io.ehsdesk.error.ValidationException;
import io.ehsdesk.model.Actor;
import io.ehsdesk.model.Role;
import io.ehsdesk.storage.StoreWriteLock;
import io.ehsdesk.storage.UserStore;
import io.ehsdesk.util.Hashing;

import java.util.List;
import java.util.Optional;

/** Registration and credential lookup. Passwords are stored as unsalted SHA-256 hex. */
public final class IdentityService {
    private final UserStore userStore;
    private final StoreWriteLock writeLock;

    public IdentityService(UserStore userStore, StoreWriteLock writeLock) {
        this.userStore = userStore;
        this.writeLock = writeLock;
    }

    public Actor register(String username, String password, Role role) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            throw new ValidationException("Username and password cannot be empty");
        }
        if (role == null) {
            throw new ValidationException("Role cannot be empty, expected 'worker' or 'manager'");
        }
        String name = username.trim();
        return writeLock.guard(() -> {
            if (userStore.existsByUsername(name)) {
                throw new ValidationException("User already exists: " + name);
            }
            long id = userStore.insert(name, Hashing.sha256Hex(password), role);
            return new Actor(id, name, role);
        });
    }

    public Optional<Actor> login(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            return Optional.empty();
        }
        return userStore.findByCredentials(username.trim(), Hashing.sha256Hex(password));
    }

    public Optional<Role> resolveRole(String username, String password) {
        return login(username, password).map(Actor::role);
    }

    public Optional<Long> userId(String username, String password) {
        return login(username, password).map(Actor::id);
    }

    public List<Actor> listWorkers() {
        return userStore.listByRole(Role.WORKER);
    }
}
