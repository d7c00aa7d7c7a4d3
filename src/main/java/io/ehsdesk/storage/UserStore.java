package io.ehsdesk.storage;

import io.ehsdesk.model.Actor;
import io.ehsdesk.model.Role;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class UserStore {
    private final Database database;

    public UserStore(Database database) {
        this.database = database;
    }

    public long insert(String username, String passwordHash, Role role) {
        return database.write("insert user " + username, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO users(username,password,role) VALUES(?,?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, username);
                ps.setString(2, passwordHash);
                ps.setString(3, role.dbValue());
                ps.executeUpdate();
                return TaskStore.generatedId(ps);
            }
        });
    }

    public boolean existsByUsername(String username) {
        return database.read("look up user " + username, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM users WHERE username=? LIMIT 1")) {
                ps.setString(1, username);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    public Optional<Actor> get(long userId) {
        return database.read("load user " + userId, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT id,username,role FROM users WHERE id=?")) {
                ps.setLong(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<Actor>empty();
                }
            }
        });
    }

    public Optional<Actor> findByCredentials(String username, String passwordHash) {
        return database.read("authenticate user " + username, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id,username,role FROM users WHERE username=? AND password=?")) {
                ps.setString(1, username);
                ps.setString(2, passwordHash);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<Actor>empty();
                }
            }
        });
    }

    public List<Actor> listByRole(Role role) {
        return database.read("list users by role", c -> {
            List<Actor> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id,username,role FROM users WHERE role=? ORDER BY id")) {
                ps.setString(1, role.dbValue());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(map(rs));
                    }
                }
            }
            return out;
        });
    }

    private Actor map(ResultSet rs) throws SQLException {
        return new Actor(rs.getLong("id"), rs.getString("username"), Role.fromString(rs.getString("role")));
    }
}
