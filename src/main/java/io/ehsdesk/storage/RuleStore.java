package io.ehsdesk.storage;

import io.ehsdesk.model.RuleView;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class RuleStore {
    private final Database database;

    public RuleStore(Database database) {
        this.database = database;
    }

    public long insert(String text, String timestamp) {
        return database.write("insert rule", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO rules(rule_text,timestamp) VALUES(?,?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, text);
                ps.setString(2, timestamp);
                ps.executeUpdate();
                return TaskStore.generatedId(ps);
            }
        });
    }

    public Optional<RuleView> get(long ruleId) {
        return database.read("load rule " + ruleId, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id,rule_text,feedback,timestamp FROM rules WHERE id=?")) {
                ps.setLong(1, ruleId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<RuleView>empty();
                }
            }
        });
    }

    public List<RuleView> listAll() {
        return database.read("list rules", c -> {
            List<RuleView> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id,rule_text,feedback,timestamp FROM rules ORDER BY id");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        });
    }

    /** Blind overwrite of the feedback slot. Returns false when the rule does not exist. */
    public boolean updateFeedback(long ruleId, String feedback) {
        return database.write("update rule feedback " + ruleId, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE rules SET feedback=? WHERE id=?")) {
                ps.setString(1, feedback);
                ps.setLong(2, ruleId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public boolean delete(long ruleId) {
        return database.write("delete rule " + ruleId, c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM rules WHERE id=?")) {
                ps.setLong(1, ruleId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private RuleView map(ResultSet rs) throws SQLException {
        return new RuleView(
                rs.getLong("id"),
                rs.getString("rule_text"),
                rs.getString("feedback"),
                rs.getString("timestamp")
        );
    }
}
