package io.ehsdesk.rules;

import io.ehsdesk.error.NotFoundException;
import io.ehsdesk.error.ValidationException;
import io.ehsdesk.model.RuleFeedback;
import io.ehsdesk.model.RuleView;
import io.ehsdesk.storage.RuleStore;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Safety rules and their single feedback slot.
 *
 * <p>Feedback is a blind overwrite: two workers writing the same rule race and whichever write
 * lands last is kept. There is no history and no version check.
 */
public final class RuleFeedbackLedger {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RuleStore ruleStore;
    private final Clock clock;

    public RuleFeedbackLedger(RuleStore ruleStore, Clock clock) {
        this.ruleStore = ruleStore;
        this.clock = clock;
    }

    public long addRule(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Rule cannot be empty");
        }
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return ruleStore.insert(text.trim(), timestamp);
    }

    public void deleteRule(long ruleId) {
        if (!ruleStore.delete(ruleId)) {
            throw new NotFoundException("Rule not found: " + ruleId);
        }
    }

    public void giveFeedback(long ruleId, String feedbackText) {
        if (feedbackText == null || feedbackText.isBlank()) {
            throw new ValidationException("Feedback cannot be empty");
        }
        if (!ruleStore.updateFeedback(ruleId, feedbackText.trim())) {
            throw new NotFoundException("Rule not found: " + ruleId);
        }
    }

    public List<RuleView> listRules() {
        return ruleStore.listAll();
    }

    public List<RuleFeedback> listFeedback() {
        return ruleStore.listAll().stream()
                .map(rule -> new RuleFeedback(rule.id(), rule.text(), rule.feedback()))
                .toList();
    }
}
