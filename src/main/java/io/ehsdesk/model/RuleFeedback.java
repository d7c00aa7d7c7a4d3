package io.ehsdesk.model;

public record RuleFeedback(long ruleId, String ruleText, String feedback) {
    public boolean hasFeedback() {
        return feedback != null && !feedback.isEmpty();
    }
}
