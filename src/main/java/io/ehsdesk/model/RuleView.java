package io.ehsdesk.model;

public record RuleView(long id, String text, String feedback, String timestamp) {
}
