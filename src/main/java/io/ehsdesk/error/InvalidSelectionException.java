package io.ehsdesk.error;

/** A report submitted for a task outside the worker's open task list. */
public class InvalidSelectionException extends EhsDeskException {
    public InvalidSelectionException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "invalid_selection";
    }
}
