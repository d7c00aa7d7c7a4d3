package io.ehsdesk.error;

/** Empty or malformed input. */
public class ValidationException extends EhsDeskException {
    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "validation";
    }
}
