package io.ehsdesk.error;

/** An id that does not resolve to a row. */
public class NotFoundException extends EhsDeskException {
    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "not_found";
    }
}
