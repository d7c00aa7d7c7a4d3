package io.ehsdesk.error;

public class StoreException extends EhsDeskException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "store";
    }
}
