package io.ehsdesk.error;

public class TransferException extends EhsDeskException {
    public TransferException(String message) {
        super(message);
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "transfer";
    }
}
