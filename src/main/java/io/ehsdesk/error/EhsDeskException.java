package io.ehsdesk.error;

/**
 * Root of the failures an operation can end with. None of them is fatal to the process:
 * each aborts the current operation only and hands control back to the caller.
 */
public class EhsDeskException extends RuntimeException {
    public EhsDeskException(String message) {
        super(message);
    }

    public EhsDeskException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short machine-readable tag used in audit rows and CLI JSON output. */
    public String code() {
        return "error";
    }
}
