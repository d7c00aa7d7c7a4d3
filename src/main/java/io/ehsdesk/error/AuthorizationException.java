package io.ehsdesk.error;

/** An actor acting on something it does not own or its role does not permit. */
public class AuthorizationException extends EhsDeskException {
    public AuthorizationException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "unauthorized";
    }
}
