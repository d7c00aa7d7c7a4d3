package io.ehsdesk.model;

/** An authenticated user. Holds identity only; task and rule data are always re-read from the store. */
public record Actor(long id, String username, Role role) {
    public boolean isManager() {
        return role == Role.MANAGER;
    }

    public boolean isWorker() {
        return role == Role.WORKER;
    }
}
