package com.aletheia.engine.api;

/**
 * @param accepted null counts as an acceptance
 */
public record AcceptanceRequest(String workerId, Boolean accepted) {

    boolean isAccepted() {
        return accepted == null || accepted;
    }
}
