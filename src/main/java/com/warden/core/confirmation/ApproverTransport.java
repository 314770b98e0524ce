package com.warden.core.confirmation;

/**
 * Outbound channel that shows pending confirmations to an external approver (UI, chat, terminal).
 * <p>
 * Publishing is fire-and-forget; the approver answers asynchronously through
 * {@link ConfirmationGateway#submitResponse(String, boolean, String)}.
 */
public interface ApproverTransport {

    void publish(ConfirmationSnapshot request);

    /**
     * Called once a request reaches a terminal state, so the transport can retract its prompt.
     */
    default void resolved(ConfirmationSnapshot request) {
    }
}
