package io.krpc.server.spi;

/**
 * Decides whether a client that completed its RPC handshake may connect.
 *
 * <p>Asked once per tick for every session awaiting approval until it answers
 * {@link Decision.Allow} or {@link Decision.Deny}, or the approval timeout passes.
 * Operator-confirmed approval returns {@link Decision.Pending} until the operator has answered.
 */
@FunctionalInterface
public interface ConnectionApprover {

    Decision onConnectionRequested(ClientInfo client);

    sealed interface Decision permits Decision.Allow, Decision.Deny, Decision.Pending {

        Decision ALLOW = new Allow();
        Decision PENDING = new Pending();

        record Allow() implements Decision {}

        /**
         * @param reason message returned to the client
         */
        record Deny(String reason) implements Decision {
            public Deny {
                reason = reason == null ? "" : reason;
            }
        }

        record Pending() implements Decision {}
    }

    /**
     * Approver that admits every client.
     */
    static ConnectionApprover allowAll() {
        return client -> Decision.ALLOW;
    }
}
