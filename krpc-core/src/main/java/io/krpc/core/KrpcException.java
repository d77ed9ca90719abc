package io.krpc.core;

/**
 * Base class for runtime errors raised by the RPC server and its collaborators.
 *
 * <p>Per-call subclasses ({@link InvalidHandle}, {@link UnknownProcedure}, {@link ArgumentError})
 * are converted into error slots of a response. {@link RequestBufferOverflow} is fatal for the
 * connection that caused it and nothing else.
 */
public abstract class KrpcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected KrpcException(String message) {
        super(message);
    }

    protected KrpcException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a handle does not map to a registered instance.
     */
    public static class InvalidHandle extends KrpcException {
        private static final long serialVersionUID = 1L;
        private final long handle;

        public InvalidHandle(long handle) {
            super("No instance registered for handle " + Long.toUnsignedString(handle));
            this.handle = handle;
        }

        public long handle() {
            return handle;
        }
    }

    /**
     * Raised when a call names a service or procedure the dispatcher does not know.
     */
    public static class UnknownProcedure extends KrpcException {
        private static final long serialVersionUID = 1L;

        public UnknownProcedure(String service, String procedure) {
            super("Procedure not found: " + service + "." + procedure);
        }
    }

    /**
     * Raised when call arguments do not match the procedure signature.
     */
    public static class ArgumentError extends KrpcException {
        private static final long serialVersionUID = 1L;

        public ArgumentError(String message) {
            super(message);
        }

        public ArgumentError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a receive buffer fills up without yielding a complete message.
     */
    public static class RequestBufferOverflow extends KrpcException {
        private static final long serialVersionUID = 1L;

        public RequestBufferOverflow(int capacity) {
            super("Receive buffer of " + capacity + " bytes filled without a complete message");
        }
    }

    /**
     * Raised when the server cannot be started or bound.
     */
    public static class ServerException extends KrpcException {
        private static final long serialVersionUID = 1L;

        public ServerException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
