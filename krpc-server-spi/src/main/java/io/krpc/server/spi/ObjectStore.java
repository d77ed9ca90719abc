package io.krpc.server.spi;

import io.krpc.core.KrpcException;

/**
 * Bidirectional map between host instances and the opaque handles clients see.
 *
 * <p>The store only records the relation; it never owns the instances. Handle {@code 0} always
 * means {@code null}. Implementations must be safe to call from the tick thread and from any
 * thread that produces instances.
 */
public interface ObjectStore {

    /**
     * Register an instance, or return its existing handle. Lookup is by identity, not equality.
     *
     * @param instance the host instance, may be null
     * @return the handle for the instance, {@code 0} for null
     */
    long addInstance(Object instance);

    /**
     * Resolve a handle.
     *
     * @return the registered instance, or null for handle {@code 0}
     * @throws KrpcException.InvalidHandle if nothing is registered under the handle
     */
    Object getInstance(long handle);

    /**
     * Resolve a handle and check the instance type.
     *
     * @throws KrpcException.InvalidHandle if nothing is registered under the handle
     * @throws KrpcException.ArgumentError if the instance is not a {@code type}
     */
    default <T> T getInstance(long handle, Class<T> type) {
        Object instance = getInstance(handle);
        if (instance != null && !type.isInstance(instance)) {
            throw new KrpcException.ArgumentError("Handle " + Long.toUnsignedString(handle)
                    + " refers to a " + instance.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(instance);
    }

    /**
     * Invalidate an instance the host has destroyed. Its handle is retired and never reissued.
     *
     * @return true if the instance was registered
     */
    boolean removeInstance(Object instance);

    /**
     * Number of live mappings.
     */
    int size();
}
