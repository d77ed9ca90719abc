package io.krpc.server.core;

import io.krpc.core.KrpcException;
import io.krpc.server.spi.ObjectStore;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ObjectStore} keyed by instance identity.
 *
 * <p>Handles are allocated sequentially from 1 and never reused, so a retired handle can
 * never silently point at a different instance. One lock guards both directions of the map.
 */
public final class IdentityObjectStore implements ObjectStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Object, Long> handles = new IdentityHashMap<>();
    private final Map<Long, Object> instances = new HashMap<>();
    private long nextHandle = 1L;

    @Override
    public long addInstance(Object instance) {
        if (instance == null) {
            return 0L;
        }
        lock.lock();
        try {
            Long existing = handles.get(instance);
            if (existing != null) {
                return existing;
            }
            long handle = nextHandle++;
            handles.put(instance, handle);
            instances.put(handle, instance);
            return handle;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Object getInstance(long handle) {
        if (handle == 0L) {
            return null;
        }
        lock.lock();
        try {
            Object instance = instances.get(handle);
            if (instance == null) {
                throw new KrpcException.InvalidHandle(handle);
            }
            return instance;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeInstance(Object instance) {
        if (instance == null) {
            return false;
        }
        lock.lock();
        try {
            Long handle = handles.remove(instance);
            if (handle == null) {
                return false;
            }
            instances.remove(handle);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return instances.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every mapping. Handles issued before remain retired.
     */
    public void clear() {
        lock.lock();
        try {
            handles.clear();
            instances.clear();
        } finally {
            lock.unlock();
        }
    }
}
