/*
 * Copyright (c) 2020 Jon Chambers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package com.eatthepath.resourcepool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link KeyedResourcePool} that lazily creates a {@link DefaultResourcePool} for each key it encounters. All
 * per-key pools share the same configuration.
 *
 * @param <K> the type of key
 * @param <T> the type of pooled resource
 */
public class DefaultKeyedResourcePool<K, T> implements KeyedResourcePool<K, T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultKeyedResourcePool.class);

    private final KeyedResourceLifecycleManager<K, T> resourceLifecycleManager;
    private final ResourcePoolConfiguration configuration;

    private final Lock lock = new ReentrantLock();

    // Guarded by lock
    private final Map<K, ResourcePool<T>> poolsByKey = new HashMap<>();
    private boolean isClosed = false;

    private class DelegatingResourceLifecycleManager implements ResourceLifecycleManager<T> {
        private final K key;

        public DelegatingResourceLifecycleManager(final K key) {
            this.key = key;
        }

        @Override
        public T create() throws Exception {
            return resourceLifecycleManager.create(key);
        }

        @Override
        public boolean validate(final T resource) {
            return resourceLifecycleManager.validate(key, resource);
        }

        @Override
        public void destroy(final T resource) throws Exception {
            resourceLifecycleManager.destroy(key, resource);
        }
    }

    public DefaultKeyedResourcePool(final KeyedResourceLifecycleManager<K, T> resourceLifecycleManager,
                                    final ResourcePoolConfiguration configuration) {

        this.resourceLifecycleManager = Objects.requireNonNull(resourceLifecycleManager, "Lifecycle manager must not be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration must not be null");
    }

    @Override
    public ScopedResource<T> acquire(final K key) {
        return getOrCreatePool(key).acquire();
    }

    @Override
    public ScopedResource<T> acquire(final K key, final long timeout, final TimeUnit timeUnit) {
        return getOrCreatePool(key).acquire(timeout, timeUnit);
    }

    private ResourcePool<T> getOrCreatePool(final K key) {
        Objects.requireNonNull(key, "Key must not be null");

        lock.lock();

        try {
            if (isClosed) {
                throw new PoolClosedException("Cannot acquire a resource because the pool is closed");
            }

            return poolsByKey.computeIfAbsent(key, k -> {
                log.debug("Creating resource pool for key {}", k);
                return new DefaultResourcePool<>(new DelegatingResourceLifecycleManager(k), configuration);
            });
        } finally {
            lock.unlock();
        }
    }

    private ResourcePool<T> getPool(final K key) {
        lock.lock();

        try {
            return poolsByKey.get(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(final K key, final T resource) {
        release(key, resource, true);
    }

    @Override
    public void release(final K key, final T resource, final boolean valid) {
        final ResourcePool<T> poolForKey = getPool(key);

        if (poolForKey == null) {
            throw new IllegalArgumentException("Cannot release resource for non-existent key: " + key);
        }

        poolForKey.release(resource, valid);
    }

    @Override
    public PoolStatistics getStatistics(final K key) {
        final ResourcePool<T> poolForKey = getPool(key);
        return poolForKey != null ? poolForKey.getStatistics() : null;
    }

    @Override
    public void close() {
        final List<ResourcePool<T>> pools;

        lock.lock();

        try {
            if (isClosed) {
                return;
            }

            isClosed = true;
            pools = new ArrayList<>(poolsByKey.values());
        } finally {
            lock.unlock();
        }

        log.info("Closing {} keyed resource pools", pools.size());

        ResourcePoolException closeFailure = null;

        for (final ResourcePool<T> pool : pools) {
            try {
                pool.close();
            } catch (final ResourcePoolException e) {
                if (closeFailure == null) {
                    closeFailure = e;
                } else {
                    closeFailure.addSuppressed(e);
                }
            }
        }

        if (closeFailure != null) {
            throw closeFailure;
        }
    }
}
