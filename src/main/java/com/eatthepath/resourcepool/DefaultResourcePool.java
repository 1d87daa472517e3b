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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A thread-safe, blocking {@link ResourcePool}. Resources are created lazily and reused in the order they were
 * released. The pool's lock guards only its bookkeeping; resources are created, validated, and destroyed outside the
 * lock.
 *
 * @param <T> the type of pooled resource
 */
public class DefaultResourcePool<T> implements ResourcePool<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultResourcePool.class);

    private final ResourceLifecycleManager<T> resourceLifecycleManager;
    private final ResourcePoolConfiguration configuration;

    private final Lock lock = new ReentrantLock(true);
    private final Condition resourceAvailable = lock.newCondition();

    // Guarded by lock
    private final Deque<T> idleResources = new ArrayDeque<>();
    private final Set<T> resourcesInUse = Collections.newSetFromMap(new IdentityHashMap<>());
    private int pendingCreations = 0;
    private boolean isClosed = false;

    private final AtomicLong totalCreated = new AtomicLong();
    private final AtomicLong totalDestroyed = new AtomicLong();
    private final AtomicLong totalAcquired = new AtomicLong();
    private final AtomicLong totalReleased = new AtomicLong();

    public DefaultResourcePool(final ResourceLifecycleManager<T> resourceLifecycleManager, final int maxSize) {
        this(resourceLifecycleManager, ResourcePoolConfiguration.builder().maxSize(maxSize).build());
    }

    public DefaultResourcePool(final ResourceLifecycleManager<T> resourceLifecycleManager,
                               final ResourcePoolConfiguration configuration) {

        this.resourceLifecycleManager = Objects.requireNonNull(resourceLifecycleManager, "Lifecycle manager must not be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration must not be null");

        log.info("Resource pool created: {}", configuration);
    }

    @Override
    public ScopedResource<T> acquire() {
        final long maxWaitMillis = configuration.getMaxWaitMillis();

        return new ScopedResource<>(this, maxWaitMillis == ResourcePoolConfiguration.WAIT_INDEFINITELY ?
                acquireResource(false, 0) :
                acquireResource(true, TimeUnit.MILLISECONDS.toNanos(maxWaitMillis)));
    }

    @Override
    public ScopedResource<T> acquire(final long timeout, final TimeUnit timeUnit) {
        Objects.requireNonNull(timeUnit, "Time unit must not be null");
        return new ScopedResource<>(this, acquireResource(true, timeUnit.toNanos(timeout)));
    }

    private T acquireResource(final boolean timed, final long timeoutNanos) {
        final long deadline = timed ? System.nanoTime() + timeoutNanos : 0;

        while (true) {
            final T idleResource = takeIdleResourceOrReserveCapacity(timed, deadline);

            if (idleResource == null) {
                // We've reserved room for a new resource
                return createResource();
            }

            if (!configuration.isValidateOnAcquire() || isValid(idleResource)) {
                totalAcquired.incrementAndGet();
                log.debug("Acquired idle resource {}", idleResource);

                return idleResource;
            }

            log.debug("Idle resource {} failed validation; discarding it", idleResource);
            discardInvalidIdleResource(idleResource);
        }
    }

    /**
     * Waits until either an idle resource is available or the pool has spare capacity. In the former case, the idle
     * resource is marked as in use and returned. In the latter, a creation slot is reserved and this method returns
     * {@code null}.
     */
    private T takeIdleResourceOrReserveCapacity(final boolean timed, final long deadline) {
        lock.lock();

        try {
            while (true) {
                if (isClosed) {
                    throw new PoolClosedException("Cannot acquire a resource because the pool is closed");
                }

                final T idleResource = idleResources.pollFirst();

                if (idleResource != null) {
                    resourcesInUse.add(idleResource);
                    return idleResource;
                }

                if (getLiveCount() < configuration.getMaxSize()) {
                    pendingCreations += 1;
                    return null;
                }

                if (timed) {
                    final long remainingNanos = deadline - System.nanoTime();

                    if (remainingNanos <= 0) {
                        throw new PoolTimeoutException("Timed out waiting for a resource (maxSize=" +
                                configuration.getMaxSize() + ")");
                    }

                    resourceAvailable.awaitNanos(remainingNanos);
                } else {
                    resourceAvailable.await();
                }
            }
        } catch (final InterruptedException e) {
            // We may have consumed a signal meant for somebody else; pass it along
            resourceAvailable.signal();
            Thread.currentThread().interrupt();

            throw new ResourcePoolException("Interrupted while waiting for a resource", e);
        } finally {
            lock.unlock();
        }
    }

    private T createResource() {
        T resource = null;

        try {
            resource = resourceLifecycleManager.create();
        } catch (final Exception e) {
            throw new ResourceCreationException("Failed to create a new resource", e);
        } finally {
            lock.lock();

            try {
                pendingCreations -= 1;

                if (resource != null) {
                    resourcesInUse.add(resource);
                } else {
                    // The reserved slot is free again, and a waiter may be able to use it
                    resourceAvailable.signal();
                }
            } finally {
                lock.unlock();
            }
        }

        if (resource == null) {
            throw new ResourceCreationException("Lifecycle manager created a null resource");
        }

        totalCreated.incrementAndGet();
        totalAcquired.incrementAndGet();
        log.debug("Created and acquired new resource {}", resource);

        return resource;
    }

    private boolean isValid(final T resource) {
        try {
            return resourceLifecycleManager.validate(resource);
        } catch (final RuntimeException e) {
            log.debug("Failed to validate resource {}", resource, e);
            return false;
        }
    }

    private void discardInvalidIdleResource(final T resource) {
        lock.lock();

        try {
            resourcesInUse.remove(resource);
            resourceAvailable.signal();
        } finally {
            lock.unlock();
        }

        // Failing to destroy this resource doesn't stop the search for a usable one
        try {
            destroyResource(resource);
        } catch (final ResourcePoolException e) {
            log.warn("Failed to destroy invalid resource {}", resource, e);
        }
    }

    @Override
    public void release(final T resource) {
        release(resource, true);
    }

    @Override
    public void release(final T resource, final boolean valid) {
        Objects.requireNonNull(resource, "Resource must not be null");

        final boolean shouldDestroy;

        lock.lock();

        try {
            if (!resourcesInUse.remove(resource)) {
                throw new IllegalStateException("Resource " + resource + " is not checked out from this pool");
            }

            shouldDestroy = !valid || isClosed;

            if (!shouldDestroy) {
                idleResources.addLast(resource);
            }

            resourceAvailable.signal();
        } finally {
            lock.unlock();
        }

        totalReleased.incrementAndGet();
        log.debug("Released resource {} (valid={})", resource, valid);

        if (shouldDestroy) {
            destroyResource(resource);
        }
    }

    private void destroyResource(final T resource) {
        try {
            resourceLifecycleManager.destroy(resource);
        } catch (final Exception e) {
            throw new ResourcePoolException("Failed to destroy resource " + resource, e);
        }

        totalDestroyed.incrementAndGet();

        log.debug("Destroyed resource {}", resource);
    }

    @Override
    public PoolStatistics getStatistics() {
        lock.lock();

        try {
            return new PoolStatistics(idleResources.size(),
                    resourcesInUse.size(),
                    pendingCreations,
                    totalCreated.get(),
                    totalDestroyed.get(),
                    totalAcquired.get(),
                    totalReleased.get());
        } finally {
            lock.unlock();
        }
    }

    private int getLiveCount() {
        return idleResources.size() + resourcesInUse.size() + pendingCreations;
    }

    @Override
    public void close() {
        final List<T> resourcesToDestroy;
        final int resourcesInUseAtClosure;

        lock.lock();

        try {
            if (isClosed) {
                return;
            }

            isClosed = true;

            resourcesToDestroy = new ArrayList<>(idleResources);
            idleResources.clear();

            resourcesInUseAtClosure = resourcesInUse.size() + pendingCreations;

            // Everybody waiting for a resource should give up now
            resourceAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("Closing resource pool; destroying {} idle resources ({} still in use)",
                resourcesToDestroy.size(), resourcesInUseAtClosure);

        ResourcePoolException destructionFailure = null;

        for (final T resource : resourcesToDestroy) {
            try {
                destroyResource(resource);
            } catch (final ResourcePoolException e) {
                if (destructionFailure == null) {
                    destructionFailure = e;
                } else {
                    destructionFailure.addSuppressed(e);
                }
            }
        }

        if (destructionFailure != null) {
            throw destructionFailure;
        }

        log.info("Resource pool closed");
    }
}
