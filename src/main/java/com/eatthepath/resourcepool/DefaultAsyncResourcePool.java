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

import io.netty.util.concurrent.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * An {@link AsyncResourcePool} whose state is confined to a single event executor. All bookkeeping happens on that
 * executor, so the pool needs no locks; callers on other threads hand their requests to the executor and receive
 * futures in return.
 *
 * @param <T> the type of pooled resource
 */
public class DefaultAsyncResourcePool<T> implements AsyncResourcePool<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultAsyncResourcePool.class);

    private final AsyncResourceLifecycleManager<T> resourceLifecycleManager;
    private final OrderedEventExecutor executor;
    private final int capacity;

    private boolean isClosed = false;

    private final Set<Future<T>> pendingCreateFutures = new HashSet<>();
    private final Deque<Promise<T>> pendingAcquisitionPromises = new ArrayDeque<>();

    private final Set<T> allResources = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Deque<T> idleResources = new ArrayDeque<>();

    public DefaultAsyncResourcePool(final AsyncResourceLifecycleManager<T> resourceLifecycleManager,
                                    final OrderedEventExecutor executor,
                                    final int capacity) {

        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }

        this.resourceLifecycleManager = Objects.requireNonNull(resourceLifecycleManager, "Lifecycle manager must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
        this.capacity = capacity;
    }

    @Override
    public Future<T> acquire() {
        final Promise<T> acquirePromise = new DefaultPromise<>(executor);

        doInEventLoop(() -> acquireWithinEventExecutor(acquirePromise));

        return acquirePromise;
    }

    @Override
    public Future<T> acquire(final long timeout, final TimeUnit timeUnit) {
        final Promise<T> acquirePromise = new DefaultPromise<>(executor);

        doInEventLoop(() -> {
            final ScheduledFuture<?> timeoutFuture = executor.schedule(() -> {
                // Only acquisitions still waiting in line time out; creations already underway run to completion
                if (pendingAcquisitionPromises.remove(acquirePromise)) {
                    acquirePromise.tryFailure(new PoolTimeoutException("Timed out waiting for a resource (capacity=" +
                            capacity + ")"));
                }
            }, timeout, timeUnit);

            acquirePromise.addListener(future -> timeoutFuture.cancel(false));

            acquireWithinEventExecutor(acquirePromise);
        });

        return acquirePromise;
    }

    private void acquireWithinEventExecutor(final Promise<T> acquirePromise) {
        assert executor.inEventLoop();

        if (isClosed) {
            acquirePromise.tryFailure(new PoolClosedException("Cannot acquire a resource because the pool is closed"));
            return;
        }

        final T idleResource = idleResources.pollFirst();

        if (idleResource != null) {
            if (isValid(idleResource)) {
                if (acquirePromise.trySuccess(idleResource)) {
                    log.debug("Acquired idle resource {}", idleResource);
                } else {
                    // The caller gave up on this acquisition; the resource goes back where it came from
                    idleResources.addFirst(idleResource);
                    handleNextAcquisition();
                }
            } else {
                // The resource from the idle pool isn't usable; discard it and try again
                log.debug("Idle resource {} failed validation; discarding it", idleResource);

                // Failing to destroy this resource doesn't stop the search for a usable one
                discardResource(idleResource).addListener(future -> {
                    if (!future.isSuccess()) {
                        log.warn("Failed to destroy invalid resource {}", idleResource, future.cause());
                    }
                });

                acquireWithinEventExecutor(acquirePromise);
            }
        } else if (allResources.size() + pendingCreateFutures.size() < capacity) {
            createResource(acquirePromise);
        } else {
            // We don't have any resources ready to go, and don't have any more capacity to create new resources. Add
            // this acquisition to the queue waiting for resources to become available.
            pendingAcquisitionPromises.addLast(acquirePromise);
        }
    }

    private boolean isValid(final T resource) {
        try {
            return resourceLifecycleManager.validate(resource);
        } catch (final RuntimeException e) {
            log.debug("Failed to validate resource {}", resource, e);
            return false;
        }
    }

    private void createResource(final Promise<T> acquirePromise) {
        assert executor.inEventLoop();

        Future<T> createFuture;

        try {
            createFuture = resourceLifecycleManager.create();
        } catch (final RuntimeException e) {
            createFuture = executor.newFailedFuture(e);
        }

        final Future<T> pendingCreateFuture = createFuture;
        pendingCreateFutures.add(pendingCreateFuture);

        pendingCreateFuture.addListener((GenericFutureListener<Future<T>>) future -> {
            pendingCreateFutures.remove(pendingCreateFuture);

            if (future.isSuccess() && future.getNow() != null) {
                final T resource = future.getNow();

                allResources.add(resource);
                log.debug("Created and acquired new resource {}", resource);

                if (!acquirePromise.trySuccess(resource)) {
                    // Nobody wants this resource anymore (the acquisition may have been cancelled); keep it around
                    // for the next caller instead
                    releaseWithinEventExecutor(resource, true, new DefaultPromise<>(executor));
                }
            } else {
                acquirePromise.tryFailure(new ResourceCreationException("Failed to create a new resource",
                        future.cause()));

                // If we failed to create a resource, this is the end of the line for this acquisition attempt, and
                // callers won't be able to release the resource (since they didn't get one in the first place). Move
                // on to the next acquisition attempt if one is present.
                handleNextAcquisition();
            }
        });
    }

    @Override
    public Future<Void> release(final T resource) {
        return release(resource, true);
    }

    @Override
    public Future<Void> release(final T resource, final boolean valid) {
        final Promise<Void> releasePromise = new DefaultPromise<>(executor);

        doInEventLoop(() -> releaseWithinEventExecutor(resource, valid, releasePromise));

        return releasePromise;
    }

    private void releaseWithinEventExecutor(final T resource, final boolean valid, final Promise<Void> releasePromise) {
        assert executor.inEventLoop();

        if (!allResources.contains(resource) || idleResources.contains(resource)) {
            releasePromise.tryFailure(
                    new IllegalStateException("Resource " + resource + " is not checked out from this pool"));
            return;
        }

        if (valid && !isClosed) {
            idleResources.addLast(resource);
            releasePromise.trySuccess(null);

            log.debug("Released resource {}", resource);
        } else {
            log.debug("Released resource {} (valid={}); discarding it", resource, valid);
            discardResource(resource).addListener(new PromiseNotifier<>(releasePromise));
        }

        handleNextAcquisition();
    }

    private Future<Void> discardResource(final T resource) {
        assert executor.inEventLoop();

        idleResources.remove(resource);
        allResources.remove(resource);

        final Promise<Void> discardPromise = new DefaultPromise<>(executor);

        Future<Void> destroyFuture;

        try {
            destroyFuture = resourceLifecycleManager.destroy(resource);
        } catch (final RuntimeException e) {
            destroyFuture = executor.newFailedFuture(e);
        }

        destroyFuture.addListener(future -> {
            if (future.isSuccess()) {
                discardPromise.trySuccess(null);
            } else {
                discardPromise.tryFailure(new ResourcePoolException("Failed to destroy resource " + resource,
                        future.cause()));
            }
        });

        return discardPromise;
    }

    private void handleNextAcquisition() {
        assert executor.inEventLoop();

        Promise<T> acquisitionPromise;

        while ((acquisitionPromise = pendingAcquisitionPromises.pollFirst()) != null) {
            if (!acquisitionPromise.isDone()) {
                acquireWithinEventExecutor(acquisitionPromise);
                break;
            }
        }
    }

    @Override
    public Future<Void> close() {
        final Promise<Void> closePromise = new DefaultPromise<>(executor);

        doInEventLoop(() -> closeWithinEventExecutor(closePromise));

        return closePromise;
    }

    private void closeWithinEventExecutor(final Promise<Void> closePromise) {
        assert executor.inEventLoop();

        if (isClosed) {
            closePromise.trySuccess(null);
            return;
        }

        isClosed = true;

        log.info("Closing asynchronous resource pool");

        for (final Promise<T> acquisitionPromise : pendingAcquisitionPromises) {
            acquisitionPromise.tryFailure(new PoolClosedException("Pool closed before a resource could be acquired"));
        }

        pendingAcquisitionPromises.clear();

        final PromiseCombiner createFutureCombiner = new PromiseCombiner(executor);

        for (final Future<T> createFuture : pendingCreateFutures) {
            createFutureCombiner.add(createFuture);
        }

        final Promise<Void> allCreateFuturesFinishedPromise = new DefaultPromise<>(executor);
        createFutureCombiner.finish(allCreateFuturesFinishedPromise);

        allCreateFuturesFinishedPromise.addListener(future -> {
            // Resources still checked out get destroyed when they come back
            final PromiseCombiner destroyResourcesCombiner = new PromiseCombiner(executor);

            for (final T resource : new ArrayList<>(idleResources)) {
                destroyResourcesCombiner.add(discardResource(resource));
            }

            final Promise<Void> allResourcesDestroyedPromise = new DefaultPromise<>(executor);
            destroyResourcesCombiner.finish(allResourcesDestroyedPromise);

            allResourcesDestroyedPromise.addListener(new PromiseNotifier<>(closePromise));
            allResourcesDestroyedPromise.addListener(destroyFuture -> log.info("Asynchronous resource pool closed"));
        });
    }

    private void doInEventLoop(final Runnable action) {
        if (executor.inEventLoop()) {
            action.run();
        } else {
            executor.submit(action);
        }
    }
}
