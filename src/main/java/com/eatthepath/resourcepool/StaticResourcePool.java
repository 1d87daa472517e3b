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

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link ResourcePool} that always hands out the same resource without ever blocking. Releasing the resource has no
 * effect and the resource is never destroyed. This pool is meant to stand in for a real pool in tests of code that
 * consumes pools, where a deterministic, always-available resource (usually a mock) is more useful than real
 * connections.
 *
 * @param <T> the type of pooled resource
 */
public class StaticResourcePool<T> implements ResourcePool<T> {

    private final T resource;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong totalAcquired = new AtomicLong();
    private final AtomicLong totalReleased = new AtomicLong();

    public StaticResourcePool(final T resource) {
        this.resource = Objects.requireNonNull(resource, "Resource must not be null");
    }

    public T getResource() {
        return resource;
    }

    @Override
    public ScopedResource<T> acquire() {
        if (closed.get()) {
            throw new PoolClosedException("Cannot acquire a resource because the pool is closed");
        }

        totalAcquired.incrementAndGet();
        return new ScopedResource<>(this, resource);
    }

    @Override
    public ScopedResource<T> acquire(final long timeout, final TimeUnit timeUnit) {
        return acquire();
    }

    @Override
    public void release(final T resource) {
        release(resource, true);
    }

    @Override
    public void release(final T resource, final boolean valid) {
        totalReleased.incrementAndGet();
    }

    @Override
    public PoolStatistics getStatistics() {
        // The single resource is always available, so it always counts as idle
        return new PoolStatistics(1, 0, 0, 1, 0, totalAcquired.get(), totalReleased.get());
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
