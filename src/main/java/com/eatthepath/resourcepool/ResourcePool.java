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

import java.util.concurrent.TimeUnit;

/**
 * A bounded pool of reusable resources that blocks callers while it is exhausted.
 *
 * @param <T> the type of pooled resource
 */
public interface ResourcePool<T> extends AutoCloseable {

    /**
     * Acquires a resource, waiting for the pool's configured default time if none is available.
     *
     * @return a scoped handle for the acquired resource
     *
     * @throws PoolTimeoutException if the pool's default wait elapsed before a resource became available
     * @throws ResourceCreationException if a new resource was needed and could not be created
     * @throws PoolClosedException if the pool is closed
     */
    ScopedResource<T> acquire();

    /**
     * Acquires a resource, waiting up to the given time if none is available.
     *
     * @param timeout the longest time to wait for a resource
     * @param timeUnit the unit of {@code timeout}
     *
     * @return a scoped handle for the acquired resource
     *
     * @throws PoolTimeoutException if the timeout elapsed before a resource became available
     * @throws ResourceCreationException if a new resource was needed and could not be created
     * @throws PoolClosedException if the pool is closed
     */
    ScopedResource<T> acquire(long timeout, TimeUnit timeUnit);

    /**
     * Returns a valid resource to this pool.
     *
     * @param resource the resource to return
     */
    void release(T resource);

    /**
     * Returns a resource to this pool. Valid resources become available to other callers; invalid resources, and all
     * resources released after the pool has closed, are destroyed.
     *
     * @param resource the resource to return
     * @param valid {@code true} if the resource may be reused or {@code false} if it should be destroyed
     *
     * @throws IllegalStateException if the resource is not currently checked out from this pool
     * @throws ResourcePoolException if the resource needed to be destroyed and could not be
     */
    void release(T resource, boolean valid);

    PoolStatistics getStatistics();

    /**
     * Closes this pool and destroys its idle resources. Resources still in use are destroyed as they are released.
     * Calling this method on a closed pool has no effect.
     *
     * @throws ResourcePoolException if one or more idle resources could not be destroyed
     */
    @Override
    void close();
}
