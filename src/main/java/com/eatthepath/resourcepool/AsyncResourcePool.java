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

import io.netty.util.concurrent.Future;

import java.util.concurrent.TimeUnit;

/**
 * A bounded pool of reusable resources for callers that must never block, such as code running on an event loop.
 *
 * @param <T> the type of pooled resource
 */
public interface AsyncResourcePool<T> {

    /**
     * Acquires a resource, waiting for as long as it takes for one to become available.
     *
     * @return a future that succeeds with the acquired resource
     */
    Future<T> acquire();

    /**
     * Acquires a resource. If the pool is exhausted and the request is still waiting in line after the given time,
     * the returned future fails with a {@link PoolTimeoutException}.
     *
     * @param timeout the longest time to wait in line for a resource
     * @param timeUnit the unit of {@code timeout}
     *
     * @return a future that succeeds with the acquired resource
     */
    Future<T> acquire(long timeout, TimeUnit timeUnit);

    Future<Void> release(T resource);

    /**
     * Returns a resource to this pool, destroying it if it is invalid or if the pool has been closed.
     *
     * @param resource the resource to return
     * @param valid {@code true} if the resource may be reused or {@code false} if it should be destroyed
     *
     * @return a future that completes when the resource is idle or destroyed, and that fails with an
     * {@link IllegalStateException} if the resource was not checked out from this pool
     */
    Future<Void> release(T resource, boolean valid);

    Future<Void> close();
}
