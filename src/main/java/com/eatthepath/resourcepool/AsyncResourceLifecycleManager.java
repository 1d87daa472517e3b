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

/**
 * Creates, validates, and destroys resources for an asynchronous resource pool.
 *
 * @param <T> the type of resource managed by this lifecycle manager
 */
public interface AsyncResourceLifecycleManager<T> {

    /**
     * Asynchronously creates a new resource for use in an asynchronous resource pool. Newly-created resources are
     * assumed to be valid; if a newly-created resource would not pass this lifecycle manager's
     * {@link #validate(Object)} check, this method should return a failed future instead.
     *
     * @return a {@code Future} that will complete when a new resource has been created
     */
    Future<T> create();

    /**
     * Tests whether the given resource is usable and should be available to borrowers. Implementations of this method
     * must not block.
     *
     * @param resource the resource to test
     *
     * @return {@code true} if the resource is usable and should be available to borrowers or {@code false} otherwise
     */
    boolean validate(T resource);

    /**
     * Asynchronously destroys a resource evicted from an asynchronous resource pool.
     *
     * @param resource the resource to destroy
     *
     * @return a {@code Future} that will complete when the given resource has been destroyed
     */
    Future<Void> destroy(T resource);
}
