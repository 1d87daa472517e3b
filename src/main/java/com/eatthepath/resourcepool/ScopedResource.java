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

/**
 * A resource checked out from a {@link ResourcePool}. Closing a scoped resource releases it back to the pool that
 * issued it, so acquiring resources in a try-with-resources block guarantees their release no matter how the block
 * exits:
 *
 * <pre>
 * try (final ScopedResource&lt;Connection&gt; scopedConnection = pool.acquire()) {
 *     final Connection connection = scopedConnection.get();
 *
 *     if (!connection.send(message)) {
 *         // The connection is broken; the pool will destroy it instead of reusing it
 *         scopedConnection.invalidate();
 *     }
 * }
 * </pre>
 *
 * Scoped resources belong to a single caller and are not thread-safe.
 *
 * @param <T> the type of the underlying resource
 */
public class ScopedResource<T> implements AutoCloseable {

    private final ResourcePool<T> pool;
    private final T resource;

    private boolean valid = true;
    private boolean released = false;

    public ScopedResource(final ResourcePool<T> pool, final T resource) {
        this.pool = Objects.requireNonNull(pool, "Pool must not be null");
        this.resource = Objects.requireNonNull(resource, "Resource must not be null");
    }

    /**
     * Returns the underlying resource.
     *
     * @return the underlying resource
     *
     * @throws IllegalStateException if this scoped resource has already been closed
     */
    public T get() {
        if (released) {
            throw new IllegalStateException("Resource has already been released");
        }

        return resource;
    }

    /**
     * Marks the underlying resource as unusable; the pool will destroy it instead of reusing it when this scoped
     * resource is closed.
     */
    public void invalidate() {
        valid = false;
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Releases the underlying resource to its pool. Only the first call has any effect.
     */
    @Override
    public void close() {
        if (!released) {
            released = true;
            pool.release(resource, valid);
        }
    }
}
