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
 * A group of blocking resource pools with one independent pool per key (per broker address, for example). Each key's
 * pool enforces its own capacity.
 *
 * @param <K> the type of key
 * @param <T> the type of pooled resource
 */
public interface KeyedResourcePool<K, T> extends AutoCloseable {

    ScopedResource<T> acquire(K key);

    ScopedResource<T> acquire(K key, long timeout, TimeUnit timeUnit);

    void release(K key, T resource);

    void release(K key, T resource, boolean valid);

    /**
     * Returns statistics for the given key's pool.
     *
     * @param key the key whose pool to describe
     *
     * @return statistics for the given key's pool, or {@code null} if no resource has ever been acquired for the key
     */
    PoolStatistics getStatistics(K key);

    @Override
    void close();
}
