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
import java.util.concurrent.Callable;

/**
 * Creates, validates, and destroys resources for a blocking resource pool. Pools never call these methods while
 * holding their internal locks, so implementations may block (to open a connection, for example).
 *
 * @param <T> the type of resource managed by this lifecycle manager
 */
public interface ResourceLifecycleManager<T> {

    /**
     * Creates a new resource. Newly-created resources are assumed to be valid.
     *
     * @return a new, non-null resource
     *
     * @throws Exception if the resource could not be created; pools report this to callers as a
     * {@link ResourceCreationException}
     */
    T create() throws Exception;

    /**
     * Tests whether an idle resource is still usable and may be handed to a caller.
     *
     * @param resource the resource to test
     *
     * @return {@code true} if the resource is usable or {@code false} if it should be destroyed
     */
    boolean validate(T resource);

    /**
     * Destroys a resource evicted from a pool.
     *
     * @param resource the resource to destroy
     *
     * @throws Exception if the resource could not be closed cleanly
     */
    void destroy(T resource) throws Exception;

    /**
     * Returns a lifecycle manager that creates resources with the given factory and destroys them with the given
     * closer. Resources produced by the returned manager always pass validation.
     *
     * @param factory the source of new resources
     * @param closer the action that closes evicted resources
     * @param <T> the type of resource managed by the returned lifecycle manager
     *
     * @return a lifecycle manager backed by the given factory and closer
     */
    static <T> ResourceLifecycleManager<T> of(final Callable<? extends T> factory, final ResourceCloser<? super T> closer) {
        Objects.requireNonNull(factory, "Factory must not be null");
        Objects.requireNonNull(closer, "Closer must not be null");

        return new ResourceLifecycleManager<T>() {
            @Override
            public T create() throws Exception {
                return factory.call();
            }

            @Override
            public boolean validate(final T resource) {
                return true;
            }

            @Override
            public void destroy(final T resource) throws Exception {
                closer.close(resource);
            }
        };
    }
}
