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

/**
 * Configuration for {@link DefaultResourcePool} and {@link DefaultKeyedResourcePool}.
 */
public class ResourcePoolConfiguration {

    public static final int DEFAULT_MAX_SIZE = 10;

    /**
     * A {@code maxWaitMillis} value that makes untimed acquisitions wait for as long as it takes.
     */
    public static final long WAIT_INDEFINITELY = 0;

    private final int maxSize;
    private final long maxWaitMillis;
    private final boolean validateOnAcquire;

    private ResourcePoolConfiguration(final Builder builder) {
        this.maxSize = builder.maxSize;
        this.maxWaitMillis = builder.maxWaitMillis;
        this.validateOnAcquire = builder.validateOnAcquire;
    }

    public static ResourcePoolConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the maximum number of resources a pool may hold at once, counting idle resources, resources in use, and
     * resources being created.
     *
     * @return the maximum number of live resources
     */
    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Returns the longest time, in milliseconds, that {@link ResourcePool#acquire()} waits for a resource, or
     * {@link #WAIT_INDEFINITELY}.
     *
     * @return the default acquisition timeout in milliseconds
     */
    public long getMaxWaitMillis() {
        return maxWaitMillis;
    }

    public boolean isValidateOnAcquire() {
        return validateOnAcquire;
    }

    public static class Builder {
        private int maxSize = DEFAULT_MAX_SIZE;
        private long maxWaitMillis = WAIT_INDEFINITELY;
        private boolean validateOnAcquire = true;

        private Builder() {
        }

        public Builder maxSize(final int maxSize) {
            if (maxSize < 1) {
                throw new IllegalArgumentException("maxSize must be at least 1");
            }

            this.maxSize = maxSize;
            return this;
        }

        public Builder maxWaitMillis(final long maxWaitMillis) {
            if (maxWaitMillis < 0) {
                throw new IllegalArgumentException("maxWaitMillis must not be negative");
            }

            this.maxWaitMillis = maxWaitMillis;
            return this;
        }

        public Builder validateOnAcquire(final boolean validateOnAcquire) {
            this.validateOnAcquire = validateOnAcquire;
            return this;
        }

        public ResourcePoolConfiguration build() {
            return new ResourcePoolConfiguration(this);
        }
    }

    @Override
    public String toString() {
        return "ResourcePoolConfiguration{" +
                "maxSize=" + maxSize +
                ", maxWaitMillis=" + maxWaitMillis +
                ", validateOnAcquire=" + validateOnAcquire +
                '}';
    }
}
