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
 * A point-in-time snapshot of a resource pool's state.
 */
public class PoolStatistics {

    private final int idleCount;
    private final int inUseCount;
    private final int pendingCreationCount;

    private final long totalCreated;
    private final long totalDestroyed;
    private final long totalAcquired;
    private final long totalReleased;

    public PoolStatistics(final int idleCount,
                          final int inUseCount,
                          final int pendingCreationCount,
                          final long totalCreated,
                          final long totalDestroyed,
                          final long totalAcquired,
                          final long totalReleased) {

        this.idleCount = idleCount;
        this.inUseCount = inUseCount;
        this.pendingCreationCount = pendingCreationCount;
        this.totalCreated = totalCreated;
        this.totalDestroyed = totalDestroyed;
        this.totalAcquired = totalAcquired;
        this.totalReleased = totalReleased;
    }

    /**
     * Returns the number of resources that count toward the pool's capacity: idle resources, resources in use, and
     * resources being created.
     *
     * @return the pool's live resource count
     */
    public int getLiveCount() {
        return idleCount + inUseCount + pendingCreationCount;
    }

    public int getIdleCount() {
        return idleCount;
    }

    public int getInUseCount() {
        return inUseCount;
    }

    public int getPendingCreationCount() {
        return pendingCreationCount;
    }

    public long getTotalCreated() {
        return totalCreated;
    }

    public long getTotalDestroyed() {
        return totalDestroyed;
    }

    public long getTotalAcquired() {
        return totalAcquired;
    }

    public long getTotalReleased() {
        return totalReleased;
    }

    @Override
    public String toString() {
        return "PoolStatistics{" +
                "idle=" + idleCount +
                ", inUse=" + inUseCount +
                ", pendingCreation=" + pendingCreationCount +
                ", created=" + totalCreated +
                ", destroyed=" + totalDestroyed +
                ", acquired=" + totalAcquired +
                ", released=" + totalReleased +
                '}';
    }
}
