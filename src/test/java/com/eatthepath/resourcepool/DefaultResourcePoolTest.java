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

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class DefaultResourcePoolTest {

    private ResourceLifecycleManager<Object> resourceLifecycleManager;

    private DefaultResourcePool<Object> pool;

    private ExecutorService executorService;

    @SuppressWarnings("unchecked")
    @BeforeEach
    public void setUp() {
        resourceLifecycleManager = mock(ResourceLifecycleManager.class);
        when(resourceLifecycleManager.validate(any())).thenReturn(true);

        pool = new DefaultResourcePool<>(resourceLifecycleManager, 1);
        executorService = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        executorService.shutdownNow();
        pool.close();
    }

    private void replacePool(final DefaultResourcePool<Object> replacementPool) {
        pool.close();
        pool = replacementPool;
    }

    @Test
    void testAcquireRelease() throws Exception {
        final Object pooledResource = new Object();
        when(resourceLifecycleManager.create()).thenReturn(pooledResource);

        final ScopedResource<Object> firstResource = pool.acquire();
        final Future<ScopedResource<Object>> secondAcquireFuture = executorService.submit(() -> pool.acquire());

        assertThrows(TimeoutException.class, () -> secondAcquireFuture.get(500, TimeUnit.MILLISECONDS));

        firstResource.close();

        final ScopedResource<Object> secondResource = secondAcquireFuture.get(5, TimeUnit.SECONDS);
        assertSame(pooledResource, secondResource.get());

        secondResource.close();

        verify(resourceLifecycleManager).create();
        verify(resourceLifecycleManager, never()).destroy(any());
    }

    @Test
    void testReleasedResourceIsReused() throws Exception {
        replacePool(new DefaultResourcePool<>(resourceLifecycleManager, 4));
        when(resourceLifecycleManager.create()).thenAnswer(invocation -> new Object());

        final Object firstResource;

        try (final ScopedResource<Object> scopedResource = pool.acquire()) {
            firstResource = scopedResource.get();
        }

        try (final ScopedResource<Object> scopedResource = pool.acquire()) {
            assertSame(firstResource, scopedResource.get());
        }

        verify(resourceLifecycleManager).create();
    }

    @Test
    void testIdleResourcesReusedInReleaseOrder() throws Exception {
        replacePool(new DefaultResourcePool<>(resourceLifecycleManager, 2));
        when(resourceLifecycleManager.create()).thenAnswer(invocation -> new Object());

        final ScopedResource<Object> firstScopedResource = pool.acquire();
        final ScopedResource<Object> secondScopedResource = pool.acquire();

        final Object firstResource = firstScopedResource.get();
        final Object secondResource = secondScopedResource.get();

        secondScopedResource.close();
        firstScopedResource.close();

        final ScopedResource<Object> thirdScopedResource = pool.acquire();
        final ScopedResource<Object> fourthScopedResource = pool.acquire();

        assertSame(secondResource, thirdScopedResource.get());
        assertSame(firstResource, fourthScopedResource.get());

        verify(resourceLifecycleManager, times(2)).create();
    }

    @Test
    void testAcquireCreationFailure() throws Exception {
        final IOException creationFailure = new IOException("Connection refused");
        when(resourceLifecycleManager.create()).thenThrow(creationFailure);

        final ResourceCreationException exception = assertThrows(ResourceCreationException.class, () -> pool.acquire());
        assertSame(creationFailure, exception.getCause());

        assertEquals(0, pool.getStatistics().getLiveCount());
        assertEquals(0, pool.getStatistics().getTotalCreated());
    }

    @Test
    void testCreationFailureDoesNotConsumeCapacity() throws Exception {
        final Object pooledResource = new Object();

        when(resourceLifecycleManager.create())
                .thenThrow(new IOException("Connection refused"))
                .thenReturn(pooledResource);

        assertThrows(ResourceCreationException.class, () -> pool.acquire());

        try (final ScopedResource<Object> scopedResource = pool.acquire(1, TimeUnit.SECONDS)) {
            assertSame(pooledResource, scopedResource.get());
        }
    }

    @Test
    void testCreationFailureWakesWaiter() throws Exception {
        final CountDownLatch createStartedLatch = new CountDownLatch(1);
        final CountDownLatch failCreateLatch = new CountDownLatch(1);
        final Object pooledResource = new Object();
        final AtomicInteger createCount = new AtomicInteger();

        when(resourceLifecycleManager.create()).thenAnswer(invocation -> {
            if (createCount.getAndIncrement() == 0) {
                createStartedLatch.countDown();
                failCreateLatch.await();

                throw new IOException("Connection refused");
            }

            return pooledResource;
        });

        final Future<ScopedResource<Object>> failedAcquireFuture = executorService.submit(() -> pool.acquire());
        assertTrue(createStartedLatch.await(5, TimeUnit.SECONDS));

        final Future<ScopedResource<Object>> waitingAcquireFuture = executorService.submit(() -> pool.acquire());
        assertThrows(TimeoutException.class, () -> waitingAcquireFuture.get(200, TimeUnit.MILLISECONDS));

        failCreateLatch.countDown();

        final ExecutionException executionException = assertThrows(ExecutionException.class,
                () -> failedAcquireFuture.get(5, TimeUnit.SECONDS));

        assertTrue(executionException.getCause() instanceof ResourceCreationException);
        assertSame(pooledResource, waitingAcquireFuture.get(5, TimeUnit.SECONDS).get());
    }

    @Test
    void testNullResourceIsCreationFailure() throws Exception {
        when(resourceLifecycleManager.create()).thenReturn(null);

        assertThrows(ResourceCreationException.class, () -> pool.acquire());
        assertEquals(0, pool.getStatistics().getLiveCount());
    }

    @Test
    void testReleaseInvalidResource() throws Exception {
        final Object invalidResource = new Object();
        final Object replacementResource = new Object();

        when(resourceLifecycleManager.create())
                .thenReturn(invalidResource)
                .thenReturn(replacementResource);

        final ScopedResource<Object> scopedResource = pool.acquire();
        assertSame(invalidResource, scopedResource.get());

        pool.release(invalidResource, false);

        verify(resourceLifecycleManager).destroy(invalidResource);
        assertEquals(0, pool.getStatistics().getLiveCount());

        try (final ScopedResource<Object> replacement = pool.acquire()) {
            assertSame(replacementResource, replacement.get());
        }

        verify(resourceLifecycleManager, times(2)).create();
    }

    @Test
    void testInvalidateScopedResource() throws Exception {
        final Object invalidResource = new Object();
        final Object replacementResource = new Object();

        when(resourceLifecycleManager.create())
                .thenReturn(invalidResource)
                .thenReturn(replacementResource);

        try (final ScopedResource<Object> scopedResource = pool.acquire()) {
            scopedResource.invalidate();
        }

        verify(resourceLifecycleManager).destroy(invalidResource);

        try (final ScopedResource<Object> scopedResource = pool.acquire()) {
            assertSame(replacementResource, scopedResource.get());
        }
    }

    @Test
    void testScopedResourceReleasedWhenScopeThrows() throws Exception {
        final Object pooledResource = new Object();
        when(resourceLifecycleManager.create()).thenReturn(pooledResource);

        assertThrows(IllegalArgumentException.class, () -> {
            try (final ScopedResource<Object> ignored = pool.acquire()) {
                throw new IllegalArgumentException();
            }
        });

        final PoolStatistics statistics = pool.getStatistics();

        assertEquals(0, statistics.getInUseCount());
        assertEquals(1, statistics.getIdleCount());
        assertEquals(1, statistics.getTotalReleased());
    }

    @Test
    void testScopedResourceCloseIsIdempotent() throws Exception {
        when(resourceLifecycleManager.create()).thenReturn(new Object());

        final ScopedResource<Object> scopedResource = pool.acquire();

        scopedResource.close();
        scopedResource.close();

        assertTrue(scopedResource.isReleased());
        assertThrows(IllegalStateException.class, scopedResource::get);
        assertEquals(1, pool.getStatistics().getTotalReleased());
    }

    @Test
    void testDoubleRelease() throws Exception {
        final Object pooledResource = new Object();
        when(resourceLifecycleManager.create()).thenReturn(pooledResource);

        pool.acquire();
        pool.release(pooledResource);

        assertThrows(IllegalStateException.class, () -> pool.release(pooledResource));
    }

    @Test
    void testReleaseForeignResource() {
        assertThrows(IllegalStateException.class, () -> pool.release(new Object()));
    }

    @Test
    void testInvalidIdleResourceIsReplaced() throws Exception {
        final Object staleResource = new Object();
        final Object freshResource = new Object();

        when(resourceLifecycleManager.create())
                .thenReturn(staleResource)
                .thenReturn(freshResource);

        pool.acquire().close();

        when(resourceLifecycleManager.validate(staleResource)).thenReturn(false);

        try (final ScopedResource<Object> scopedResource = pool.acquire()) {
            assertSame(freshResource, scopedResource.get());
        }

        verify(resourceLifecycleManager).destroy(staleResource);
        verify(resourceLifecycleManager, times(2)).create();
    }

    @Test
    void testValidationFailureIsTreatedAsInvalid() throws Exception {
        final Object staleResource = new Object();
        final Object freshResource = new Object();

        when(resourceLifecycleManager.create())
                .thenReturn(staleResource)
                .thenReturn(freshResource);

        pool.acquire().close();

        when(resourceLifecycleManager.validate(staleResource)).thenThrow(new IllegalStateException("Channel closed"));

        try (final ScopedResource<Object> scopedResource = pool.acquire(1, TimeUnit.SECONDS)) {
            assertSame(freshResource, scopedResource.get());
        }

        verify(resourceLifecycleManager).destroy(staleResource);
        verify(resourceLifecycleManager, times(2)).create();
        assertEquals(1, pool.getStatistics().getLiveCount());
    }

    @Test
    void testSkipValidation() throws Exception {
        replacePool(new DefaultResourcePool<>(resourceLifecycleManager, ResourcePoolConfiguration.builder()
                .maxSize(1)
                .validateOnAcquire(false)
                .build()));

        final Object pooledResource = new Object();
        when(resourceLifecycleManager.create()).thenReturn(pooledResource);
        when(resourceLifecycleManager.validate(pooledResource)).thenReturn(false);

        pool.acquire().close();

        try (final ScopedResource<Object> scopedResource = pool.acquire()) {
            assertSame(pooledResource, scopedResource.get());
        }

        verify(resourceLifecycleManager, never()).validate(any());
    }

    @Test
    void testAcquireTimeout() throws Exception {
        when(resourceLifecycleManager.create()).thenReturn(new Object());

        pool.acquire();

        final long start = System.nanoTime();
        assertThrows(PoolTimeoutException.class, () -> pool.acquire(100, TimeUnit.MILLISECONDS));

        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    void testAcquireDefaultTimeout() throws Exception {
        replacePool(new DefaultResourcePool<>(resourceLifecycleManager, ResourcePoolConfiguration.builder()
                .maxSize(1)
                .maxWaitMillis(100)
                .build()));

        when(resourceLifecycleManager.create()).thenReturn(new Object());

        pool.acquire();
        assertThrows(PoolTimeoutException.class, () -> pool.acquire());
    }

    @Test
    void testAcquireFromClosedPool() {
        pool.close();

        assertThrows(PoolClosedException.class, () -> pool.acquire());
        assertThrows(PoolClosedException.class, () -> pool.acquire(1, TimeUnit.SECONDS));
    }

    @Test
    void testCloseDestroysIdleResources() throws Exception {
        replacePool(new DefaultResourcePool<>(resourceLifecycleManager, 2));

        final Object idleResource = new Object();
        final Object resourceInUse = new Object();

        when(resourceLifecycleManager.create())
                .thenReturn(idleResource)
                .thenReturn(resourceInUse);

        final ScopedResource<Object> scopedIdleResource = pool.acquire();
        final ScopedResource<Object> scopedResourceInUse = pool.acquire();

        scopedIdleResource.close();

        pool.close();

        verify(resourceLifecycleManager).destroy(idleResource);
        verify(resourceLifecycleManager, never()).destroy(resourceInUse);

        scopedResourceInUse.close();

        verify(resourceLifecycleManager).destroy(resourceInUse);
        assertEquals(0, pool.getStatistics().getLiveCount());
        assertEquals(2, pool.getStatistics().getTotalDestroyed());
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        final Object pooledResource = new Object();
        when(resourceLifecycleManager.create()).thenReturn(pooledResource);

        pool.acquire().close();

        pool.close();
        pool.close();

        verify(resourceLifecycleManager, times(1)).destroy(pooledResource);
    }

    @Test
    void testPendingAcquisitionsDuringPoolClosure() throws Exception {
        when(resourceLifecycleManager.create()).thenReturn(new Object());

        pool.acquire();

        final Future<ScopedResource<Object>> pendingFuture = executorService.submit(() -> pool.acquire());
        assertThrows(TimeoutException.class, () -> pendingFuture.get(200, TimeUnit.MILLISECONDS));

        pool.close();

        final ExecutionException executionException =
                assertThrows(ExecutionException.class, () -> pendingFuture.get(5, TimeUnit.SECONDS));

        assertTrue(executionException.getCause() instanceof PoolClosedException);
    }

    @Test
    void testDestroyFailureOnRelease() throws Exception {
        final Object pooledResource = new Object();
        final IOException destroyFailure = new IOException("Broken pipe");

        when(resourceLifecycleManager.create()).thenReturn(pooledResource);
        doThrow(destroyFailure).when(resourceLifecycleManager).destroy(pooledResource);

        pool.acquire();

        final ResourcePoolException exception =
                assertThrows(ResourcePoolException.class, () -> pool.release(pooledResource, false));

        assertSame(destroyFailure, exception.getCause());
        assertEquals(0, pool.getStatistics().getLiveCount());
        assertEquals(0, pool.getStatistics().getTotalDestroyed());
    }

    @Test
    void testDestroyFailuresOnClose() throws Exception {
        replacePool(new DefaultResourcePool<>(resourceLifecycleManager, 2));

        final Object firstResource = new Object();
        final Object secondResource = new Object();

        when(resourceLifecycleManager.create())
                .thenReturn(firstResource)
                .thenReturn(secondResource);

        doThrow(new IOException()).when(resourceLifecycleManager).destroy(any());

        final ScopedResource<Object> firstScopedResource = pool.acquire();
        final ScopedResource<Object> secondScopedResource = pool.acquire();

        firstScopedResource.close();
        secondScopedResource.close();

        final ResourcePoolException exception = assertThrows(ResourcePoolException.class, () -> pool.close());
        assertEquals(1, exception.getSuppressed().length);

        verify(resourceLifecycleManager).destroy(firstResource);
        verify(resourceLifecycleManager).destroy(secondResource);
    }

    @Test
    void testInterruptedWhileWaiting() throws Exception {
        when(resourceLifecycleManager.create()).thenReturn(new Object());

        pool.acquire();

        final AtomicReference<ResourcePoolException> caughtException = new AtomicReference<>();
        final AtomicBoolean interruptFlagRestored = new AtomicBoolean(false);

        final Thread waitingThread = new Thread(() -> {
            try {
                pool.acquire();
            } catch (final ResourcePoolException e) {
                caughtException.set(e);
                interruptFlagRestored.set(Thread.currentThread().isInterrupted());
            }
        });

        waitingThread.start();
        waitingThread.interrupt();
        waitingThread.join(5000);

        assertNotNull(caughtException.get());
        assertTrue(caughtException.get().getCause() instanceof InterruptedException);
        assertTrue(interruptFlagRestored.get());
    }

    @Test
    void testConcurrentUseNeverExceedsMaxSize() throws Exception {
        final int maxSize = 3;
        final int threads = 16;
        final int iterations = 200;

        final AtomicInteger createdResources = new AtomicInteger();
        final AtomicInteger resourcesInUse = new AtomicInteger();
        final AtomicInteger maxResourcesInUse = new AtomicInteger();

        final DefaultResourcePool<Object> concurrentPool = new DefaultResourcePool<>(ResourceLifecycleManager.of(() -> {
            createdResources.incrementAndGet();
            return new Object();
        }, resource -> {}), maxSize);

        final CountDownLatch startLatch = new CountDownLatch(1);
        final List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            futures.add(executorService.submit(() -> {
                startLatch.await();

                for (int j = 0; j < iterations; j++) {
                    try (final ScopedResource<Object> ignored = concurrentPool.acquire(5, TimeUnit.SECONDS)) {
                        maxResourcesInUse.accumulateAndGet(resourcesInUse.incrementAndGet(), Math::max);
                        resourcesInUse.decrementAndGet();
                    }
                }

                return null;
            }));
        }

        startLatch.countDown();

        for (final Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        assertTrue(maxResourcesInUse.get() <= maxSize);
        assertTrue(createdResources.get() <= maxSize);
        assertEquals(threads * iterations, concurrentPool.getStatistics().getTotalAcquired());
        assertEquals(0, concurrentPool.getStatistics().getInUseCount());

        concurrentPool.close();
    }
}
