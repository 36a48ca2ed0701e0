/*
 * WorkerPoolTest.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of mint, a minimal file-serving HTTP responder.
 *
 * mint is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * mint is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with mint.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.mint;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Unit tests for {@link WorkerPool}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class WorkerPoolTest {

    private WorkerPool pool;

    @Before
    public void setUp() {
        Logger.getLogger(WorkerPool.class.getName()).setLevel(Level.OFF);
        pool = new WorkerPool(4);
    }

    @After
    public void tearDown() {
        pool.close();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroWorkers() {
        new WorkerPool(0);
    }

    @Test
    public void testWorkerCount() {
        assertEquals(4, pool.getWorkerCount());
        WorkerPool defaultPool = new WorkerPool();
        try {
            assertEquals(Runtime.getRuntime().availableProcessors(), defaultPool.getWorkerCount());
        } finally {
            defaultPool.close();
        }
    }

    @Test
    public void testEachTaskRunsExactlyOnce() throws Exception {
        final int taskCount = 1000;
        final AtomicIntegerArray runs = new AtomicIntegerArray(taskCount);
        final CountDownLatch done = new CountDownLatch(taskCount);
        for (int i = 0; i < taskCount; i++) {
            final int index = i;
            pool.submit(new Runnable() {
                @Override
                public void run() {
                    runs.incrementAndGet(index);
                    done.countDown();
                }
            });
        }
        assertTrue("Tasks did not complete", done.await(10, TimeUnit.SECONDS));
        pool.close();
        for (int i = 0; i < taskCount; i++) {
            assertEquals("Task " + i, 1, runs.get(i));
        }
    }

    @Test
    public void testTasksRunOnWorkerThreads() throws Exception {
        final Set<String> names = Collections.synchronizedSet(new HashSet<String>());
        final CountDownLatch done = new CountDownLatch(50);
        for (int i = 0; i < 50; i++) {
            pool.submit(new Runnable() {
                @Override
                public void run() {
                    names.add(Thread.currentThread().getName());
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertFalse(names.isEmpty());
        for (String name : names) {
            assertTrue(name, name.matches("Worker-[1-4]"));
        }
    }

    @Test
    public void testTasksRunConcurrently() throws Exception {
        // Every worker must be inside a task at once for the barrier to open
        final CountDownLatch arrived = new CountDownLatch(4);
        final CountDownLatch release = new CountDownLatch(1);
        for (int i = 0; i < 4; i++) {
            pool.submit(new Runnable() {
                @Override
                public void run() {
                    arrived.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });
        }
        assertTrue("Workers did not run in parallel", arrived.await(10, TimeUnit.SECONDS));
        release.countDown();
    }

    @Test
    public void testFailingTaskDoesNotKillWorker() throws Exception {
        WorkerPool single = new WorkerPool(1);
        try {
            final CountDownLatch done = new CountDownLatch(1);
            single.submit(new Runnable() {
                @Override
                public void run() {
                    throw new IllegalStateException("boom");
                }
            });
            single.submit(new Runnable() {
                @Override
                public void run() {
                    done.countDown();
                }
            });
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            single.close();
        }
    }

    @Test
    public void testShutdownDrainsQueue() throws Exception {
        WorkerPool single = new WorkerPool(1);
        final CountDownLatch blocker = new CountDownLatch(1);
        final AtomicInteger count = new AtomicInteger();
        single.submit(new Runnable() {
            @Override
            public void run() {
                try {
                    blocker.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        for (int i = 0; i < 10; i++) {
            single.submit(new Runnable() {
                @Override
                public void run() {
                    count.incrementAndGet();
                }
            });
        }
        single.shutdown();
        blocker.countDown();
        single.join();
        assertEquals(10, count.get());
        assertEquals(0, single.getQueueSize());
    }

    @Test
    public void testSubmitAfterShutdown() {
        pool.shutdown();
        try {
            pool.submit(new Runnable() {
                @Override
                public void run() {
                }
            });
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test(expected = NullPointerException.class)
    public void testSubmitNull() {
        pool.submit(null);
    }

}
