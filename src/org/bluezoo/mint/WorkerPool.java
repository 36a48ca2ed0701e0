/*
 * WorkerPool.java
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

import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed set of worker threads executing tasks from a shared FIFO queue.
 *
 * <p>Each submitted task is dequeued by exactly one worker and run to
 * completion on that worker's thread, outside the queue lock. Tasks are
 * started in submission order, but tasks on different workers run
 * concurrently, so completion order is not defined.
 *
 * <p>Tasks are expected to handle their own failures. The pool has no
 * way to report a failed task to whoever submitted it: a runtime
 * exception escaping a task is logged and the worker carries on with
 * the next task.
 *
 * <p>{@link #shutdown} stops the pool accepting new tasks and wakes the
 * workers. Workers drain whatever is still queued before they exit, so
 * {@link #close} returns only once every submitted task has run.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WorkerPool.class.getName());

    private final Deque<Runnable> queue;
    private final Lock lock;
    private final Condition condition;
    private final Worker[] workers;
    private boolean running;

    /**
     * Creates a pool with one worker per available processor.
     */
    public WorkerPool() {
        this(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates a pool and starts its workers.
     *
     * @param workerCount the number of worker threads
     * @throws IllegalArgumentException if workerCount is less than 1
     */
    public WorkerPool(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        this.queue = new ArrayDeque<>();
        this.lock = new ReentrantLock();
        this.condition = lock.newCondition();
        this.running = true;

        // 1-based naming for humans
        this.workers = new Worker[workerCount];
        for (int i = 0; i < workerCount; i++) {
            workers[i] = new Worker(i + 1);
        }
        for (Worker worker : workers) {
            worker.start();
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            String message = Mint.L10N.getString("info.started_workers");
            message = MessageFormat.format(message, workerCount);
            LOGGER.fine(message);
        }
    }

    /**
     * Returns the number of worker threads in this pool.
     */
    public int getWorkerCount() {
        return workers.length;
    }

    /**
     * Returns the number of tasks waiting for a worker.
     */
    public int getQueueSize() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues a task for execution and returns immediately.
     *
     * @param task the task to run
     * @throws IllegalStateException if the pool has been shut down
     */
    public void submit(Runnable task) {
        if (task == null) {
            throw new NullPointerException("task");
        }
        lock.lock();
        try {
            if (!running) {
                throw new IllegalStateException(Mint.L10N.getString("err.pool_shutdown"));
            }
            queue.addLast(task);
            condition.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting new tasks and wakes every worker.
     * Tasks already queued will still be run.
     */
    public void shutdown() {
        lock.lock();
        try {
            running = false;
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for all worker threads to exit.
     * Only returns once {@link #shutdown} has been called and the queue
     * has drained.
     */
    public void join() throws InterruptedException {
        for (Worker worker : workers) {
            worker.join();
        }
    }

    /**
     * Shuts down the pool and waits for every queued and in-flight task
     * to finish.
     */
    @Override
    public void close() {
        shutdown();
        try {
            join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Blocks until a task is available.
     *
     * @return the next task, or null if the pool is shut down and drained
     */
    private Runnable take() throws InterruptedException {
        lock.lock();
        try {
            while (running && queue.isEmpty()) {
                condition.await();
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    private class Worker extends Thread {

        Worker(int index) {
            super("Worker-" + index);
        }

        @Override
        public void run() {
            while (true) {
                Runnable task;
                try {
                    task = take();
                } catch (InterruptedException e) {
                    // Only shutdown ends a worker
                    continue;
                }
                if (task == null) {
                    break;
                }
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOGGER.log(Level.SEVERE, Mint.L10N.getString("err.task_failed"), e);
                }
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(getName() + " exited");
            }
        }
    }

}
