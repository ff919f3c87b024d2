////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspdaemon;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspdaemon.util.MdcProjectContext;

/**
 * Thread management for one invocation of the daemon layer.
 *
 * <ul>
 *   <li><b>Event loop</b>: a single-threaded scheduled executor shared by
 *       every {@link com.tomaszrup.lspdaemon.rpc.RpcClient}. Socket read
 *       completions, request timeouts and diagnostics polling all run here,
 *       so client state is confined to one thread and needs no locks.</li>
 *   <li><b>Relay pool</b>: cached pool for the proxy's accept loops and the
 *       worker stdout pumps. Process pipes only offer blocking streams, so
 *       each relay direction occupies a thread for its lifetime.</li>
 * </ul>
 *
 * <p>All threads are daemon threads. A hosting process keeps itself alive by
 * blocking on {@link DaemonManager#awaitHostedWorkers()}.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ScheduledExecutorService eventLoop;

    private final ExecutorService relayPool;

    public ExecutorPools() {
        ScheduledExecutorService rawEventLoop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lspdaemon-event-loop");
            t.setDaemon(true);
            return t;
        });
        this.eventLoop = new MdcScheduledExecutorService(rawEventLoop);

        AtomicInteger relayCounter = new AtomicInteger();
        ExecutorService rawRelayPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "lspdaemon-relay-" + relayCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.relayPool = new MdcExecutorService(rawRelayPool);
    }

    /** Single-threaded executor that owns all RPC client state. */
    public ScheduledExecutorService getEventLoop() {
        return eventLoop;
    }

    /** Pool for blocking relay loops (accept loop, worker stdout pump). */
    public ExecutorService getRelayPool() {
        return relayPool;
    }

    /**
     * Shut down both pools. Relay loops blocked in socket or pipe reads end
     * when their endpoint is closed; this only stops new work and waits
     * briefly for the event loop to drain.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        eventLoop.shutdownNow();
        relayPool.shutdownNow();
        try {
            eventLoop.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -----------------------------------------------------------------------
    // MDC-propagating executor wrappers
    // -----------------------------------------------------------------------

    /**
     * Wraps an {@link ExecutorService} so that every submitted task
     * inherits the caller thread's SLF4J MDC context.
     */
    private static class MdcExecutorService implements ExecutorService {
        protected final ExecutorService delegate;

        MdcExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override public void execute(Runnable command) {
            delegate.execute(MdcProjectContext.wrap(command));
        }

        @Override public Future<?> submit(Runnable task) {
            return delegate.submit(MdcProjectContext.wrap(task));
        }

        @Override public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(MdcProjectContext.wrap(task), result);
        }

        @Override public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrapCallable(task));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks)
                throws InterruptedException {
            return delegate.invokeAll(wrapCallables(tasks));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.invokeAll(wrapCallables(tasks), timeout, unit);
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapCallables(tasks));
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapCallables(tasks), timeout, unit);
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }

        static <T> Callable<T> wrapCallable(Callable<T> task) {
            Map<String, String> ctx = MdcProjectContext.snapshot();
            return () -> {
                Map<String, String> prev = MdcProjectContext.snapshot();
                MdcProjectContext.restore(ctx);
                try {
                    return task.call();
                } finally {
                    MdcProjectContext.restore(prev);
                }
            };
        }

        private static <T> Collection<Callable<T>> wrapCallables(Collection<? extends Callable<T>> tasks) {
            List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                wrapped.add(wrapCallable(task));
            }
            return wrapped;
        }
    }

    /**
     * Wraps a {@link ScheduledExecutorService} so that every scheduled task
     * inherits the caller thread's SLF4J MDC context.
     */
    private static class MdcScheduledExecutorService extends MdcExecutorService
            implements ScheduledExecutorService {
        private final ScheduledExecutorService scheduledDelegate;

        MdcScheduledExecutorService(ScheduledExecutorService delegate) {
            super(delegate);
            this.scheduledDelegate = delegate;
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(MdcProjectContext.wrap(command), delay, unit);
        }

        @Override
        public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(wrapCallable(callable), delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay,
                long period, TimeUnit unit) {
            return scheduledDelegate.scheduleAtFixedRate(
                    MdcProjectContext.wrap(command), initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay,
                long delay, TimeUnit unit) {
            return scheduledDelegate.scheduleWithFixedDelay(
                    MdcProjectContext.wrap(command), initialDelay, delay, unit);
        }
    }
}
