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
package com.tomaszrup.trillls;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.trillls.util.MdcDocumentContext;

/**
 * Thread pool management for the language server.
 *
 * <p>Completion and hover requests run on one shared <b>request pool</b>
 * sized to {@code max(2, availableProcessors)}. Document lifecycle
 * notifications do not use a pool; they run on the protocol listener
 * thread in arrival order.</p>
 *
 * <p>Lifecycle: create one instance in {@link TrillLanguageServer}, pass it
 * to {@link TrillServices}, and call {@link #shutdownAll()} on server
 * shutdown.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ExecutorService requestPool;

    public ExecutorPools() {
        this(Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    public ExecutorPools(int requestThreads) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService rawRequestPool = Executors.newFixedThreadPool(requestThreads, r -> {
            Thread t = new Thread(r, "trillls-request-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.requestPool = new MdcExecutorService(rawRequestPool);
        logger.debug("Request pool threads: {}", requestThreads);
    }

    /** Pool for completion and hover requests. */
    public ExecutorService getRequestPool() {
        return requestPool;
    }

    /**
     * Shut down all pools, waiting up to 5 seconds for running requests.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        requestPool.shutdownNow();
        try {
            requestPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -----------------------------------------------------------------------
    // MDC-propagating executor wrapper
    // -----------------------------------------------------------------------

    /**
     * Wraps an {@link ExecutorService} so that every submitted task
     * automatically inherits the caller thread's SLF4J MDC context.
     */
    private static class MdcExecutorService implements ExecutorService {
        private final ExecutorService delegate;

        MdcExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override public void execute(Runnable command) {
            delegate.execute(MdcDocumentContext.wrap(command));
        }

        @Override public Future<?> submit(Runnable task) {
            return delegate.submit(MdcDocumentContext.wrap(task));
        }

        @Override public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(MdcDocumentContext.wrap(task), result);
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

        private static <T> Callable<T> wrapCallable(Callable<T> task) {
            Map<String, String> ctx = MdcDocumentContext.snapshot();
            return () -> {
                Map<String, String> prev = MdcDocumentContext.snapshot();
                MdcDocumentContext.restore(ctx);
                try {
                    return task.call();
                } finally {
                    MdcDocumentContext.restore(prev);
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
}
