package com.mosaic.enrichment;

import com.mosaic.model.Entry;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Runs an enrichment task over an entry stream with a fixed number of workers.
 *
 * <p>The returned stream contains every upstream entry exactly once and unchanged:
 * <ul>
 *   <li>entries rejected by the predicate are handed on immediately, no task runs,</li>
 *   <li>accepted entries are handed on after their task completed, possibly out of
 *       upstream order.</li>
 * </ul>
 *
 * <h3>Concurrency</h3>
 * <p>At most {@code concurrent} tasks are in flight. The upstream is only pulled while a
 * worker slot is free, so memory stays bounded by the number of workers regardless of the
 * stream length. The predicate is evaluated on the consuming thread right before each
 * dispatch. The worker pool is created on the first dispatch and shut down when the
 * stream is exhausted or closed.</p>
 */
@Slf4j
public class BoundedDispatcher implements EntryStage {

    private final String name;
    private final Predicate<Entry> predicate;
    private final Function<Entry, EnrichmentOutcome> task;
    private final int concurrent;
    private final EnrichmentReport report;

    public BoundedDispatcher(String name, Predicate<Entry> predicate,
                             Function<Entry, EnrichmentOutcome> task, int concurrent) {
        if (concurrent <= 0) {
            throw new IllegalArgumentException("concurrent must be positive for " + name + ": " + concurrent);
        }
        this.name = name;
        this.predicate = predicate;
        this.task = task;
        this.concurrent = concurrent;
        this.report = new EnrichmentReport(name);
    }

    @Override
    public Stream<Entry> apply(Stream<Entry> entries) {
        DispatchIterator iterator = new DispatchIterator(entries.iterator());
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.NONNULL), false)
                .onClose(iterator::close)
                .onClose(entries::close);
    }

    public EnrichmentReport getReport() {
        return report;
    }

    public String getName() {
        return name;
    }

    public int getConcurrent() {
        return concurrent;
    }

    @Override
    public String toString() {
        return "BoundedDispatcher[" + name + ", concurrent=" + concurrent + "]";
    }

    private Entry execute(Entry entry) {
        EnrichmentOutcome outcome;
        try {
            outcome = task.apply(entry);
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing {} of {}", name, entry, e);
            outcome = EnrichmentOutcome.UNEXPECTED_ERROR;
        }
        report.record(outcome);
        return entry;
    }

    // ── Pull-based dispatch ──────────────────────────────────────────────

    private final class DispatchIterator implements Iterator<Entry> {

        private final Iterator<Entry> upstream;
        private ExecutorService executor;
        private CompletionService<Entry> completions;
        private int inFlight;
        private Entry next;
        private boolean finished;

        DispatchIterator(Iterator<Entry> upstream) {
            this.upstream = upstream;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            next = advance();
            if (next == null) {
                finish();
                return false;
            }
            return true;
        }

        @Override
        public Entry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Entry entry = next;
            next = null;
            return entry;
        }

        /** Returns the next entry to emit, or {@code null} when upstream and workers are drained. */
        private Entry advance() {
            while (true) {
                if (inFlight > 0) {
                    Future<Entry> done = completions.poll();
                    if (done != null) {
                        inFlight--;
                        return await(done);
                    }
                }
                if (inFlight < concurrent && upstream.hasNext()) {
                    Entry entry = upstream.next();
                    if (!predicate.test(entry)) {
                        report.recordPassedThrough();
                        return entry;
                    }
                    submit(entry);
                    continue;
                }
                if (inFlight > 0) {
                    Future<Entry> done = take();
                    inFlight--;
                    return await(done);
                }
                return null;
            }
        }

        private void submit(Entry entry) {
            if (executor == null) {
                executor = Executors.newFixedThreadPool(concurrent, workerThreadFactory());
                completions = new ExecutorCompletionService<>(executor);
            }
            completions.submit(() -> execute(entry));
            inFlight++;
        }

        private Future<Entry> take() {
            try {
                return completions.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new IllegalStateException("Interrupted while waiting for " + name + " tasks", e);
            }
        }

        private Entry await(Future<Entry> done) {
            try {
                return done.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new IllegalStateException("Interrupted while waiting for " + name + " tasks", e);
            } catch (ExecutionException e) {
                // execute() catches runtime exceptions, so only errors end up here
                close();
                throw new IllegalStateException("Task of " + name + " failed", e.getCause());
            }
        }

        private void finish() {
            finished = true;
            if (executor != null) {
                executor.shutdown();
            }
            log.info("Finished {}", report);
        }

        void close() {
            if (!finished) {
                finished = true;
                if (executor != null) {
                    executor.shutdownNow();
                }
                log.debug("Closed {} with {} tasks in flight", name, inFlight);
            }
        }

        private ThreadFactory workerThreadFactory() {
            String prefix = "mosaic-" + name.replaceAll("[^A-Za-z0-9]+", "-") + "-";
            AtomicInteger counter = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, prefix + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
