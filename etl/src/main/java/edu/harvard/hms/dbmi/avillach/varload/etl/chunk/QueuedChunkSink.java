package edu.harvard.hms.dbmi.avillach.varload.etl.chunk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Runs a delegate sink on its own writer thread, fed through a queue that holds one chunk.
 *
 * Parsing and normalizing the next chunk overlaps with writing the previous one, while chunks still
 * reach the delegate in arrival order. Anything thrown on the writer thread, errors included, is
 * rethrown to the producer on its next {@link #accept} or on {@link #close}.
 */
public class QueuedChunkSink implements ChunkSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueuedChunkSink.class);

    private static final Chunk END_OF_INPUT = new Chunk(-1, List.of());

    private final ChunkSink delegate;
    private final BlockingQueue<Chunk> queue = new ArrayBlockingQueue<>(1);
    private final Thread writerThread;
    private volatile Throwable failure;
    private boolean closed = false;

    public QueuedChunkSink(ChunkSink delegate) {
        this.delegate = delegate;
        this.writerThread = new Thread(this::drain, "chunk-writer");
        this.writerThread.setDaemon(true);
        this.writerThread.start();
    }

    private void drain() {
        try {
            while (true) {
                Chunk chunk = queue.take();
                if (chunk == END_OF_INPUT) {
                    return;
                }
                delegate.accept(chunk);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } catch (Throwable e) {
            log.error("Chunk writer failed", e);
            failure = e;
            // unblock a producer waiting on a full queue
            queue.clear();
        }
    }

    @Override
    public void accept(Chunk chunk) throws IOException {
        rethrowFailure();
        try {
            while (!queue.offer(chunk, 100, TimeUnit.MILLISECONDS)) {
                rethrowFailure();
                if (!writerThread.isAlive()) {
                    throw new IOException("Chunk writer thread stopped");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while handing off chunk " + chunk.index());
        }
    }

    private void rethrowFailure() throws IOException {
        Throwable t = failure;
        if (t == null) {
            return;
        }
        if (t instanceof IOException io) {
            throw io;
        }
        if (t instanceof RuntimeException re) {
            throw re;
        }
        if (t instanceof Error error) {
            throw error;
        }
        throw new IOException("Chunk writer failed", t);
    }

    /**
     * Waits for every queued chunk to be written, then stops the writer thread.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (writerThread.isAlive() && failure == null) {
                while (!queue.offer(END_OF_INPUT, 100, TimeUnit.MILLISECONDS)) {
                    if (!writerThread.isAlive() || failure != null) {
                        break;
                    }
                }
            }
            writerThread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writerThread.interrupt();
            throw new InterruptedIOException("Interrupted while waiting for chunk writer");
        }
        rethrowFailure();
    }
}
