package com.ybds.transport.ws;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, closable per-client frame buffer between publishers and the client's write loop.
 *
 * Producers never block: {@link #offer} fails when the queue is full or closed.
 * The single consumer drains everything queued at wake-up in one call. Closing
 * discards pending frames and wakes the consumer.
 */
public final class OutboundQueue {

    private final int capacity;
    private final ArrayDeque<byte[]> frames;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public OutboundQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.frames = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Enqueue without blocking.
     *
     * @return false if the queue is full or closed
     */
    public boolean offer(byte[] frame) {
        lock.lock();
        try {
            if (closed || frames.size() >= capacity) {
                return false;
            }
            frames.addLast(frame);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to the timeout for frames and take all of them.
     *
     * @return the drained frames in submission order, an empty list on timeout,
     *         or null once the queue is closed
     */
    public List<byte[]> pollAll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!closed && frames.isEmpty()) {
                if (nanos <= 0L) {
                    return List.of();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            if (closed) {
                return null;
            }
            List<byte[]> batch = new ArrayList<>(frames);
            frames.clear();
            return batch;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the queue. Pending frames are dropped.
     *
     * @return true on the first call only
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            frames.clear();
            notEmpty.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return frames.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
