package io.github.drompincen.agentlink.runtime.queue;

import io.github.drompincen.agentlink.protocol.frame.Frame;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO hand-off between the transport callback that produces frames and the single loop that
 * consumes them. Frames are delivered in arrival order and never dropped; once closed, the
 * remaining frames are still delivered and {@link #next()} then reports the end of the stream.
 */
public class FrameQueue {

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private boolean closed;

    /** Appends a frame and wakes one waiting consumer. Ignored once the queue is closed. */
    public boolean push(Frame frame) {
        lock.lock();
        try {
            if (closed) return false;
            frames.addLast(frame);
            available.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a frame is available or the queue is closed and drained.
     *
     * @return the head frame, or empty when no more frames will arrive
     */
    public Optional<Frame> next() throws InterruptedException {
        lock.lock();
        try {
            while (frames.isEmpty() && !closed) {
                available.await();
            }
            return Optional.ofNullable(frames.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #next()} but gives up after the timeout. An empty result is ambiguous here;
     * check {@link #isDone()} to tell a timeout from the end of the stream.
     */
    public Optional<Frame> next(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (frames.isEmpty() && !closed) {
                if (nanos <= 0) return Optional.empty();
                nanos = available.awaitNanos(nanos);
            }
            return Optional.ofNullable(frames.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Frame> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(frames.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /** Marks the connection closed; waiting consumers are released once the queue drains. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            available.signalAll();
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

    public boolean isDone() {
        lock.lock();
        try {
            return closed && frames.isEmpty();
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
}
