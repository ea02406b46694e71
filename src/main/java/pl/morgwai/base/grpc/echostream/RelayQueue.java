// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;



/**
 * Fixed-capacity FIFO hand-off between exactly 1 producer and 1 consumer running in different
 * threads.
 * <p>
 * The producer {@link #put(Object) puts} messages and finally marks the end of its stream with
 * {@link #putEndOfStream()}. The consumer {@link #take() takes} {@link Envelope}s until it gets one
 * that is not a {@link Envelope.Kind#MESSAGE message}.</p>
 * <p>
 * At most {@code capacity} messages are held at any time: {@link #put(Object)} blocks while the
 * queue is full, which slows the producer down to the consumer's pace. The end-of-stream marker does
 * not count towards the capacity and never blocks.</p>
 * <p>
 * Both {@code put} and {@code take} give up once {@code stopSignal} is raised, so that neither
 * side stays blocked after its counterpart died. Waiting threads are woken up as soon as the signal
 * is raised and additionally re-check it every {@code pollInterval}.</p>
 */
public class RelayQueue<MessageT> {



	final String label;
	final int capacity;
	final long pollIntervalNanos;
	final CancellationSignal stopSignal;

	final ArrayDeque<MessageT> messages;
	boolean endOfStreamEnqueued = false;
	int highWaterMark = 0;

	final ReentrantLock lock = new ReentrantLock();
	final Condition notFull = lock.newCondition();
	final Condition notEmpty = lock.newCondition();



	/**
	 * @param label used in log and exception messages.
	 * @param capacity maximum number of messages held at once.
	 * @param stopSignal signal that makes blocked {@code put} and {@code take} calls give up.
	 * @param pollInterval upper bound of how long a blocked call waits before re-checking
	 *     {@code stopSignal}.
	 */
	public RelayQueue(
		String label,
		int capacity,
		CancellationSignal stopSignal,
		long pollInterval,
		TimeUnit unit
	) {
		if (capacity < 1) throw new IllegalArgumentException("capacity must be positive");
		if (pollInterval < 1L) throw new IllegalArgumentException("pollInterval must be positive");
		this.label = label;
		this.capacity = capacity;
		this.stopSignal = stopSignal;
		this.pollIntervalNanos = unit.toNanos(pollInterval);
		messages = new ArrayDeque<>(capacity);
		stopSignal.addListener(this::wakeUpAll);
	}



	/**
	 * Appends {@code message} at the tail, blocking while the queue is full.
	 * @return {@code true} if {@code message} was enqueued, {@code false} if {@code stopSignal} was
	 *     raised before it could be: the message is then dropped.
	 * @throws IllegalStateException if {@link #putEndOfStream()} has already been called.
	 */
	public boolean put(MessageT message) throws InterruptedException {
		if (message == null) throw new NullPointerException("message");
		lock.lockInterruptibly();
		try {
			if (endOfStreamEnqueued) {
				throw new IllegalStateException(label + ": end-of-stream already enqueued");
			}
			while (messages.size() >= capacity) {
				if (stopSignal.isRaised()) return false;
				if (log.isLoggable(Level.FINEST)) log.finest(label + ": full, producer waits");
				notFull.awaitNanos(pollIntervalNanos);
			}
			if (stopSignal.isRaised()) return false;
			messages.addLast(message);
			if (messages.size() > highWaterMark) highWaterMark = messages.size();
			notEmpty.signal();
			return true;
		} finally {
			lock.unlock();
		}
	}



	/**
	 * Marks the end of the producer's stream. Never blocks: the marker is accepted even if the
	 * queue is full or {@code stopSignal} has been raised.
	 * @throws IllegalStateException if called more than once.
	 */
	public void putEndOfStream() {
		lock.lock();
		try {
			if (endOfStreamEnqueued) {
				throw new IllegalStateException(label + ": end-of-stream already enqueued");
			}
			endOfStreamEnqueued = true;
			notEmpty.signal();
		} finally {
			lock.unlock();
		}
	}



	/**
	 * Removes and returns the message at the head, blocking while the queue is empty.
	 * Once all messages have been taken and the end-of-stream marker is at the head,
	 * {@link Envelope#endOfStream()} is returned: the marker stays in place, so subsequent calls
	 * return it again.
	 * @return {@link Envelope#cancelled()} if {@code stopSignal} is raised, regardless of whether
	 *     any messages are still queued.
	 */
	public Envelope<MessageT> take() throws InterruptedException {
		lock.lockInterruptibly();
		try {
			while (true) {
				if (stopSignal.isRaised()) return Envelope.cancelled();
				final var message = messages.pollFirst();
				if (message != null) {
					notFull.signal();
					return Envelope.of(message);
				}
				if (endOfStreamEnqueued) return Envelope.endOfStream();
				notEmpty.awaitNanos(pollIntervalNanos);
			}
		} finally {
			lock.unlock();
		}
	}



	public int size() {
		lock.lock();
		try {
			return messages.size();
		} finally {
			lock.unlock();
		}
	}



	/**
	 * Returns the maximum number of messages that were held at the same time so far.
	 */
	public int getHighWaterMark() {
		lock.lock();
		try {
			return highWaterMark;
		} finally {
			lock.unlock();
		}
	}



	public boolean isEndOfStreamEnqueued() {
		lock.lock();
		try {
			return endOfStreamEnqueued;
		} finally {
			lock.unlock();
		}
	}



	public int getCapacity() { return capacity; }



	void wakeUpAll() {
		lock.lock();
		try {
			notFull.signalAll();
			notEmpty.signalAll();
		} finally {
			lock.unlock();
		}
	}



	@Override
	public String toString() {
		return label;
	}



	static final Logger log = Logger.getLogger(RelayQueue.class.getName());
}
