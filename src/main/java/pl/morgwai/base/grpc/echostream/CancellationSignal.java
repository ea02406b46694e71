// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;



/**
 * One-way flag shared by all activities of a single call. Once {@link #raise(Throwable) raised},
 * it stays raised: subsequent calls to {@code raise(...)} have no effect and the cause passed to the
 * first one is retained.
 * <p>
 * Activities blocked on some hand-off point may register a {@link #addListener(Runnable) listener}
 * to be woken up immediately rather than waiting for their next poll.</p>
 */
public class CancellationSignal {



	final CountDownLatch latch = new CountDownLatch(1);
	final AtomicReference<Throwable> cause = new AtomicReference<>();
	final List<Runnable> listeners = new CopyOnWriteArrayList<>();



	/**
	 * Raises this signal without any cause, which is interpreted as a plain cancellation (peer
	 * gone, call context no longer active).
	 * @return {@code true} if this invocation raised the signal, {@code false} if it had already
	 *     been raised.
	 */
	public boolean raise() {
		return raise(null);
	}



	/**
	 * Raises this signal recording {@code cause} as the reason if this is the first invocation.
	 * Registered listeners are run synchronously by the thread that raised the signal.
	 * @return {@code true} if this invocation raised the signal, {@code false} if it had already
	 *     been raised.
	 */
	public boolean raise(Throwable cause) {
		synchronized (latch) {
			if (latch.getCount() == 0) return false;
			this.cause.set(cause);
			latch.countDown();
		}
		if (log.isLoggable(Level.FINE)) log.fine("cancellation signal raised, cause: " + cause);
		for (var listener: listeners) runListener(listener);
		return true;
	}



	public boolean isRaised() {
		return latch.getCount() == 0;
	}



	/**
	 * Returns the cause passed to the first {@link #raise(Throwable)} call or {@code empty} if the
	 * signal has not been raised or was raised without a cause.
	 */
	public Optional<Throwable> getCause() {
		return Optional.ofNullable(cause.get());
	}



	/**
	 * Registers {@code listener} to be run when this signal is raised. If the signal has already
	 * been raised, {@code listener} is run immediately by the calling thread.
	 */
	public void addListener(Runnable listener) {
		synchronized (latch) {
			if (latch.getCount() > 0) {
				listeners.add(listener);
				return;
			}
		}
		runListener(listener);
	}



	/**
	 * Waits up to {@code timeout} of {@code unit} for this signal to be raised. Used by activities
	 * to pace themselves without delaying cancellation.
	 * @return {@code true} if the signal is raised, {@code false} if the timeout passed.
	 */
	public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
		return latch.await(timeout, unit);
	}



	void runListener(Runnable listener) {
		try {
			listener.run();
		} catch (RuntimeException e) {
			log.log(Level.WARNING, "cancellation listener failed", e);
		}
	}



	@Override
	public String toString() {
		return "CancellationSignal(raised=" + isRaised() + ", cause=" + cause.get() + ')';
	}



	static final Logger log = Logger.getLogger(CancellationSignal.class.getName());
}
