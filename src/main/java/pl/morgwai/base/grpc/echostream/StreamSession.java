// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static pl.morgwai.base.grpc.echostream.StreamSession.State.*;



/**
 * State of a single call, owned by its {@link StreamCallHandler}. Activities spawned by the handler
 * only observe the session: they may {@link #getCancellationSignal() raise the cancellation
 * signal}, {@link #markDraining() report end of input} and bump the counter they are responsible
 * for.
 * <p>
 * Lifecycle: {@code CREATED -> ACTIVE -> [DRAINING ->] CLOSED | CANCELLED | ERRORED}. Each session
 * is terminated exactly once: an attempt to terminate it again throws
 * {@link IllegalStateException}.</p>
 */
public class StreamSession {



	public enum State {

		CREATED,
		ACTIVE,

		/** End of input was observed, but some outbound work remains. */
		DRAINING,

		CLOSED,
		CANCELLED,
		ERRORED;

		public boolean isTerminal() {
			return this == CLOSED || this == CANCELLED || this == ERRORED;
		}
	}



	public String getCallLabel() { return callLabel; }
	final String callLabel;

	public CancellationSignal getCancellationSignal() { return cancellationSignal; }
	final CancellationSignal cancellationSignal;

	public State getState() { return state; }
	volatile State state = CREATED;

	/**
	 * Returns the error passed to {@link #fail(Throwable)} if the session ended as
	 * {@link State#ERRORED}.
	 */
	public Optional<Throwable> getError() { return Optional.ofNullable(error); }
	volatile Throwable error;

	public long getRequestCount() { return requestCount.get(); }
	public long incrementRequestCount() { return requestCount.incrementAndGet(); }
	final AtomicLong requestCount = new AtomicLong(0L);

	public long getResponseCount() { return responseCount.get(); }
	public long incrementResponseCount() { return responseCount.incrementAndGet(); }
	final AtomicLong responseCount = new AtomicLong(0L);

	final CountDownLatch terminationLatch = new CountDownLatch(1);
	final long createdNanos = System.nanoTime();



	public StreamSession(String callLabel) {
		this(callLabel, new CancellationSignal());
	}

	public StreamSession(String callLabel, CancellationSignal cancellationSignal) {
		this.callLabel = callLabel;
		this.cancellationSignal = cancellationSignal;
	}



	/**
	 * {@code true} if the session has been activated, has not been terminated and its cancellation
	 * signal has not been raised.
	 */
	public boolean isActive() {
		final var currentState = state;
		return (currentState == ACTIVE || currentState == DRAINING)
				&& !cancellationSignal.isRaised();
	}



	/**
	 * Switches from {@code CREATED} to {@code ACTIVE}.
	 * @throws IllegalStateException if the session has already been activated.
	 */
	public synchronized void activate() {
		if (state != CREATED) throw new IllegalStateException(callLabel + " is already " + state);
		state = ACTIVE;
	}



	/**
	 * Switches from {@code ACTIVE} to {@code DRAINING}. Has no effect in other states.
	 * @return {@code true} if the state was switched.
	 */
	public synchronized boolean markDraining() {
		if (state != ACTIVE) return false;
		state = DRAINING;
		return true;
	}



	public void close() { terminate(CLOSED, null); }

	public void cancel() { terminate(CANCELLED, null); }

	public void fail(Throwable error) { terminate(ERRORED, error); }

	synchronized void terminate(State terminalState, Throwable error) {
		if (state.isTerminal()) {
			throw new IllegalStateException(
					callLabel + " already terminated as " + state + ", attempted " + terminalState);
		}
		this.error = error;
		state = terminalState;
		terminationLatch.countDown();
	}



	public boolean isTerminated() {
		return state.isTerminal();
	}



	/**
	 * Awaits up to {@code timeout} of {@code unit} for this session to be terminated.
	 * @return {@code true} if the session is terminated, {@code false} if the timeout passed.
	 */
	public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
		return terminationLatch.await(timeout, unit);
	}



	public long getAgeMillis() {
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - createdNanos);
	}



	@Override
	public String toString() {
		return callLabel + '(' + state + ", requests=" + requestCount.get()
				+ ", responses=" + responseCount.get() + ')';
	}
}
