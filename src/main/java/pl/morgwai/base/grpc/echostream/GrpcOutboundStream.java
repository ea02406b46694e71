// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;



/**
 * {@link OutboundStream} backed by a server method's response observer.
 * <p>
 * {@link #send(Object)} respects flow-control: it blocks while the response observer is not
 * {@link ServerCallStreamObserver#isReady() ready}, until its
 * {@link ServerCallStreamObserver#setOnReadyHandler(Runnable) onReadyHandler} fires, the call is
 * cancelled or {@code cancellationSignal} is raised. Nothing is written once the signal is
 * raised.<br/>
 * The response observer's {@link ServerCallStreamObserver#setOnCancelHandler(Runnable)
 * onCancelHandler} raises {@code cancellationSignal}.</p>
 * <p>
 * Must be constructed within the server method invocation (before it returns), as handlers may
 * not be set afterwards and the call's {@link Context} is captured.</p>
 */
public class GrpcOutboundStream<OutboundT> implements OutboundStream<OutboundT> {



	final ServerCallStreamObserver<OutboundT> responseObserver;
	final CancellationSignal cancellationSignal;
	final Context callContext;
	final long pollIntervalNanos;

	final ReentrantLock lock = new ReentrantLock();
	/** Signaled on readiness, inbound arrivals, cancellation. */
	final Condition changed = lock.newCondition();

	volatile boolean cancelled = false;



	public GrpcOutboundStream(
		StreamObserver<OutboundT> basicResponseObserver,
		CancellationSignal cancellationSignal,
		long pollInterval,
		TimeUnit unit
	) {
		this.responseObserver = (ServerCallStreamObserver<OutboundT>) basicResponseObserver;
		this.cancellationSignal = cancellationSignal;
		this.pollIntervalNanos = unit.toNanos(pollInterval);
		callContext = Context.current();
		responseObserver.setOnReadyHandler(this::wakeUpWaiters);
		responseObserver.setOnCancelHandler(this::onCancel);
		cancellationSignal.addListener(this::wakeUpWaiters);
	}



	/**
	 * response observer's onCancelHandler.
	 */
	void onCancel() {
		cancelled = true;
		log.fine("peer cancelled the call");
		cancellationSignal.raise();
		wakeUpWaiters();
	}



	@Override
	public boolean isActive() {
		return !cancelled && !responseObserver.isCancelled() && !callContext.isCancelled();
	}



	@Override
	public void send(OutboundT message) throws StatusException, InterruptedException {
		lock.lockInterruptibly();
		try {
			while ( !responseObserver.isReady() && isActive() && !cancellationSignal.isRaised()) {
				changed.awaitNanos(pollIntervalNanos);
			}
		} finally {
			lock.unlock();
		}
		if ( !isActive()) throw Status.CANCELLED.withDescription("peer disconnected").asException();
		if (cancellationSignal.isRaised()) {
			throw Status.CANCELLED
				.withDescription("call cancelled before sending")
				.withCause(cancellationSignal.getCause().orElse(null))
				.asException();
		}
		try {
			responseObserver.onNext(message);
		} catch (StatusRuntimeException e) {
			throw new StatusException(e.getStatus(), e.getTrailers());
		}
	}



	@Override
	public void complete() {
		try {
			responseObserver.onCompleted();
		} catch (StatusRuntimeException e) {
			if (log.isLoggable(Level.FINE)) log.fine("could not complete the call: " + e);
		}
	}



	@Override
	public void abort(Status status) {
		try {
			responseObserver.onError(status.asException());
		} catch (StatusRuntimeException e) {
			if (log.isLoggable(Level.FINE)) log.fine("could not abort the call: " + e);
		}
	}



	void wakeUpWaiters() {
		lock.lock();
		try {
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}



	static final Logger log = Logger.getLogger(GrpcOutboundStream.class.getName());
}
