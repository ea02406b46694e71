// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;



/**
 * {@link DuplexStream} of a client-streaming or bi-di server method. Instances are returned to
 * gRPC as the method's request observer:
 * <pre>
 * public StreamObserver&lt;Request&gt; myBiDiMethod(StreamObserver&lt;Response&gt; responseObserver) {
 *     final var session = new StreamSession("myBiDiMethod");
 *     final var stream = new GrpcDuplexStream&lt;Request, Response&gt;(
 *             responseObserver, session.getCancellationSignal(), 100L, TimeUnit.MILLISECONDS);
 *     workerPool.execute(new SyncBidiEcho&lt;&gt;(session, stream, this::echo));
 *     return stream;
 * }</pre>
 * <p>
 * Automatic inbound flow-control is disabled: exactly 1 message is
 * {@link ServerCallStreamObserver#request(int) requested} whenever {@link #receive()} finds no
 * message already delivered, so the peer may not send faster than the messages are received.</p>
 */
public class GrpcDuplexStream<InboundT, OutboundT> extends GrpcOutboundStream<OutboundT>
		implements DuplexStream<InboundT, OutboundT>, StreamObserver<InboundT> {



	final ArrayDeque<InboundT> delivered = new ArrayDeque<>(2);
	boolean messageRequested = false;
	boolean halfClosed = false;
	Throwable inboundError;



	public GrpcDuplexStream(
		StreamObserver<OutboundT> basicResponseObserver,
		CancellationSignal cancellationSignal,
		long pollInterval,
		TimeUnit unit
	) {
		super(basicResponseObserver, cancellationSignal, pollInterval, unit);
		responseObserver.disableAutoRequest();
	}



	@Override
	public Envelope<InboundT> receive() throws StatusException, InterruptedException {
		lock.lockInterruptibly();
		try {
			while (true) {
				if (cancellationSignal.isRaised() || !isActive()) return Envelope.cancelled();
				final var message = delivered.pollFirst();
				if (message != null) return Envelope.of(message);
				if (inboundError != null) {
					throw Status.fromThrowable(inboundError)
							.asException(Status.trailersFromThrowable(inboundError));
				}
				if (halfClosed) return Envelope.endOfStream();
				if ( !messageRequested) {
					messageRequested = true;
					responseObserver.request(1);
				}
				changed.awaitNanos(pollIntervalNanos);
			}
		} finally {
			lock.unlock();
		}
	}



	@Override
	public void onNext(InboundT message) {
		lock.lock();
		try {
			delivered.addLast(message);
			messageRequested = false;
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}



	@Override
	public void onCompleted() {
		lock.lock();
		try {
			halfClosed = true;
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}



	@Override
	public void onError(Throwable error) {
		lock.lock();
		try {
			inboundError = error;
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}
}
