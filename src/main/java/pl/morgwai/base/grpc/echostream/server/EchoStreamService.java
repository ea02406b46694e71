// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream.server;

import java.util.List;
import java.util.concurrent.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import pl.morgwai.base.grpc.echostream.*;
import pl.morgwai.base.grpc.echostream.api.EchoRequest;
import pl.morgwai.base.grpc.echostream.api.EchoResponse;
import pl.morgwai.base.grpc.echostream.api.EchoServiceGrpc.EchoServiceImplBase;



/**
 * Implements {@code echo.stream.v1.EchoService}.
 * <p>
 * Each call is handled by a {@link StreamCallHandler} dispatched to {@code callExecutor}, so
 * gRPC's own executor never blocks on handler work.
 * {@link #echoBidirectionalStreamAsync(StreamObserver)} additionally runs its ingestion and
 * processing activities on {@code stageExecutor}.<br/>
 * At most {@link EchoStreamConfig#getMaxConcurrentCalls() maxConcurrentCalls} calls are admitted
 * at the same time: excess calls are rejected with {@link Status#RESOURCE_EXHAUSTED}.</p>
 */
public class EchoStreamService extends EchoServiceImplBase {



	final EchoStreamConfig config;
	final Executor callExecutor;
	final Executor stageExecutor;
	final Semaphore admissions;



	public EchoStreamService(
		EchoStreamConfig config,
		Executor callExecutor,
		Executor stageExecutor
	) {
		this.config = config;
		this.callExecutor = callExecutor;
		this.stageExecutor = stageExecutor;
		admissions = new Semaphore(config.getMaxConcurrentCalls());
	}



	@Override
	public StreamObserver<EchoRequest> echoClientStream(
			StreamObserver<EchoResponse> responseObserver) {
		final var session = new StreamSession("EchoClientStream");
		final var stream = newDuplexStream(responseObserver, session);
		dispatch(new ClientStreamAggregator<>(session, stream, EchoStreamService::summarize),
				stream);
		return stream;
	}



	@Override
	public void echoServerStream(
			EchoRequest request, StreamObserver<EchoResponse> responseObserver) {
		final var session = new StreamSession("EchoServerStream");
		final var stream = new GrpcOutboundStream<>(responseObserver,
				session.getCancellationSignal(), config.getPollIntervalMillis(),
				TimeUnit.MILLISECONDS);
		dispatch(
			new ServerStreamFanOut<>(
				session,
				stream,
				(ordinal) -> echo("Echo #" + ordinal + ": ", request),
				config.getFanOutCount(),
				config.getFanOutDelayMillis()
			),
			stream
		);
	}



	@Override
	public StreamObserver<EchoRequest> echoBidirectionalStreamSync(
			StreamObserver<EchoResponse> responseObserver) {
		final var session = new StreamSession("EchoBidirectionalStreamSync");
		final var stream = newDuplexStream(responseObserver, session);
		dispatch(new SyncBidiEcho<>(session, stream, (request) -> echo("Sync Echo: ", request)),
				stream);
		return stream;
	}



	@Override
	public StreamObserver<EchoRequest> echoBidirectionalStreamAsync(
			StreamObserver<EchoResponse> responseObserver) {
		final var session = new StreamSession("EchoBidirectionalStreamAsync");
		final var stream = newDuplexStream(responseObserver, session);
		dispatch(
			new AsyncBidiPipeline<>(
				session,
				stream,
				(request) -> echo("Async Echo (processed): ", request),
				stageExecutor,
				config.getQueueCapacity(),
				config.getPollIntervalMillis(),
				config.getProcessingDelayMillis(),
				config.getJoinTimeoutMillis()
			),
			stream
		);
		return stream;
	}



	static EchoResponse echo(String prefix, EchoRequest request) {
		return EchoResponse.newBuilder().setMessage(prefix + request.getMessage()).build();
	}

	/**
	 * Produces {@code "Received <N> messages: [m1, m2, ...]"}.
	 */
	static EchoResponse summarize(List<EchoRequest> requests) {
		final var messages = requests.stream()
			.map(EchoRequest::getMessage)
			.collect(Collectors.toList());
		return EchoResponse.newBuilder()
			.setMessage("Received " + messages.size() + " messages: " + messages)
			.build();
	}



	GrpcDuplexStream<EchoRequest, EchoResponse> newDuplexStream(
			StreamObserver<EchoResponse> responseObserver, StreamSession session) {
		return new GrpcDuplexStream<>(responseObserver, session.getCancellationSignal(),
				config.getPollIntervalMillis(), TimeUnit.MILLISECONDS);
	}



	/**
	 * Admits the call and dispatches {@code handler} to {@link #callExecutor}, or rejects the call
	 * via {@code stream}.
	 */
	void dispatch(StreamCallHandler<EchoResponse> handler, OutboundStream<EchoResponse> stream) {
		final var callLabel = handler.getSession().getCallLabel();
		if ( !admissions.tryAcquire()) {
			log.warning(callLabel + ": too many concurrent calls, rejecting");
			stream.abort(Status.RESOURCE_EXHAUSTED.withDescription(
					"more than " + config.getMaxConcurrentCalls() + " concurrent calls"));
			return;
		}
		try {
			callExecutor.execute(() -> {
				try {
					handler.run();
				} finally {
					admissions.release();
				}
			});
		} catch (RejectedExecutionException e) {
			admissions.release();
			log.warning(callLabel + ": worker pool shut down, rejecting");
			stream.abort(Status.UNAVAILABLE.withDescription("server is shutting down"));
		}
	}



	/**
	 * Number of calls that may still be admitted.
	 */
	public int getAvailableCallSlots() {
		return admissions.availablePermits();
	}



	static final Logger log = Logger.getLogger(EchoStreamService.class.getName());
}
