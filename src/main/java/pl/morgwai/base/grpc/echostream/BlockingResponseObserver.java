// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;



/**
 * A {@link ClientResponseObserver} that records all responses of a call and allows to block until
 * the response stream is completed with either {@link #onCompleted()} or
 * {@link #onError(Throwable)}.
 * <p>
 * Typical usage:</p>
 * <pre>
 * var responseObserver = new BlockingResponseObserver&lt;EchoRequest, EchoResponse&gt;(
 *         response -&gt; log.info("got " + response.getMessage()));
 * echoStub.echoServerStream(request, responseObserver);
 * try {
 *     if ( !responseObserver.awaitCompletion(5, TimeUnit.SECONDS)) {
 *         responseObserver.cancel("timeout");
 *     }
 *     final var responses = responseObserver.getResponses();
 * } catch (ErrorReportedException e) {
 *     Throwable reportedError = e.getCause();
 * }</pre>
 */
public class BlockingResponseObserver<RequestT, ResponseT>
		implements ClientResponseObserver<RequestT, ResponseT> {



	final Consumer<? super ResponseT> responseHandler;
	final Consumer<? super ClientCallStreamObserver<RequestT>> beforeStartHandler;

	final List<ResponseT> responses = Collections.synchronizedList(new ArrayList<>());
	final CountDownLatch latch = new CountDownLatch(1);
	volatile boolean completed = false;
	volatile Throwable error;
	volatile ClientCallStreamObserver<RequestT> requestObserver;



	/**
	 * @param responseHandler called for each response after it is recorded, may be {@code null}.
	 * @param beforeStartHandler called by {@link #beforeStart(ClientCallStreamObserver)}, may be
	 *     {@code null}. This is the place to configure client-side flow-control and to start
	 *     streaming requests.
	 */
	public BlockingResponseObserver(
		Consumer<? super ResponseT> responseHandler,
		Consumer<? super ClientCallStreamObserver<RequestT>> beforeStartHandler
	) {
		this.responseHandler = responseHandler;
		this.beforeStartHandler = beforeStartHandler;
	}

	public BlockingResponseObserver(Consumer<? super ResponseT> responseHandler) {
		this(responseHandler, null);
	}

	public BlockingResponseObserver() { this(null, null); }



	@Override
	public void beforeStart(ClientCallStreamObserver<RequestT> requestObserver) {
		this.requestObserver = requestObserver;
		if (beforeStartHandler != null) beforeStartHandler.accept(requestObserver);
	}

	/**
	 * Returns the request observer passed to {@link #beforeStart(ClientCallStreamObserver)} or
	 * {@code empty} if the call has not been started yet.
	 */
	public Optional<ClientCallStreamObserver<RequestT>> getRequestObserver() {
		return Optional.ofNullable(requestObserver);
	}



	@Override
	public void onNext(ResponseT response) {
		responses.add(response);
		if (responseHandler != null) responseHandler.accept(response);
	}

	/**
	 * Returns a snapshot of the responses received so far, in arrival order.
	 */
	public List<ResponseT> getResponses() {
		synchronized (responses) {
			return List.copyOf(responses);
		}
	}



	@Override
	public void onCompleted() {
		completed = true;
		latch.countDown();
	}

	@Override
	public void onError(Throwable error) {
		this.error = error;
		onCompleted();
	}

	/**
	 * {@code true} if either {@link #onCompleted()} or {@link #onError(Throwable)} was called.
	 */
	public boolean isCompleted() { return completed; }

	public Optional<Throwable> getError() { return Optional.ofNullable(error); }



	/**
	 * Awaits up to {@code timeout} of {@code unit} for {@link #onCompleted()} or
	 * {@link #onError(Throwable)} to be called.
	 * @return {@code true} if the call completed, {@code false} if the timeout passed.
	 * @throws ErrorReportedException if {@link #onError(Throwable)} was called.
	 */
	public boolean awaitCompletion(long timeout, TimeUnit unit)
			throws ErrorReportedException, InterruptedException {
		latch.await(timeout, unit);
		if (error != null) throw new ErrorReportedException(error);
		return completed;
	}



	/**
	 * Cancels the call if it has been started and has not completed yet.
	 */
	public void cancel(String message) {
		final var observer = requestObserver;
		if (observer != null && !completed) observer.cancel(message, null);
	}



	/**
	 * Thrown by {@link #awaitCompletion(long, TimeUnit)} if {@link #onError(Throwable)} was called.
	 * {@link #getCause()} returns the reported error.
	 */
	public static class ErrorReportedException extends Exception {
		ErrorReportedException(Throwable reportedError) { super(reportedError); }
		private static final long serialVersionUID = 1848619649489806621L;
	}
}
