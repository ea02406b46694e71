// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream.server;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.*;
import io.grpc.ForwardingServerCall.SimpleForwardingServerCall;
import io.grpc.ForwardingServerCallListener.SimpleForwardingServerCallListener;



/**
 * Logs the start of each call and, once the call is closed or cancelled by the peer, its status
 * and duration.
 */
public class LoggingServerInterceptor implements ServerInterceptor {



	@Override
	public <RequestT, ResponseT> ServerCall.Listener<RequestT> interceptCall(
		ServerCall<RequestT, ResponseT> call,
		Metadata headers,
		ServerCallHandler<RequestT, ResponseT> next
	) {
		final var methodName = call.getMethodDescriptor().getFullMethodName();
		final var startNanos = System.nanoTime();
		log.info("starting call to " + methodName);
		final var listener = next.startCall(
			new SimpleForwardingServerCall<>(call) {

				@Override public void close(Status status, Metadata trailers) {
					final var durationMillis =
							TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
					log.log(
						status.isOk() ? Level.INFO : Level.WARNING,
						methodName + " closed with " + status.getCode()
							+ (status.getDescription() != null
								? " (" + status.getDescription() + ')' : "")
							+ " after " + durationMillis + "ms"
					);
					super.close(status, trailers);
				}
			},
			headers
		);
		return new SimpleForwardingServerCallListener<>(listener) {

			@Override public void onCancel() {
				log.info(methodName + " cancelled by peer after "
						+ TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos) + "ms");
				super.onCancel();
			}
		};
	}



	static final Logger log = Logger.getLogger(LoggingServerInterceptor.class.getName());
}
