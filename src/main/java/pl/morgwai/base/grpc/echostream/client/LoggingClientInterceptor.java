// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream.client;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.*;
import io.grpc.ForwardingClientCall.SimpleForwardingClientCall;
import io.grpc.ForwardingClientCallListener.SimpleForwardingClientCallListener;



/**
 * Logs the start of each call together with its method type and, once the call is closed, its
 * status and duration.
 */
public class LoggingClientInterceptor implements ClientInterceptor {



	@Override
	public <RequestT, ResponseT> ClientCall<RequestT, ResponseT> interceptCall(
		MethodDescriptor<RequestT, ResponseT> method,
		CallOptions callOptions,
		Channel next
	) {
		final var methodName = method.getFullMethodName();
		return new SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {

			@Override public void start(Listener<ResponseT> responseListener, Metadata headers) {
				final var startNanos = System.nanoTime();
				log.info("starting " + methodName + " (" + method.getType() + ')');
				super.start(
					new SimpleForwardingClientCallListener<>(responseListener) {

						@Override public void onClose(Status status, Metadata trailers) {
							log.log(
								status.isOk() ? Level.INFO : Level.WARNING,
								methodName + " completed with " + status.getCode() + " in "
									+ TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)
									+ "ms"
							);
							super.onClose(status, trailers);
						}
					},
					headers
				);
			}
		};
	}



	static final Logger log = Logger.getLogger(LoggingClientInterceptor.class.getName());
}
