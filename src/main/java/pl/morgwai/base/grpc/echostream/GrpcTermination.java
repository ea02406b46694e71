// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.concurrent.TimeUnit;

import io.grpc.ManagedChannel;
import io.grpc.Server;



/**
 * Orderly termination of gRPC servers and channels with a forced fallback.
 */
public interface GrpcTermination {



	/**
	 * Calls {@link Server#shutdown()} and awaits up to {@code timeout} for termination. If
	 * {@code server} fails to terminate in time, {@link Server#shutdownNow()} is called.
	 * @return {@code true} if {@code server} terminated cleanly within {@code timeout}.
	 */
	static boolean enforceTermination(Server server, long timeout, TimeUnit unit)
			throws InterruptedException {
		try {
			server.shutdown();
			return server.awaitTermination(timeout, unit);
		} finally {
			if ( !server.isTerminated()) server.shutdownNow();
		}
	}



	/**
	 * Calls {@link ManagedChannel#shutdown()} and awaits up to {@code timeout} for termination. If
	 * {@code channel} fails to terminate in time, {@link ManagedChannel#shutdownNow()} is called.
	 * @return {@code true} if {@code channel} terminated cleanly within {@code timeout}.
	 */
	static boolean enforceTermination(ManagedChannel channel, long timeout, TimeUnit unit)
			throws InterruptedException {
		try {
			channel.shutdown();
			return channel.awaitTermination(timeout, unit);
		} finally {
			if ( !channel.isTerminated()) channel.shutdownNow();
		}
	}
}
