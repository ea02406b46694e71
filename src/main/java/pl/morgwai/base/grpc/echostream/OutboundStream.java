// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import io.grpc.Status;
import io.grpc.StatusException;



/**
 * Outbound side of a call as seen by a {@link StreamCallHandler}. Methods of this interface must
 * be called by 1 thread at a time.
 */
public interface OutboundStream<OutboundT> {



	/**
	 * Sends {@code message} to the peer. May block while the transport's outbound buffer is full.
	 * @throws StatusException if the message could not be written (peer gone, transport failure).
	 */
	void send(OutboundT message) throws StatusException, InterruptedException;

	/**
	 * {@code false} once the peer disconnected or the call was cancelled.
	 */
	boolean isActive();

	/**
	 * Closes the stream successfully.
	 */
	void complete();

	/**
	 * Closes the stream with {@code status}.
	 */
	void abort(Status status);
}
