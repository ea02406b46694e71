// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import io.grpc.StatusException;



/**
 * A call with streaming inbound and outbound sides. {@link #receive()} may be called by a different
 * thread than the one using the {@link OutboundStream} methods, but by only 1 thread at a time.
 */
public interface DuplexStream<InboundT, OutboundT> extends OutboundStream<OutboundT> {



	/**
	 * Blocks until the next inbound message arrives, the peer closes its side of the stream or the
	 * call is cancelled.
	 * @return an {@link Envelope} with the next message, {@link Envelope#endOfStream()} once the
	 *     peer closed its side or {@link Envelope#cancelled()} if the call was cancelled while
	 *     waiting.
	 * @throws StatusException if the peer reported an error or the transport failed.
	 */
	Envelope<InboundT> receive() throws StatusException, InterruptedException;
}
