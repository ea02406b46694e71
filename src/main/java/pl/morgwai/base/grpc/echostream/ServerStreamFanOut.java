// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.StatusException;



/**
 * Handler for server-streaming calls: sends {@code count} responses produced by
 * {@code responseProducer} from consecutive ordinals starting at {@code 1}, pausing for
 * {@code delayMillis} between them. Liveness of the peer is checked before each response: if it
 * disappears, fewer responses are sent and the call ends as cancelled without any error.
 */
public class ServerStreamFanOut<OutboundT> extends StreamCallHandler<OutboundT> {



	final MessageTransformer<Integer, OutboundT> responseProducer;
	final int count;
	final long delayMillis;



	public ServerStreamFanOut(
		StreamSession session,
		OutboundStream<OutboundT> outboundStream,
		MessageTransformer<Integer, OutboundT> responseProducer,
		int count,
		long delayMillis
	) {
		super(session, outboundStream);
		if (count < 0) throw new IllegalArgumentException("count must not be negative");
		this.responseProducer = responseProducer;
		this.count = count;
		this.delayMillis = delayMillis;
	}



	@Override
	protected void handle() throws StatusException, ProcessingException, InterruptedException {
		session.incrementRequestCount();
		session.markDraining();
		for (int ordinal = 1; ordinal <= count; ordinal++) {
			if ( !outboundStream.isActive() || cancellationSignal.isRaised()) {
				log.info(session.getCallLabel() + ": peer disconnected after "
						+ (ordinal - 1) + " responses");
				cancellationSignal.raise();
				return;
			}
			final var response = responseProducer.transform(ordinal);
			if (log.isLoggable(Level.FINER)) {
				log.finer(session.getCallLabel() + ": sending #" + ordinal + ": " + response);
			}
			outboundStream.send(response);
			session.incrementResponseCount();
			if (ordinal < count && delayMillis > 0L
					&& cancellationSignal.await(delayMillis, TimeUnit.MILLISECONDS)) {
				return;
			}
		}
	}



	static final Logger log = Logger.getLogger(ServerStreamFanOut.class.getName());
}
