// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.StatusException;



/**
 * Handler for bi-di calls that send exactly 1 response for each request, before reading the next
 * request. Receiving, processing and sending all happen in the thread that invokes {@link #run()},
 * so responses are paired with requests strictly in order.
 *
 * @see AsyncBidiPipeline
 */
public class SyncBidiEcho<InboundT, OutboundT> extends StreamCallHandler<OutboundT> {



	final DuplexStream<InboundT, OutboundT> stream;
	final MessageTransformer<InboundT, OutboundT> transformer;



	public SyncBidiEcho(
		StreamSession session,
		DuplexStream<InboundT, OutboundT> stream,
		MessageTransformer<InboundT, OutboundT> transformer
	) {
		super(session, stream);
		this.stream = stream;
		this.transformer = transformer;
	}



	@Override
	protected void handle() throws StatusException, ProcessingException, InterruptedException {
		while (true) {
			if ( !stream.isActive() || cancellationSignal.isRaised()) {
				cancellationSignal.raise();
				return;
			}
			final var envelope = stream.receive();
			switch (envelope.getKind()) {
				case MESSAGE:
					session.incrementRequestCount();
					final var response = transformer.transform(envelope.getMessage());
					stream.send(response);
					session.incrementResponseCount();
					if (log.isLoggable(Level.FINER)) {
						log.finer(session.getCallLabel() + ": " + envelope.getMessage() + " -> "
								+ response);
					}
					break;
				case END_OF_STREAM:
					session.markDraining();
					return;
				default:
					cancellationSignal.raise();
					return;
			}
		}
	}



	static final Logger log = Logger.getLogger(SyncBidiEcho.class.getName());
}
