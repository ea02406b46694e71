// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.StatusException;



/**
 * Handler for client-streaming calls: collects all inbound messages in arrival order and once the
 * peer closes its side, sends exactly 1 response produced by {@code summarizer} from the whole
 * list. Runs entirely in the thread that invokes {@link #run()}.
 */
public class ClientStreamAggregator<InboundT, OutboundT> extends StreamCallHandler<OutboundT> {



	final DuplexStream<InboundT, OutboundT> stream;
	final MessageTransformer<List<InboundT>, OutboundT> summarizer;



	public ClientStreamAggregator(
		StreamSession session,
		DuplexStream<InboundT, OutboundT> stream,
		MessageTransformer<List<InboundT>, OutboundT> summarizer
	) {
		super(session, stream);
		this.stream = stream;
		this.summarizer = summarizer;
	}



	@Override
	protected void handle() throws StatusException, ProcessingException, InterruptedException {
		final var received = new ArrayList<InboundT>();
		while (true) {
			if ( !stream.isActive() || cancellationSignal.isRaised()) {
				cancellationSignal.raise();
				return;
			}
			final var envelope = stream.receive();
			switch (envelope.getKind()) {
				case MESSAGE:
					received.add(envelope.getMessage());
					session.incrementRequestCount();
					if (log.isLoggable(Level.FINER)) {
						log.finer(session.getCallLabel() + ": received " + envelope.getMessage());
					}
					break;
				case END_OF_STREAM:
					session.markDraining();
					final var summary = summarizer.transform(Collections.unmodifiableList(received));
					if (log.isLoggable(Level.FINE)) {
						log.fine(session.getCallLabel() + ": sending summary " + summary);
					}
					stream.send(summary);
					session.incrementResponseCount();
					return;
				default:
					cancellationSignal.raise();
					return;
			}
		}
	}



	static final Logger log = Logger.getLogger(ClientStreamAggregator.class.getName());
}
