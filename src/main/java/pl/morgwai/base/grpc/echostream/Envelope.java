// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.NoSuchElementException;



/**
 * Element handed over between a stream and its consumers: either a {@link Kind#MESSAGE message},
 * the {@link Kind#END_OF_STREAM end-of-stream} marker or a notice that the consumer should stop
 * because the call was {@link Kind#CANCELLED cancelled}.
 * <p>
 * Consumers are expected to switch over {@link #getKind()} rather than test for {@code null}
 * payloads:</p>
 * <pre>
 * final var envelope = queue.take();
 * switch (envelope.getKind()) {
 *     case MESSAGE:
 *         process(envelope.getMessage());
 *         break;
 *     case END_OF_STREAM:
 *     case CANCELLED:
 *         return;
 * }</pre>
 */
public final class Envelope<MessageT> {



	public enum Kind { MESSAGE, END_OF_STREAM, CANCELLED }

	public Kind getKind() { return kind; }
	final Kind kind;



	/**
	 * Returns the wrapped message.
	 * @throws NoSuchElementException if this is not a {@link Kind#MESSAGE message} envelope.
	 */
	public MessageT getMessage() {
		if (kind != Kind.MESSAGE) throw new NoSuchElementException(kind + " carries no message");
		return message;
	}
	final MessageT message;



	public boolean isMessage() { return kind == Kind.MESSAGE; }
	public boolean isEndOfStream() { return kind == Kind.END_OF_STREAM; }
	public boolean isCancelled() { return kind == Kind.CANCELLED; }



	public static <MessageT> Envelope<MessageT> of(MessageT message) {
		if (message == null) throw new NullPointerException("message");
		return new Envelope<>(Kind.MESSAGE, message);
	}

	@SuppressWarnings("unchecked")
	public static <MessageT> Envelope<MessageT> endOfStream() {
		return (Envelope<MessageT>) END_OF_STREAM;
	}

	@SuppressWarnings("unchecked")
	public static <MessageT> Envelope<MessageT> cancelled() {
		return (Envelope<MessageT>) CANCELLED;
	}

	static final Envelope<?> END_OF_STREAM = new Envelope<>(Kind.END_OF_STREAM, null);
	static final Envelope<?> CANCELLED = new Envelope<>(Kind.CANCELLED, null);



	private Envelope(Kind kind, MessageT message) {
		this.kind = kind;
		this.message = message;
	}



	@Override
	public String toString() {
		return kind == Kind.MESSAGE ? "Envelope(" + message + ')' : kind.toString();
	}
}
