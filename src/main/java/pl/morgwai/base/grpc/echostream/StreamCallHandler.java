// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.Status;
import io.grpc.StatusException;



/**
 * Base class for top-level call handlers. Subclasses implement {@link #handle()}, this class takes
 * care of the {@link StreamSession session} lifecycle and of reporting the call's terminal status
 * to the peer exactly once.
 * <p>
 * Faults thrown by {@link #handle()} are not propagated: they {@link CancellationSignal#raise(
 * Throwable) raise} the session's cancellation signal, after which {@link #run()} concludes the
 * call according to the signal's cause:</p>
 * <ul>
 *   <li>not raised: the stream is {@link OutboundStream#complete() completed} and the session
 *     {@link StreamSession#close() closed},</li>
 *   <li>{@link ProcessingException}: the stream is aborted with {@link Status#INTERNAL} and the
 *     session {@link StreamSession#fail(Throwable) fails},</li>
 *   <li>{@link StatusException} while the peer is still present: the stream is aborted with the
 *     exception's status and the session fails,</li>
 *   <li>anything else, including faults observed after the peer disappeared: the session is
 *     {@link StreamSession#cancel() cancelled} and nothing is reported.</li>
 * </ul>
 */
public abstract class StreamCallHandler<OutboundT> implements Runnable {



	protected final StreamSession session;
	protected final OutboundStream<OutboundT> outboundStream;
	protected final CancellationSignal cancellationSignal;



	protected StreamCallHandler(StreamSession session, OutboundStream<OutboundT> outboundStream) {
		this.session = session;
		this.outboundStream = outboundStream;
		this.cancellationSignal = session.getCancellationSignal();
	}



	/**
	 * Performs the call's work. Returns normally once all outbound messages were sent or the
	 * cancellation signal was observed.
	 */
	protected abstract void handle()
			throws StatusException, ProcessingException, InterruptedException;



	public StreamSession getSession() { return session; }



	@Override
	public final void run() {
		session.activate();
		if (log.isLoggable(Level.FINE)) log.fine(session.getCallLabel() + ": started");
		try {
			handle();
		} catch (StatusException | ProcessingException e) {
			cancellationSignal.raise(e);
		} catch (InterruptedException e) {
			cancellationSignal.raise(e);
			Thread.currentThread().interrupt();
		} catch (RuntimeException e) {
			cancellationSignal.raise(new ProcessingException(e));
		} finally {
			conclude();
		}
	}



	void conclude() {
		final var label = session.getCallLabel();
		if ( !cancellationSignal.isRaised()) {
			if (outboundStream.isActive()) {
				session.close();
				outboundStream.complete();
				log.info(label + ": finished, " + summary());
			} else {
				session.cancel();
				log.info(label + ": peer disconnected, " + summary());
			}
			return;
		}

		final var cause = cancellationSignal.getCause().orElse(null);
		if (cause instanceof ProcessingException) {
			session.fail(cause);
			log.log(Level.WARNING, label + ": processing failed, " + summary(), cause);
			outboundStream.abort(
					Status.INTERNAL.withDescription(cause.getMessage()).withCause(cause));
		} else if (cause instanceof StatusException && outboundStream.isActive()) {
			session.fail(cause);
			log.log(Level.WARNING, label + ": transport error, " + summary(), cause);
			outboundStream.abort(((StatusException) cause).getStatus());
		} else {
			session.cancel();
			log.info(label + ": cancelled, " + summary()
					+ (cause != null ? ", cause: " + cause : ""));
		}
	}



	String summary() {
		return "requests: " + session.getRequestCount() + ", responses: "
				+ session.getResponseCount() + ", " + session.getAgeMillis() + "ms";
	}



	static final Logger log = Logger.getLogger(StreamCallHandler.class.getName());
}
