// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;

import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.Status;
import io.grpc.StatusException;



/**
 * Handler for bi-di calls that decouples receiving, processing and sending of messages.
 * <p>
 * 3 activities run concurrently for each call:</p>
 * <ol>
 *   <li><b>ingestion</b> (dispatched to {@code stageExecutor}) receives inbound messages from the
 *     stream and {@link RelayQueue#put(Object) puts} them into the inbound queue,</li>
 *   <li><b>processing</b> (dispatched to {@code stageExecutor}) takes inbound messages, pauses for
 *     {@code processingDelayMillis}, {@link MessageTransformer#transform(Object) transforms} them
 *     and puts the results into the outbound queue,</li>
 *   <li><b>emission</b> (the thread that invokes {@link #run()}) takes results from the outbound
 *     queue and sends them to the stream.</li>
 * </ol>
 * <p>
 * Both queues are bounded by {@code queueCapacity}: a slow stage makes the preceding one block,
 * which in turn stops requesting inbound messages from the peer.</p>
 * <p>
 * Each producing activity always finishes by putting the end-of-stream marker into its output
 * queue, including when it exits because of a fault or cancellation, so the following activity
 * never stays blocked. Faults are not propagated across activities: they raise the session's
 * {@link CancellationSignal} with the fault as its cause and all activities wind down. Emission
 * raises the signal too if the peer disappears. After emission exits, the other 2 activities are
 * awaited for at most {@code joinTimeoutMillis} and interrupted if they fail to finish.</p>
 * <p>
 * If processing produces a result after the outbound side has been shut down, the result is
 * dropped and logged instead of being enqueued.</p>
 */
public class AsyncBidiPipeline<InboundT, OutboundT> extends StreamCallHandler<OutboundT> {



	final DuplexStream<InboundT, OutboundT> stream;
	final MessageTransformer<InboundT, OutboundT> transformer;
	final Executor stageExecutor;
	final long processingDelayMillis;
	final long joinTimeoutMillis;

	final RelayQueue<InboundT> inboundQueue;
	final RelayQueue<OutboundT> outboundQueue;

	FutureTask<Void> ingestion;
	FutureTask<Void> processing;



	/**
	 * @param stageExecutor executor for ingestion and processing activities. It must be able to run
	 *     both of them at the same time, as each occupies its thread for the whole call.
	 * @param queueCapacity capacity of both the inbound and the outbound queue.
	 * @param pollIntervalMillis how often activities blocked on a queue re-check the cancellation
	 *     signal.
	 * @param processingDelayMillis pause before processing each message.
	 * @param joinTimeoutMillis how long to wait for ingestion and processing after emission exits.
	 */
	public AsyncBidiPipeline(
		StreamSession session,
		DuplexStream<InboundT, OutboundT> stream,
		MessageTransformer<InboundT, OutboundT> transformer,
		Executor stageExecutor,
		int queueCapacity,
		long pollIntervalMillis,
		long processingDelayMillis,
		long joinTimeoutMillis
	) {
		super(session, stream);
		this.stream = stream;
		this.transformer = transformer;
		this.stageExecutor = stageExecutor;
		this.processingDelayMillis = processingDelayMillis;
		this.joinTimeoutMillis = joinTimeoutMillis;
		inboundQueue = new RelayQueue<>(session.getCallLabel() + " inbound", queueCapacity,
				cancellationSignal, pollIntervalMillis, TimeUnit.MILLISECONDS);
		outboundQueue = new RelayQueue<>(session.getCallLabel() + " outbound", queueCapacity,
				cancellationSignal, pollIntervalMillis, TimeUnit.MILLISECONDS);
	}



	public RelayQueue<InboundT> getInboundQueue() { return inboundQueue; }
	public RelayQueue<OutboundT> getOutboundQueue() { return outboundQueue; }



	@Override
	protected void handle() throws StatusException, InterruptedException {
		ingestion = new FutureTask<>(this::ingest, null);
		processing = new FutureTask<>(this::process, null);
		try {
			startStage(ingestion);
			startStage(processing);
			emit();
		} finally {
			awaitStages();
		}
	}

	void startStage(FutureTask<Void> stage) throws StatusException {
		try {
			stageExecutor.execute(stage);
		} catch (RejectedExecutionException e) {
			final var unavailable = Status.UNAVAILABLE
				.withDescription("no capacity to start stream stage")
				.withCause(e)
				.asException();
			cancellationSignal.raise(unavailable);
			stage.cancel(false);
			if (stage == ingestion) processing.cancel(false);  // never started
			throw unavailable;
		}
	}



	void ingest() {
		try {
			while ( !cancellationSignal.isRaised()) {
				if ( !stream.isActive()) {
					cancellationSignal.raise();
					break;
				}
				final var envelope = stream.receive();
				if (envelope.isEndOfStream()) {
					session.markDraining();
					if (log.isLoggable(Level.FINE)) {
						log.fine(session.getCallLabel() + ": peer closed its stream after "
								+ session.getRequestCount() + " messages");
					}
					break;
				}
				if (envelope.isCancelled()) {
					cancellationSignal.raise();
					break;
				}
				session.incrementRequestCount();
				if (log.isLoggable(Level.FINER)) {
					log.finer(session.getCallLabel() + ": received " + envelope.getMessage());
				}
				if ( !inboundQueue.put(envelope.getMessage())) break;
			}
		} catch (StatusException e) {
			if (log.isLoggable(Level.FINE)) log.fine(session.getCallLabel() + ": ingestion: " + e);
			cancellationSignal.raise(e);
		} catch (InterruptedException e) {
			cancellationSignal.raise(e);
			Thread.currentThread().interrupt();
		} catch (RuntimeException e) {
			log.log(Level.SEVERE, session.getCallLabel() + ": ingestion failed", e);
			cancellationSignal.raise(Status.INTERNAL.withCause(e).asException());
		} finally {
			inboundQueue.putEndOfStream();
		}
	}



	void process() {
		try {
			while ( !cancellationSignal.isRaised()) {
				final var envelope = inboundQueue.take();
				if ( !envelope.isMessage()) break;
				if (processingDelayMillis > 0L
						&& cancellationSignal.await(processingDelayMillis, TimeUnit.MILLISECONDS)) {
					break;
				}
				final var result = transformer.transform(envelope.getMessage());
				if ( !outboundQueue.put(result)) {
					log.info(session.getCallLabel()
							+ ": outbound side already shut down, dropping " + result);
					break;
				}
				if (log.isLoggable(Level.FINER)) {
					log.finer(session.getCallLabel() + ": processed " + result);
				}
			}
		} catch (ProcessingException e) {
			cancellationSignal.raise(e);
		} catch (InterruptedException e) {
			cancellationSignal.raise(e);
			Thread.currentThread().interrupt();
		} catch (RuntimeException e) {
			cancellationSignal.raise(new ProcessingException(e));
		} finally {
			outboundQueue.putEndOfStream();
		}
	}



	void emit() throws InterruptedException {
		while (true) {
			if ( !stream.isActive()) {
				cancellationSignal.raise();
				return;
			}
			final var envelope = outboundQueue.take();
			if ( !envelope.isMessage() || cancellationSignal.isRaised()) return;
			try {
				stream.send(envelope.getMessage());
			} catch (StatusException e) {
				cancellationSignal.raise(e);
				return;
			}
			session.incrementResponseCount();
		}
	}



	/**
	 * Awaits ingestion and processing for at most {@link #joinTimeoutMillis} in total. Activities
	 * that fail to finish in time are interrupted.
	 */
	void awaitStages() {
		final long deadlineNanos = System.nanoTime()
				+ TimeUnit.MILLISECONDS.toNanos(joinTimeoutMillis);
		for (var stage: new FutureTask<?>[] {ingestion, processing}) {
			try {
				stage.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
			} catch (TimeoutException e) {
				log.warning(session.getCallLabel() + ": stage did not finish within "
						+ joinTimeoutMillis + "ms, interrupting");
				cancellationSignal.raise();
				stage.cancel(true);
			} catch (InterruptedException e) {
				cancellationSignal.raise(e);
				ingestion.cancel(true);
				processing.cancel(true);
				Thread.currentThread().interrupt();
				return;
			} catch (CancellationException ignored) {
				// this stage was rejected by the executor and never started
			} catch (ExecutionException e) {
				log.log(Level.SEVERE, session.getCallLabel() + ": stage failed", e.getCause());
				cancellationSignal.raise(new ProcessingException(e.getCause()));
			}
		}
	}



	static final Logger log = Logger.getLogger(AsyncBidiPipeline.class.getName());
}
