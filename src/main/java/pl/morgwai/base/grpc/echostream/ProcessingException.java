// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;



/**
 * Thrown when domain processing of a message fails. Terminates the call with
 * {@link io.grpc.Status#INTERNAL INTERNAL} status: messages already sent are not retracted.
 */
public class ProcessingException extends Exception {

	public ProcessingException(String message) { super(message); }

	public ProcessingException(String message, Throwable cause) { super(message, cause); }

	public ProcessingException(Throwable cause) { super(cause); }

	private static final long serialVersionUID = -3917760329816482075L;
}
