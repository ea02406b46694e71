// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.base.grpc.echostream;



/**
 * Domain logic plugged into the stream handlers.
 */
@FunctionalInterface
public interface MessageTransformer<InputT, OutputT> {

	OutputT transform(InputT input) throws ProcessingException;
}
