package it.unimib.datai.handlerharness.core.transport;

import it.unimib.datai.handlerharness.common.model.InvocationRequest;
import it.unimib.datai.handlerharness.core.loop.CancellationSignal;

/**
 * Performs exactly one invocation of a handler. Implementations neither retry nor
 * interpret the returned status.
 */
@FunctionalInterface
public interface HandlerClient {

    /**
     * @throws HandlerTransportException when the handler could not be reached, did not answer
     *                                   in time, answered with something that is not a response
     *                                   envelope, or the call was cancelled
     */
    RawResponse invoke(InvocationRequest request, CancellationSignal cancellation);
}
