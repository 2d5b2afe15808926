package com.z254.mender.dispatch;

import reactor.core.publisher.Mono;

/**
 * Triggers the external remediation job.
 */
public interface DispatchTransport {

    /**
     * @return the run identifier of the triggered job; errors when the job could not be started
     */
    Mono<String> dispatch(DispatchRequest request);
}
