package com.eyelevel.docpipeline.dto.queue.response;

/**
 * @param removed number of waiting or delayed jobs actually removed.
 */
public record DrainResponse(String queueName, int removed) {
}
