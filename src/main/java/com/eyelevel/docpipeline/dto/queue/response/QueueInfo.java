package com.eyelevel.docpipeline.dto.queue.response;

public record QueueInfo(String name, String description) {
}
