package com.eyelevel.docpipeline.service.queue;

public enum QueueJobState {
    WAITING, DELAYED, ACTIVE, COMPLETED, FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
