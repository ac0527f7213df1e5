package com.eyelevel.docpipeline.service.events;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ProcessingEventType {
    STARTED("processing:started"),
    PROGRESS("processing:progress"),
    COMPLETED("processing:completed"),
    FAILED("processing:failed");

    private final String eventName;
}
