package com.eyelevel.docpipeline.dto.queue.response;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class QueueStatsOverview {
    private final List<QueueStats> queues;
    private final QueueStats totals;
}
