package com.eyelevel.docpipeline.service.processor;

import com.eyelevel.docpipeline.exception.JobConfigurationException;
import com.eyelevel.docpipeline.model.JobType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the {@link JobProcessor} for a job type. Built once from every processor bean; a job type claimed by
 * two processors is a configuration error.
 */
@Slf4j
@Service
public class JobProcessorRegistry {

    private final Map<JobType, JobProcessor> processors = new EnumMap<>(JobType.class);

    public JobProcessorRegistry(List<JobProcessor> processors) {
        for (JobProcessor processor : processors) {
            for (JobType jobType : processor.supportedJobTypes()) {
                JobProcessor existing = this.processors.putIfAbsent(jobType, processor);
                if (existing != null) {
                    throw new JobConfigurationException(String.format(
                            "Job type %s is claimed by both %s and %s", jobType,
                            existing.getClass().getSimpleName(), processor.getClass().getSimpleName()));
                }
            }
        }
        log.info("JobProcessorRegistry initialized with {} processors covering {} job types.", processors.size(),
                 this.processors.size());
    }

    public Optional<JobProcessor> getProcessor(JobType jobType) {
        Optional<JobProcessor> processor = Optional.ofNullable(jobType).map(processors::get);
        log.debug("Searching for processor for job type '{}'. Found: {}", jobType,
                  processor.map(p -> p.getClass().getSimpleName()).orElse("None"));
        return processor;
    }
}
