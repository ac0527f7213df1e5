package com.eyelevel.docpipeline.service.routing;

import com.eyelevel.docpipeline.exception.JobConfigurationException;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.service.queue.QueueName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JobRouterTest {

    private final JobRouter router = new JobRouter();

    @Test
    void routesDedicatedQueues() {
        assertEquals(new JobRoute(QueueName.OCR, "ocr-document", JobRouter.PRIORITY_NORMAL), router.route(JobType.OCR));
        assertEquals(new JobRoute(QueueName.THUMBNAIL, "generate-thumbnail", JobRouter.PRIORITY_HIGH),
                     router.route(JobType.THUMBNAIL));
        assertEquals(new JobRoute(QueueName.EMBEDDING, "generate-embedding", JobRouter.PRIORITY_LOW),
                     router.route(JobType.EMBEDDING));
        assertEquals(new JobRoute(QueueName.AI_CLASSIFY, "classify-document", JobRouter.PRIORITY_NORMAL),
                     router.route(JobType.AI_CLASSIFY));
    }

    @ParameterizedTest
    @EnumSource(value = JobType.class, names = "PDF_.*", mode = EnumSource.Mode.MATCH_ALL)
    void pdfOperationsShareThePdfQueue(JobType type) {
        JobRoute route = router.route(type);

        assertEquals(QueueName.PDF, route.queue());
        assertEquals(type.name().toLowerCase(), route.jobKind());
    }

    @Test
    void lightPdfOperationsHaveNormalPriority() {
        assertEquals(JobRouter.PRIORITY_NORMAL, router.route(JobType.PDF_RENDER_PAGE).defaultPriority());
        assertEquals(JobRouter.PRIORITY_NORMAL, router.route(JobType.PDF_METADATA).defaultPriority());
        assertEquals(JobRouter.PRIORITY_LOW, router.route(JobType.PDF_MERGE).defaultPriority());
    }

    @Test
    void resolvesNamesCaseInsensitively() {
        assertEquals(JobType.AI_CLASSIFY, router.resolveJobType(" ai_classify "));
        assertEquals(QueueName.OCR, router.route("ocr").queue());
    }

    @Test
    void unknownJobTypeIsAConfigurationError() {
        JobConfigurationException error = assertThrows(JobConfigurationException.class,
                () -> router.route("TRANSLATE"));
        assertEquals("Unknown job type: TRANSLATE", error.getMessage());
    }

    @Test
    void nullOrBlankJobTypeIsRejected() {
        assertThrows(JobConfigurationException.class, () -> router.route((JobType) null));
        assertThrows(JobConfigurationException.class, () -> router.resolveJobType("  "));
    }
}
