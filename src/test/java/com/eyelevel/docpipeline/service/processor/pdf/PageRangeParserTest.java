package com.eyelevel.docpipeline.service.processor.pdf;

import com.eyelevel.docpipeline.exception.ProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PageRangeParserTest {

    @Test
    void rangesAndSinglePagesAreMergedSortedAndZeroBased() {
        assertEquals(List.of(0, 1, 2, 4, 7, 8, 9), PageRangeParser.parse("8-10, 1-3,5,2", 10));
    }

    @Test
    void emptyPartsAreIgnored() {
        assertEquals(List.of(3), PageRangeParser.parse("4,,", 4));
    }

    @Test
    void outOfBoundsPageIsRejected() {
        ProcessingException error = assertThrows(ProcessingException.class, () -> PageRangeParser.parse("2-6", 5));

        assertEquals("Page range 2-6 is out of bounds (document has 5 pages)", error.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "a", "1-b", "3-1", "0", ",", "-2"})
    void malformedSelectionsAreRejected(String selection) {
        assertThrows(ProcessingException.class, () -> PageRangeParser.parse(selection, 5));
    }
}
