package com.titan.prepress.toolchain;

import com.titan.prepress.report.PageSize;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PdfMetadataExtractorTest {

    @Test
    void readsPageCountAndSize() {
        PdfMetadata metadata = PdfMetadataExtractor.parse(
                "Title:          flyer\nPages:          4\nEncrypted:      no\nPage size:      595.276 x 841.89 pts (A4)\n");

        assertEquals(4, metadata.getPageCount());
        assertEquals(1, metadata.getPageSizes().size());
        PageSize size = metadata.getPageSizes().get(0);
        assertEquals(595.276, size.getWidth(), 0.0001);
        assertEquals(841.89, size.getHeight(), 0.0001);
        assertEquals("pt", size.getUnit());
        assertTrue(metadata.getIssues().isEmpty());
    }

    @Test
    void failureIsWarningWithoutPageData() {
        PdfMetadata metadata = new PdfMetadataExtractor(new FakeToolRunner().failing(Tool.PDFINFO))
                .extract(FakeToolRunner.pdf("x"));

        assertEquals(0, metadata.getPageCount());
        assertTrue(metadata.getPageSizes().isEmpty());
        assertEquals("PDFINFO_FAILED", metadata.getIssues().asList().get(0).getCode());
        assertEquals(1, metadata.getIssues().counts().getWarning());
    }
}
