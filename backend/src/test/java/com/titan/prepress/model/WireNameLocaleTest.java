package com.titan.prepress.model;

import com.titan.prepress.storage.OutputKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class WireNameLocaleTest {

    private Locale previous;

    @BeforeEach
    void setup() {
        previous = Locale.getDefault();
        // dotless i would turn FAILED into "faıled"
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void teardown() {
        Locale.setDefault(previous);
    }

    @Test
    void wireNamesIgnoreTheDefaultLocale() {
        assertEquals("failed", JobStatus.FAILED.wireName());
        assertEquals("check_and_fix", JobMode.CHECK_AND_FIX.wireName());
        assertEquals("normalize_dpi", FixType.NORMALIZE_DPI.wireName());
        assertEquals("missing_dpi", FindingType.MISSING_DPI.wireName());
        assertEquals("fixed_pdf", OutputKind.FIXED_PDF.wireName());
    }

    @Test
    void wireNamesStillResolveBack() {
        assertEquals(OutputKind.FIXED_PDF, OutputKind.fromWireName("fixed_pdf").orElseThrow());
        assertEquals(JobMode.CHECK_AND_FIX, JobMode.fromWireName(JobMode.CHECK_AND_FIX.wireName()));
    }
}
