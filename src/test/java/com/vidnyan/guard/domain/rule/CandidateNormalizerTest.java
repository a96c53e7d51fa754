package com.vidnyan.guard.domain.rule;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CandidateNormalizerTest {

    @Test
    void canonicalPath_ShouldCollapseRepeatedSeparators() {
        assertEquals("/home/u/openclaw-harness/src/main.rs",
                CandidateNormalizer.canonicalPath("/home/u/openclaw-harness//src///main.rs"));
        assertEquals("C:/tools/safebot/config/",
                CandidateNormalizer.canonicalPath("C:\\tools\\\\safebot\\config\\"));
    }

    @Test
    void canonicalPath_ShouldResolveDotSegments() {
        // Arrange
        String dotDot = "/home/u/openclaw-harness/docs/../src/main.rs";
        String dot = "./safebot/./config/rules.yaml";

        // Act & Assert
        assertEquals("/home/u/openclaw-harness/src/main.rs", CandidateNormalizer.canonicalPath(dotDot));
        assertEquals("safebot/config/rules.yaml", CandidateNormalizer.canonicalPath(dot));
    }

    @Test
    void canonicalPath_ShouldKeepLeadingParentOfRelativePathOnly() {
        assertEquals("../shared/rules.yaml", CandidateNormalizer.canonicalPath("../shared/rules.yaml"));
        assertEquals("/etc/passwd", CandidateNormalizer.canonicalPath("/../../etc/passwd"));
        assertEquals("/", CandidateNormalizer.canonicalPath("/tmp/.."));
        assertEquals("", CandidateNormalizer.canonicalPath(null));
    }

    @Test
    void pathContains_ShouldMatchAfterCanonicalization() {
        assertTrue(CandidateNormalizer.pathContains("/srv/SafeBot/docs/../Config/x.yaml", "safebot/config/"));
        assertFalse(CandidateNormalizer.pathContains("/srv/safebot/config/../notes.txt", "safebot/config/"));
    }
}
