package com.healthecon.common.util;

import com.healthecon.common.constants.FileTypes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileUtilsTest {
    
    @Test
    void shouldExtractLowercaseExtension() {
        assertThat(FileUtils.getFileExtension("Hospital Bill.PDF")).isEqualTo("pdf");
        assertThat(FileUtils.getFileExtension("archive.tar.gz")).isEqualTo("gz");
        assertThat(FileUtils.getFileExtension("README")).isEmpty();
        assertThat(FileUtils.getFileExtension("trailing.")).isEmpty();
        assertThat(FileUtils.getFileExtension(null)).isEmpty();
    }
    
    @Test
    void shouldAcceptOnlySupportedBillFilesWithinLimit() {
        assertThat(FileUtils.isValidBillFile("bill.pdf", 1024)).isTrue();
        assertThat(FileUtils.isValidBillFile("scan.JPEG", 1024)).isTrue();
        assertThat(FileUtils.isValidBillFile("notes.docx", 1024)).isFalse();
        assertThat(FileUtils.isValidBillFile("bill.pdf", 0)).isFalse();
        assertThat(FileUtils.isValidBillFile("bill.pdf", FileTypes.MAX_FILE_SIZE_BYTES)).isTrue();
        assertThat(FileUtils.isValidBillFile("bill.pdf", FileTypes.MAX_FILE_SIZE_BYTES + 1)).isFalse();
    }
    
    @Test
    void shouldSanitizeFileNames() {
        assertThat(FileUtils.sanitizeFileName("ER visit (March).pdf")).isEqualTo("ER_visit__March_.pdf");
        assertThat(FileUtils.sanitizeFileName(null)).isEqualTo("unnamed");
    }
}
