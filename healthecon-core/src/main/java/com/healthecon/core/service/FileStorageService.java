package com.healthecon.core.service;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Storage for uploaded bill files. Files are keyed by bill id.
 */
public interface FileStorageService {
    
    /**
     * Save the upload as {@code <billId>.<ext>} and return where it landed.
     */
    Path saveFile(MultipartFile file, String billId) throws IOException;
    
    /**
     * Remove the file stored for {@code billId}. Does nothing when none is stored.
     */
    void deleteFile(String billId) throws IOException;
}
