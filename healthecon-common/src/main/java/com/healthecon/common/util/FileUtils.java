package com.healthecon.common.util;

import com.healthecon.common.constants.FileTypes;

public final class FileUtils {
    
    private FileUtils() {}
    
    public static String getFileExtension(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot == -1 || lastDot == filename.length() - 1) {
            return "";
        }
        return filename.substring(lastDot + 1).toLowerCase();
    }
    
    /**
     * Checks that an uploaded bill has a supported extension and fits the size limit.
     */
    public static boolean isValidBillFile(String filename, long fileSizeBytes) {
        if (filename == null || filename.isEmpty() || fileSizeBytes <= 0) {
            return false;
        }
        if (!FileTypes.isSupported(getFileExtension(filename))) {
            return false;
        }
        return fileSizeBytes <= FileTypes.MAX_FILE_SIZE_BYTES;
    }
    
    public static String sanitizeFileName(String filename) {
        if (filename == null) {
            return "unnamed";
        }
        return filename.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
