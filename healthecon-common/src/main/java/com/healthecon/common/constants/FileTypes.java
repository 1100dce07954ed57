package com.healthecon.common.constants;

import java.util.Set;

public final class FileTypes {
    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
        "pdf", "png", "jpg", "jpeg", "txt"
    );
    
    public static final Set<String> PDF_TYPES = Set.of("pdf");
    public static final Set<String> IMAGE_TYPES = Set.of("png", "jpg", "jpeg");
    public static final Set<String> TEXT_TYPES = Set.of("txt");
    
    public static final long MAX_FILE_SIZE_BYTES = 50 * 1024 * 1024; // 50MB
    
    private FileTypes() {}
    
    public static boolean isSupported(String extension) {
        return extension != null && SUPPORTED_EXTENSIONS.contains(extension.toLowerCase());
    }
    
    public static String getCategory(String extension) {
        String ext = extension.toLowerCase();
        if (PDF_TYPES.contains(ext)) return "PDF";
        if (IMAGE_TYPES.contains(ext)) return "IMAGE";
        if (TEXT_TYPES.contains(ext)) return "TEXT";
        return "UNKNOWN";
    }
}
