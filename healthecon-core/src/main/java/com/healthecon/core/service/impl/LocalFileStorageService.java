package com.healthecon.core.service.impl;

import com.healthecon.common.util.FileUtils;
import com.healthecon.core.service.FileStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.stream.Stream;

@Service
@Slf4j
public class LocalFileStorageService implements FileStorageService {
    
    private final Path storageDirectory;
    
    public LocalFileStorageService(@Value("${file.storage.directory:./bills}") String storageDirectory) {
        this.storageDirectory = Paths.get(storageDirectory);
    }
    
    @Override
    public Path saveFile(MultipartFile file, String billId) throws IOException {
        Files.createDirectories(storageDirectory);
        
        String extension = FileUtils.getFileExtension(file.getOriginalFilename());
        String fileName = billId + (extension.isEmpty() ? "" : "." + extension);
        Path target = storageDirectory.resolve(fileName);
        
        try (InputStream inputStream = file.getInputStream()) {
            Files.copy(inputStream, target, StandardCopyOption.REPLACE_EXISTING);
        }
        
        if (Files.size(target) == 0) {
            Files.deleteIfExists(target);
            throw new IOException("File was not properly saved: " + target);
        }
        
        log.info("[STORAGE] Bill file saved | billId={} | path={} | sizeBytes={}", billId, target, Files.size(target));
        return target;
    }
    
    @Override
    public void deleteFile(String billId) throws IOException {
        Optional<Path> existing = findByBillId(billId);
        if (existing.isPresent()) {
            Files.delete(existing.get());
            log.info("[STORAGE] Bill file deleted | billId={}", billId);
        }
    }
    
    private Optional<Path> findByBillId(String billId) throws IOException {
        if (!Files.isDirectory(storageDirectory)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(storageDirectory)) {
            return files
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.equals(billId) || name.startsWith(billId + ".");
                })
                .findFirst();
        }
    }
}
