package com.healthecon.core.fingerprint;

import com.healthecon.common.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Builds the cache and de-duplication key of a query. Pure: no I/O, no state.
 */
@Component
public class FingerprintBuilder {
    
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");
    private static final String SEPARATOR = "\0";
    
    public Fingerprint fingerprint(String rawText, Collection<String> contextRefs) {
        String normalizedText = normalize(rawText);
        if (normalizedText.isEmpty()) {
            throw new ValidationException("Query text must not be empty");
        }
        
        List<String> sortedRefs = sortRefs(contextRefs);
        
        StringBuilder material = new StringBuilder(normalizedText);
        material.append(SEPARATOR).append(String.join(SEPARATOR, sortedRefs));
        
        return new Fingerprint(sha256Hex(material.toString()), normalizedText, sortedRefs);
    }
    
    public String normalize(String rawText) {
        if (rawText == null) {
            return "";
        }
        // Collapse before strip(): strip() keeps no-break spaces
        return WHITESPACE.matcher(rawText).replaceAll(" ").strip().toLowerCase(Locale.ROOT);
    }
    
    /**
     * Trims, de-duplicates and sorts bill ids so attachment order never changes identity.
     */
    public List<String> sortRefs(Collection<String> contextRefs) {
        if (contextRefs == null || contextRefs.isEmpty()) {
            return List.of();
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String ref : contextRefs) {
            if (ref == null || ref.isBlank()) {
                throw new ValidationException("Bill reference must not be blank");
            }
            sorted.add(ref.strip());
        }
        return List.copyOf(sorted);
    }
    
    private static String sha256Hex(String material) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
