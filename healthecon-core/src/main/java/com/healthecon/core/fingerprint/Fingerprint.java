package com.healthecon.core.fingerprint;

import lombok.Value;

import java.util.List;

/**
 * Stable identity of a query: digest of the normalized text and the sorted context references.
 */
@Value
public class Fingerprint {
    String value;
    String normalizedText;
    List<String> sortedRefs;
    
    public String shortValue() {
        return value.substring(0, Math.min(12, value.length()));
    }
}
