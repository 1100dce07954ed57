package com.healthecon.core.store;

import com.healthecon.common.exception.ValidationException;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;

/**
 * Keyset cursor over (createdAt, id): the position of the last record on the previous page.
 * Encoded as unpadded Base64URL of {@code <epochSecond>.<nanos>|<id>}.
 */
@Value
public class PageToken {
    
    private static final char SEPARATOR = '|';
    
    Instant createdAt;
    String id;
    
    public String encode() {
        String raw = createdAt.getEpochSecond() + "." + createdAt.getNano() + SEPARATOR + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
    
    public static PageToken decode(String token) {
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed page token", e);
        }
        
        int separator = raw.indexOf(SEPARATOR);
        if (separator <= 0 || separator == raw.length() - 1) {
            throw new ValidationException("Malformed page token");
        }
        
        String timestamp = raw.substring(0, separator);
        int dot = timestamp.indexOf('.');
        if (dot <= 0) {
            throw new ValidationException("Malformed page token");
        }
        try {
            long seconds = Long.parseLong(timestamp.substring(0, dot));
            long nanos = Long.parseLong(timestamp.substring(dot + 1));
            if (nanos < 0 || nanos > 999_999_999L) {
                throw new ValidationException("Malformed page token");
            }
            return new PageToken(Instant.ofEpochSecond(seconds, nanos), raw.substring(separator + 1));
        } catch (NumberFormatException | DateTimeException e) {
            throw new ValidationException("Malformed page token", e);
        }
    }
}
