package com.healthecon.llm.service;

import com.healthecon.common.constants.ErrorKind;
import lombok.Getter;

/**
 * Terminal failure of a reasoning invocation, after retries where the failure was transient.
 */
@Getter
public class ExternalServiceException extends RuntimeException {
    
    private final ErrorKind kind;
    private final int attempts;
    // classification of the final attempt; differs from kind when retries ran out
    private final ErrorKind lastAttemptKind;
    
    public ExternalServiceException(String message, ErrorKind kind, int attempts, ErrorKind lastAttemptKind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.attempts = attempts;
        this.lastAttemptKind = lastAttemptKind;
    }
}
