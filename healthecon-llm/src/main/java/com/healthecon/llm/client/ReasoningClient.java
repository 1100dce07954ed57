package com.healthecon.llm.client;

import com.healthecon.common.constants.ErrorKind;
import com.healthecon.llm.model.BillContent;
import com.healthecon.llm.model.ReasoningRequest;
import com.healthecon.llm.model.ReasoningResponse;

import java.time.Duration;

/**
 * One attempt against the external reasoning service. Implementations do not retry;
 * every failure is reported as a classified {@link ReasoningServiceException}.
 * An attempt that outlives {@code timeout} is cancelled and reported as {@link ErrorKind#TIMEOUT}.
 */
public interface ReasoningClient {

    ReasoningResponse complete(ReasoningRequest request, Duration timeout) throws ReasoningServiceException;

    /**
     * Short summary of an uploaded bill: vendor, total amount, date and main items.
     */
    ReasoningResponse describeBill(BillContent bill, Duration timeout) throws ReasoningServiceException;

    String getDefaultModel();

    boolean isConfigured();

    class ReasoningServiceException extends RuntimeException {
        private final ErrorKind kind;
        private final int statusCode;

        public ReasoningServiceException(String message, ErrorKind kind, int statusCode) {
            super(message);
            this.kind = kind;
            this.statusCode = statusCode;
        }

        public ReasoningServiceException(String message, ErrorKind kind, int statusCode, Throwable cause) {
            super(message, cause);
            this.kind = kind;
            this.statusCode = statusCode;
        }

        public ErrorKind getKind() { return kind; }
        public int getStatusCode() { return statusCode; }
        public boolean isTransient() { return kind.isTransient(); }
    }
}
