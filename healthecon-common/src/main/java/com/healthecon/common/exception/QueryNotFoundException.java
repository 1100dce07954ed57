package com.healthecon.common.exception;

public class QueryNotFoundException extends RuntimeException {

    public QueryNotFoundException(String queryId) {
        super("Query not found: " + queryId);
    }
}
