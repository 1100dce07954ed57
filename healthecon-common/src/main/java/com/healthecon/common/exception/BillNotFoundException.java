package com.healthecon.common.exception;

public class BillNotFoundException extends RuntimeException {

    public BillNotFoundException(String billId) {
        super("Bill not found: " + billId);
    }
}
