package com.healthecon.common.constants;

public enum BillStatus {
    PENDING,
    PROCESSED
}
