package com.healthecon.core.store;

import com.healthecon.common.constants.ErrorKind;
import lombok.Value;

@Value
public class ErrorInfo {
    ErrorKind kind;
    String message;
}
