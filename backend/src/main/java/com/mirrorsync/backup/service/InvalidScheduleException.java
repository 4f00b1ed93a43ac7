package com.mirrorsync.backup.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidScheduleException extends RuntimeException {
    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
