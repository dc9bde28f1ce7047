package com.example.userservice.exception;

import lombok.Getter;

/**
 * Base exception class for all business exceptions.
 * The code is stable and meant for callers mapping failures to responses.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final String code;

    protected BaseException(String code, String message) {
        super(message);
        this.code = code;
    }
}
