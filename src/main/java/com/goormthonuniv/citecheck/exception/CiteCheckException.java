package com.goormthonuniv.citecheck.exception;

/** 서비스 공통 런타임 예외 */
public class CiteCheckException extends RuntimeException {

    public CiteCheckException(String message) {
        super(message);
    }

    public CiteCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
