package com.aiinpocket.choretrust.exception;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String kind, Object id) {
        return new NotFoundException("找不到" + kind + ": " + id);
    }
}
