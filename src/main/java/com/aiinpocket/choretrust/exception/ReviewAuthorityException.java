package com.aiinpocket.choretrust.exception;

/**
 * 操作者不是該任務的唯一寫入者（非認領的孩子，或沒有審核權限的家長）。
 */
public class ReviewAuthorityException extends RuntimeException {

    public ReviewAuthorityException(String message) {
        super(message);
    }
}
