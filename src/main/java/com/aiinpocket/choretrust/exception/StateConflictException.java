package com.aiinpocket.choretrust.exception;

/**
 * 呼叫端讀到的是舊狀態（例如對已審核的任務再次審核），應重新讀取後重試。
 */
public class StateConflictException extends IllegalStateException {

    public StateConflictException(String message) {
        super(message);
    }
}
