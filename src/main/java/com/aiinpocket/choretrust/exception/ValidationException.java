package com.aiinpocket.choretrust.exception;

/**
 * 輸入不合法（金額、空白原因、缺少照片、狀態不允許此轉換等）。
 * 在任何異動之前拋出，呼叫端可直接把訊息顯示給使用者。
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
