package com.omr.common.exception;

/**
 * 标准答案不合法：选项超出 1~4，或长度与调用方预期不一致。
 */
public class AnswerKeyMismatchException extends OmrException {

    public AnswerKeyMismatchException(String message) {
        super("ANSWER_KEY_MISMATCH", message);
    }

    public AnswerKeyMismatchException(String message, Throwable cause) {
        super("ANSWER_KEY_MISMATCH", message, cause);
    }
}
