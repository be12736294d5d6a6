package com.bit.vote.exception;

/**
 * 质押投票业务异常：失败的调用不提交任何状态
 */
public class VotingException extends RuntimeException {

    private final ErrorType errorType;

    public VotingException(ErrorType errorType) {
        super("[" + errorType.getDesc() + "]");
        this.errorType = errorType;
    }

    public VotingException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public VotingException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
