package com.bit.vote.api;

import com.bit.vote.exception.ErrorType;
import com.bit.vote.exception.VotingException;
import com.bit.vote.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 异常统一转成 Result
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(VotingException.class)
    public Result<Void> handleVoting(VotingException e) {
        log.info("业务拒绝: {}", e.getMessage());
        return Result.error(e.getErrorType().getCode(), e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public Result<Void> handleBadRequest(Exception e) {
        log.info("参数非法: {}", e.getMessage());
        return Result.error(ErrorType.INVALID_ARGUMENT.getCode(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Result<Void> handleOther(Exception e) {
        log.error("接口异常", e);
        return Result.error(e.getMessage());
    }
}
