package com.example.musiclibrary.common.exception;

import com.example.musiclibrary.api.response.ApiResponse;
import java.util.concurrent.RejectedExecutionException;
import javax.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ApiResponse<Void> handleBusinessException(BusinessException e) {
        log.info("Business exception code={} msg={}", e.getCode(), e.getMessage());
        return ApiResponse.fail(e.getCode(), e.getMessage(), e.getUserAction());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class, ConstraintViolationException.class})
    public ApiResponse<Void> handleValidationException(Exception e) {
        return ApiResponse.fail(BusinessException.CODE_BAD_REQUEST, "请求参数不合法");
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ApiResponse<Void> handleDuplicateKeyException(DuplicateKeyException e) {
        return ApiResponse.fail(BusinessException.CODE_CONFLICT, "数据重复，请检查唯一约束");
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ApiResponse<Void> handleRejectedExecution(RejectedExecutionException e) {
        log.warn("Library task queue is full", e);
        return ApiResponse.fail("503", "后台任务繁忙", "请稍后重试");
    }

    @ExceptionHandler(Exception.class)
    public ApiResponse<Void> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return ApiResponse.fail("500", "系统内部错误");
    }
}
