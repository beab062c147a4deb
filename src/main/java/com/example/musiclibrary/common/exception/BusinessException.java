package com.example.musiclibrary.common.exception;

public class BusinessException extends RuntimeException {

    public static final String CODE_BAD_REQUEST = "400";
    public static final String CODE_NOT_FOUND = "404";
    public static final String CODE_CONFLICT = "409";

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        super(message);
        this.code = code;
        this.userAction = userAction;
    }

    public static BusinessException notFound(String message) {
        return new BusinessException(CODE_NOT_FOUND, message);
    }

    public static BusinessException conflict(String message, String userAction) {
        return new BusinessException(CODE_CONFLICT, message, userAction);
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
