package com.example.musiclibrary.domain.model;

import com.example.musiclibrary.domain.enumtype.ServiceResultStatus;
import lombok.Data;

@Data
public class ServiceResult<T> {

    private final ServiceResultStatus status;

    private final T data;

    private final String message;

    public static <T> ServiceResult<T> success(T data) {
        return new ServiceResult<>(ServiceResultStatus.SUCCESS, data, null);
    }

    public static <T> ServiceResult<T> notFound() {
        return new ServiceResult<>(ServiceResultStatus.SUCCESS_NOT_FOUND, null, null);
    }

    public static <T> ServiceResult<T> temporaryError(String message) {
        return new ServiceResult<>(ServiceResultStatus.TEMPORARY_ERROR, null, message);
    }

    public static <T> ServiceResult<T> permanentError(String message) {
        return new ServiceResult<>(ServiceResultStatus.PERMANENT_ERROR, null, message);
    }

    public boolean isSuccess() {
        return status == ServiceResultStatus.SUCCESS && data != null;
    }

    /**
     * A conclusive answer is one that should not be retried later.
     */
    public boolean isConclusive() {
        return status != ServiceResultStatus.TEMPORARY_ERROR;
    }
}
