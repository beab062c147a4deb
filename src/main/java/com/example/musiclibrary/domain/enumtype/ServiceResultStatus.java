package com.example.musiclibrary.domain.enumtype;

/**
 * Outcome of a lookup against an online provider.
 */
public enum ServiceResultStatus {

    /** The provider returned data. */
    SUCCESS,

    /** The provider answered, but has nothing for the query. */
    SUCCESS_NOT_FOUND,

    /** Network failure, timeout or 5xx; worth retrying later. */
    TEMPORARY_ERROR,

    /** Rate limit, bad credentials or similar; the provider is disabled for the session. */
    PERMANENT_ERROR
}
