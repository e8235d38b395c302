package com.hotelbooking.common.exception;

/**
 * An entity looked up by id does not exist.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String entity, Object id) {
        this(entity, id, ERROR_CODE);
    }

    /** For services that report a missing entity under their own error code. */
    protected ResourceNotFoundException(String entity, Object id, String errorCode) {
        super(entity + " " + id + " does not exist", errorCode);
    }
}
