package com.gbu.courseplatform.exception;

public class AlreadyEnrolledException extends BusinessException {

    public static final String MESSAGE = "You are already enrolled in this course";

    public AlreadyEnrolledException() {
        super("ALREADY_ENROLLED", MESSAGE);
    }
}
