package com.gbu.courseplatform.exception;

public class InvalidLessonException extends BusinessException {

    public InvalidLessonException(Long lessonId) {
        super("INVALID_LESSON", "Lesson not found in this course: " + lessonId);
    }
}
