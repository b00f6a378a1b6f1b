package com.gbu.courseplatform.modules.course;

import com.gbu.courseplatform.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the course catalogue. Courses are addressed either by
 * slug or by numeric id; a slug is tried first so that numeric-looking slugs
 * still resolve to themselves.
 */
@Service
@RequiredArgsConstructor
public class CourseLookupService {

    private final CourseRepository courseRepository;
    private final LessonRepository lessonRepository;

    @Transactional(readOnly = true)
    public Course getCourse(String courseRef) {
        if (courseRef == null || courseRef.isBlank()) {
            throw new ResourceNotFoundException("Course", String.valueOf(courseRef));
        }
        Optional<Course> bySlug = courseRepository.findBySlug(courseRef);
        if (bySlug.isPresent()) {
            return bySlug.get();
        }
        Long id = parseId(courseRef);
        if (id == null) {
            throw new ResourceNotFoundException("Course", courseRef);
        }
        return courseRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Course", courseRef));
    }

    @Transactional(readOnly = true)
    public List<Lesson> listLessons(Long courseId) {
        return lessonRepository.findByCourseIdOrderByOrderIndexAsc(courseId);
    }

    private static Long parseId(String value) {
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
