package com.gbu.courseplatform.modules.enrollment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {

    Optional<Enrollment> findByCourseIdAndStudentId(Long courseId, Long studentId);

    boolean existsByCourseIdAndStudentId(Long courseId, Long studentId);

    @Query("SELECT en FROM Enrollment en JOIN FETCH en.course c JOIN FETCH en.student " +
            "WHERE en.student.id = :studentId ORDER BY en.enrolledAt DESC, en.id ASC")
    List<Enrollment> findForStudent(@Param("studentId") Long studentId);

    @Query("SELECT en FROM Enrollment en JOIN FETCH en.course c JOIN FETCH en.student " +
            "WHERE c.teacher.id = :teacherId ORDER BY en.enrolledAt DESC, en.id ASC")
    List<Enrollment> findForTeacher(@Param("teacherId") Long teacherId);

    @Query("SELECT en FROM Enrollment en JOIN FETCH en.course c JOIN FETCH en.student " +
            "WHERE c.id = :courseId ORDER BY en.enrolledAt DESC, en.id ASC")
    List<Enrollment> findForCourse(@Param("courseId") Long courseId);

    /** Serializes completion events of a single enrollment. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT en FROM Enrollment en WHERE en.id = :id")
    Optional<Enrollment> findByIdForUpdate(@Param("id") Long id);
}
