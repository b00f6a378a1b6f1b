package com.gbu.courseplatform.modules.enrollment;

import com.gbu.courseplatform.exception.AlreadyEnrolledException;
import com.gbu.courseplatform.exception.InvalidLessonException;
import com.gbu.courseplatform.modules.course.Course;
import com.gbu.courseplatform.modules.course.CourseRepository;
import com.gbu.courseplatform.modules.course.Lesson;
import com.gbu.courseplatform.modules.course.LessonRepository;
import com.gbu.courseplatform.modules.enrollment.dto.CompleteLessonResponse;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentDto;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentProgressDto;
import com.gbu.courseplatform.modules.user.User;
import com.gbu.courseplatform.modules.user.UserRepository;
import com.gbu.courseplatform.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class EnrollmentFlowIntegrationTest {

    private static final int THREADS = 8;

    @Autowired
    private EnrollmentService enrollmentService;
    @Autowired
    private LessonProgressService lessonProgressService;
    @Autowired
    private UserRepository userRepository;
    @Autowired
    private CourseRepository courseRepository;
    @Autowired
    private LessonRepository lessonRepository;
    @Autowired
    private EnrollmentRepository enrollmentRepository;
    @Autowired
    private LessonProgressRepository lessonProgressRepository;

    private User teacher;
    private AuthenticatedUser alice;

    @BeforeEach
    void setUp() {
        lessonProgressRepository.deleteAll();
        enrollmentRepository.deleteAll();
        lessonRepository.deleteAll();
        courseRepository.deleteAll();
        userRepository.deleteAll();

        teacher = userRepository.save(User.builder()
                .name("Guido").email("guido@gbu.ac.in").role(User.Role.TEACHER).build());
        User student = userRepository.save(User.builder()
                .name("Alice").email("alice@gbu.ac.in").role(User.Role.STUDENT).build());
        alice = new AuthenticatedUser(student.getId(), student.getEmail(), User.Role.STUDENT);
    }

    @Test
    @DisplayName("enroll, complete lessons one by one, repeat a completion, finish the course")
    void fullCourseScenario() {
        Course course = course("python-fundamentals");
        List<Lesson> lessons = lessons(course, 5);

        EnrollmentDto enrollment = enrollmentService.enroll(alice, "python-fundamentals");
        assertThat(enrollment.getProgressPercentage()).isZero();
        Long enrollmentId = enrollment.getId();
        assertThat(enrollmentService.listEnrollments(alice))
                .singleElement()
                .extracting(EnrollmentDto::getEnrolledAt)
                .isEqualTo(enrollment.getEnrolledAt());

        CompleteLessonResponse first = lessonProgressService.completeLesson(alice, enrollmentId,
                lessons.get(0).getId());
        assertThat(first.getMessage()).isEqualTo(LessonProgressService.MARKED_COMPLETE);
        assertThat(first.getEnrollmentProgressPercentage()).isEqualTo(20);

        CompleteLessonResponse repeat = lessonProgressService.completeLesson(alice, enrollmentId,
                lessons.get(0).getId());
        CompleteLessonResponse repeatAgain = lessonProgressService.completeLesson(alice, enrollmentId,
                lessons.get(0).getId());
        assertThat(repeat.getMessage()).isEqualTo(LessonProgressService.ALREADY_COMPLETED);
        assertThat(repeat.getEnrollmentProgressPercentage()).isEqualTo(20);
        assertThat(repeat.getProgress().getCompletedAt()).isEqualTo(first.getProgress().getCompletedAt());
        assertThat(repeatAgain.getProgress().getCompletedAt()).isEqualTo(first.getProgress().getCompletedAt());
        assertThat(lessonProgressRepository.findByEnrollmentIdAndLessonId(enrollmentId, lessons.get(0).getId())
                .orElseThrow().getCompletedAt()).isEqualTo(first.getProgress().getCompletedAt());
        assertThat(lessonProgressRepository.countByEnrollmentId(enrollmentId)).isEqualTo(1);

        CompleteLessonResponse last = null;
        for (Lesson lesson : lessons.subList(1, 5)) {
            last = lessonProgressService.completeLesson(alice, enrollmentId, lesson.getId());
        }
        assertThat(last.getEnrollmentProgressPercentage()).isEqualTo(100);
        assertThat(last.isCourseCompleted()).isTrue();

        EnrollmentProgressDto progress = lessonProgressService.getProgress(alice, enrollmentId);
        assertThat(progress.getPercentage()).isEqualTo(100);
        assertThat(progress.getCompletedLessonIds())
                .containsExactlyElementsOf(lessons.stream().map(Lesson::getId).toList());

        Enrollment stored = enrollmentRepository.findById(enrollmentId).orElseThrow();
        assertThat(stored.getCompleted()).isTrue();
        assertThat(stored.getCompletedAt()).isNotNull();
        assertThat(enrollmentService.getEnrollment(alice, enrollmentId).getEnrollment().getCompletedAt())
                .isEqualTo(stored.getCompletedAt());
    }

    @Test
    @DisplayName("concurrent enroll requests from one student create exactly one enrollment")
    void concurrentEnroll_exactlyOneSucceeds() throws Exception {
        lessons(course("python-fundamentals"), 2);

        AtomicInteger created = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Throwable> unexpected = runConcurrently(() -> {
            try {
                enrollmentService.enroll(alice, "python-fundamentals");
                created.incrementAndGet();
            } catch (AlreadyEnrolledException e) {
                rejected.incrementAndGet();
            }
        });

        assertThat(unexpected).isEmpty();
        assertThat(created.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(THREADS - 1);
        assertThat(enrollmentRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent completions of the same lesson leave one row and one first completion")
    void concurrentCompletion_converges() throws Exception {
        Course course = course("python-fundamentals");
        List<Lesson> lessons = lessons(course, 4);
        Long enrollmentId = enrollmentService.enroll(alice, "python-fundamentals").getId();
        Long lessonId = lessons.get(2).getId();

        AtomicInteger marked = new AtomicInteger();
        List<Integer> percentages = new ArrayList<>();
        List<Throwable> unexpected = runConcurrently(() -> {
            CompleteLessonResponse response = lessonProgressService.completeLesson(alice, enrollmentId, lessonId);
            if (LessonProgressService.MARKED_COMPLETE.equals(response.getMessage())) {
                marked.incrementAndGet();
            }
            synchronized (percentages) {
                percentages.add(response.getEnrollmentProgressPercentage());
            }
        });

        assertThat(unexpected).isEmpty();
        assertThat(marked.get()).isEqualTo(1);
        assertThat(percentages).hasSize(THREADS).containsOnly(25);
        assertThat(lessonProgressRepository.countByEnrollmentId(enrollmentId)).isEqualTo(1);
    }

    @Test
    @DisplayName("two of three lessons done reports 66, not 67")
    void percentageIsTruncated() {
        Course course = course("three-lessons");
        List<Lesson> lessons = lessons(course, 3);
        Long enrollmentId = enrollmentService.enroll(alice, "three-lessons").getId();

        lessonProgressService.completeLesson(alice, enrollmentId, lessons.get(0).getId());
        CompleteLessonResponse response = lessonProgressService.completeLesson(alice, enrollmentId,
                lessons.get(2).getId());

        assertThat(response.getEnrollmentProgressPercentage()).isEqualTo(66);
        assertThat(response.isCourseCompleted()).isFalse();
    }

    @Test
    @DisplayName("a course without lessons reports 0")
    void emptyCourseReportsZero() {
        course("empty-course");

        EnrollmentDto enrollment = enrollmentService.enroll(alice, "empty-course");

        assertThat(enrollment.getProgressPercentage()).isZero();
        assertThat(enrollmentService.getStatus(alice, "empty-course").getProgressPercentage()).isZero();
        assertThat(lessonProgressService.getProgress(alice, enrollment.getId()).getTotalLessons()).isZero();
    }

    @Test
    @DisplayName("a lesson from another course is rejected and nothing is recorded")
    void foreignLessonRejected() {
        Course course = course("python-fundamentals");
        lessons(course, 2);
        Course other = course("rust-basics");
        Lesson foreign = lessons(other, 1).get(0);
        Long enrollmentId = enrollmentService.enroll(alice, "python-fundamentals").getId();

        assertThatThrownBy(() -> lessonProgressService.completeLesson(alice, enrollmentId, foreign.getId()))
                .isInstanceOf(InvalidLessonException.class);
        assertThat(lessonProgressRepository.count()).isZero();
        assertThat(lessonProgressService.getProgress(alice, enrollmentId).getPercentage()).isZero();
    }

    @Test
    @DisplayName("lessons added after completion lower the percentage on the next read")
    void percentageFollowsLessonCount() {
        Course course = course("python-fundamentals");
        List<Lesson> lessons = lessons(course, 2);
        Long enrollmentId = enrollmentService.enroll(alice, "python-fundamentals").getId();
        lessonProgressService.completeLesson(alice, enrollmentId, lessons.get(0).getId());
        lessonProgressService.completeLesson(alice, enrollmentId, lessons.get(1).getId());

        lessonRepository.save(Lesson.builder().course(course).title("Bonus").orderIndex(3).build());
        lessonRepository.save(Lesson.builder().course(course).title("Bonus 2").orderIndex(4).build());

        assertThat(lessonProgressService.getProgress(alice, enrollmentId).getPercentage()).isEqualTo(50);
        assertThat(enrollmentService.listEnrollments(alice))
                .singleElement()
                .extracting(EnrollmentDto::getProgressPercentage)
                .isEqualTo(50);
    }

    @Test
    @DisplayName("enrollments are listed newest first, equal enrollment times by ascending id")
    void listingOrder() {
        User student = userRepository.findById(alice.getId()).orElseThrow();
        Instant earlier = Instant.parse("2026-09-01T08:00:00Z");
        Instant later = Instant.parse("2026-09-02T08:00:00Z");
        Enrollment first = enrollmentRepository.save(Enrollment.builder()
                .student(student).course(course("course-a")).enrolledAt(earlier).build());
        Enrollment newest = enrollmentRepository.save(Enrollment.builder()
                .student(student).course(course("course-b")).enrolledAt(later).build());
        Enrollment sameTime = enrollmentRepository.save(Enrollment.builder()
                .student(student).course(course("course-c")).enrolledAt(earlier).build());
        AuthenticatedUser teacherPrincipal = new AuthenticatedUser(teacher.getId(), teacher.getEmail(),
                User.Role.TEACHER);

        assertThat(enrollmentService.listForStudent(alice.getId()))
                .extracting(EnrollmentDto::getId)
                .containsExactly(newest.getId(), first.getId(), sameTime.getId());
        assertThat(enrollmentService.listEnrollments(alice))
                .extracting(EnrollmentDto::getId)
                .containsExactly(newest.getId(), first.getId(), sameTime.getId());
        assertThat(enrollmentService.listEnrollments(teacherPrincipal))
                .extracting(EnrollmentDto::getId)
                .containsExactly(newest.getId(), first.getId(), sameTime.getId());
    }

    private Course course(String slug) {
        return courseRepository.save(Course.builder()
                .title(slug).slug(slug).teacher(teacher).isPublished(true).build());
    }

    private List<Lesson> lessons(Course course, int count) {
        List<Lesson> lessons = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            lessons.add(lessonRepository.save(Lesson.builder()
                    .course(course).title("Lesson " + i).orderIndex(i).build()));
        }
        return lessons;
    }

    private List<Throwable> runConcurrently(Runnable task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                task.run();
                return null;
            }));
        }
        start.countDown();

        List<Throwable> failures = new ArrayList<>();
        for (Future<?> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            }
        }
        pool.shutdown();
        return failures;
    }
}
