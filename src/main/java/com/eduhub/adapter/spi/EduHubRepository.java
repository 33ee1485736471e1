package com.eduhub.adapter.spi;

import org.bson.BsonValue;
import org.bson.Document;

import java.util.List;
import java.util.Optional;

/**
 * CRUD operations and reporting queries over the EduHub collections.
 *
 * <p>Database failures do not propagate: they are logged and the operation returns its neutral
 * value ({@link Optional#empty()}, {@code false} or an empty list). Write operations also return
 * {@code false} when no document matched.
 */
public interface EduHubRepository {

    // Inserts

    /**
     * Inserts a user with {@code role} forced to {@code "student"}.
     */
    Optional<BsonValue> insertStudent(Document student);

    Optional<BsonValue> insertCourse(Document course);

    Optional<BsonValue> insertLesson(Document lesson);

    /**
     * Enrolls a student in a course. The enrollment starts with no progress and is dated now.
     */
    Optional<BsonValue> registerStudent(String studentId, String courseId);

    // Reads

    List<Document> findActiveStudents();

    /**
     * Courses, each with its instructor's user document under {@code instructor}.
     */
    List<Document> findCourseDetails();

    List<Document> findCoursesByCategory(String category);

    List<Document> findStudentsEnrolledInCourse(String courseId);

    /**
     * Courses whose title contains {@code text}, ignoring case.
     */
    List<Document> searchCoursesByTitle(String text);

    List<Document> findCoursesByPriceRange(Number minPrice, Number maxPrice);

    /**
     * Users who joined within the last {@code months} months (30 days each).
     */
    List<Document> findRecentSignups(int months);

    /**
     * Courses tagged with at least one of {@code tags}.
     */
    List<Document> findCoursesWithTags(List<String> tags);

    /**
     * Assignments due between now and {@code weeks} weeks from now.
     */
    List<Document> findUpcomingAssignments(int weeks);

    // Updates and deletes

    /**
     * Replaces the user's {@code profile} sub-document.
     */
    boolean updateProfile(String userId, Document profile);

    boolean publishCourse(String courseId);

    /**
     * Sets the grade of a submission, and its feedback when {@code feedback} is not null.
     */
    boolean updateAssignmentGrade(String submissionId, Number grade, String feedback);

    /**
     * Adds the tags the course does not already carry.
     */
    boolean addTagsToCourse(String courseId, List<String> tags);

    /**
     * Soft-deletes a user by clearing {@code isActive}.
     */
    boolean deactivateUser(String userId);

    boolean deleteEnrollment(String enrollmentId);

    /**
     * Detaches a lesson from its course by blanking its {@code courseId}.
     */
    boolean removeLessonFromCourse(String lessonId, String courseId);

    // Aggregations

    List<Document> enrollmentMetrics();

    /**
     * Average rating over all courses as {@code {averageRating, count}};
     * {@code {averageRating: null, count: 0}} when there is nothing to average.
     */
    Document averageCourseRating();

    List<Document> coursesByCategory();

    List<Document> averageGradePerStudent();

    List<Document> courseCompletionRate();

    List<Document> topPerformingStudents(int limit);

    List<Document> studentsPerInstructor();

    List<Document> averageRatingPerInstructor();

    List<Document> revenuePerInstructor();

    List<Document> monthlyEnrollmentTrend();

    List<Document> mostPopularCategories(int limit);

    List<Document> studentEngagementMetrics();
}
