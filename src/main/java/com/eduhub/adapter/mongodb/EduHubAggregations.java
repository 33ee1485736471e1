package com.eduhub.adapter.mongodb;

import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.List;

/**
 * Aggregation pipelines behind the EduHub reporting queries.
 * Each method names the collection the pipeline must run against.
 */
public final class EduHubAggregations {

    private EduHubAggregations() {}

    /**
     * On {@code courses}: each course joined with its instructor.
     */
    public static List<Bson> courseDetails() {
        return List.of(
                Aggregates.lookup("users", "instructorId", "userId", "instructor"),
                Aggregates.unwind("$instructor")
        );
    }

    /**
     * On {@code enrollments}: number of enrollments per course, with the course title.
     */
    public static List<Bson> enrollmentMetrics() {
        return List.of(
                Aggregates.group("$courseId", Accumulators.sum("totalEnrollments", 1)),
                Aggregates.lookup("courses", "_id", "courseId", "course"),
                Aggregates.unwind("$course"),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("courseId", "$_id"),
                        Projections.computed("courseTitle", "$course.title"),
                        Projections.include("totalEnrollments")))
        );
    }

    /**
     * On {@code courses}: average rating over all courses, as a single document.
     */
    public static List<Bson> averageCourseRating() {
        return List.of(
                Aggregates.group(null,
                        Accumulators.avg("averageRating", "$rating"),
                        Accumulators.sum("count", 1)),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.include("averageRating", "count")))
        );
    }

    /**
     * On {@code courses}: course titles, average rating and course count per category.
     */
    public static List<Bson> coursesByCategory() {
        return List.of(
                Aggregates.group("$category",
                        Accumulators.push("courses", "$title"),
                        Accumulators.avg("averageRating", "$rating"),
                        Accumulators.sum("totalCourses", 1)),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("category", "$_id"),
                        Projections.include("courses", "averageRating", "totalCourses")))
        );
    }

    /**
     * On {@code submissions}: average grade and submission count per student.
     */
    public static List<Bson> averageGradePerStudent() {
        return List.of(
                Aggregates.group("$studentId",
                        Accumulators.avg("averageGrade", "$grade"),
                        Accumulators.sum("submissions", 1)),
                lookupUser("student"),
                Aggregates.unwind("$student"),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("studentId", "$_id"),
                        Projections.computed("studentName", fullName("student")),
                        Projections.include("averageGrade", "submissions")))
        );
    }

    /**
     * On {@code enrollments}: share of completed enrollments per course.
     */
    public static List<Bson> courseCompletionRate() {
        Document completionRate = new Document("$cond", List.of(
                new Document("$eq", List.of("$total", 0)),
                0,
                new Document("$divide", List.of("$completed", "$total"))));

        return List.of(
                Aggregates.group("$courseId",
                        Accumulators.sum("total", 1),
                        Accumulators.sum("completed", new Document("$cond", List.of("$completed", 1, 0)))),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("courseId", "$_id"),
                        Projections.computed("completionRate", completionRate),
                        Projections.computed("totalEnrolled", "$total")))
        );
    }

    /**
     * On {@code submissions}: the {@code limit} students with the best average grade.
     */
    public static List<Bson> topPerformingStudents(int limit) {
        return List.of(
                Aggregates.group("$studentId",
                        Accumulators.avg("averageGrade", "$grade"),
                        Accumulators.sum("submissions", 1)),
                Aggregates.sort(Sorts.descending("averageGrade")),
                Aggregates.limit(limit),
                lookupUser("student"),
                Aggregates.unwind("$student"),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("studentId", "$_id"),
                        Projections.computed("studentName", fullName("student")),
                        Projections.include("averageGrade", "submissions")))
        );
    }

    /**
     * On {@code enrollments}: distinct students and courses per instructor.
     */
    public static List<Bson> studentsPerInstructor() {
        return List.of(
                Aggregates.lookup("courses", "courseId", "courseId", "course"),
                Aggregates.unwind("$course"),
                Aggregates.group("$course.instructorId",
                        Accumulators.addToSet("students", "$studentId"),
                        Accumulators.addToSet("coursesTaught", "$course.courseId")),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("instructorId", "$_id"),
                        Projections.computed("totalStudents", new Document("$size", "$students")),
                        Projections.include("coursesTaught")))
        );
    }

    /**
     * On {@code courses}: average rating and course titles per instructor.
     */
    public static List<Bson> averageRatingPerInstructor() {
        return List.of(
                Aggregates.group("$instructorId",
                        Accumulators.avg("averageRating", "$rating"),
                        Accumulators.push("courses", "$title")),
                lookupUser("instructor"),
                Aggregates.unwind("$instructor"),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("instructorId", "$_id"),
                        Projections.computed("instructorName", fullName("instructor")),
                        Projections.include("averageRating", "courses")))
        );
    }

    /**
     * On {@code enrollments}: sum of course prices over all enrollments, per instructor.
     */
    public static List<Bson> revenuePerInstructor() {
        return List.of(
                Aggregates.lookup("courses", "courseId", "courseId", "course"),
                Aggregates.unwind("$course"),
                Aggregates.group("$course.instructorId",
                        Accumulators.sum("revenue", "$course.price"),
                        Accumulators.addToSet("courses", "$course.courseId")),
                lookupUser("instructor"),
                Aggregates.unwind("$instructor"),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("instructorId", "$_id"),
                        Projections.computed("instructorName", fullName("instructor")),
                        Projections.include("revenue", "courses")))
        );
    }

    /**
     * On {@code enrollments}: enrollments per calendar month, oldest first.
     */
    public static List<Bson> monthlyEnrollmentTrend() {
        Document month = new Document("year", new Document("$year", "$enrollmentDate"))
                .append("month", new Document("$month", "$enrollmentDate"));

        return List.of(
                Aggregates.group(month, Accumulators.sum("totalEnrollments", 1)),
                Aggregates.sort(Sorts.ascending("_id.year", "_id.month")),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("year", "$_id.year"),
                        Projections.computed("month", "$_id.month"),
                        Projections.include("totalEnrollments")))
        );
    }

    /**
     * On {@code courses}: the {@code limit} categories with the most courses.
     */
    public static List<Bson> mostPopularCategories(int limit) {
        return List.of(
                Aggregates.group("$category", Accumulators.sum("totalCourses", 1)),
                Aggregates.sort(Sorts.descending("totalCourses")),
                Aggregates.limit(limit),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("category", "$_id"),
                        Projections.include("totalCourses")))
        );
    }

    /**
     * On {@code submissions}: submission count and average grade per student.
     */
    public static List<Bson> studentEngagementMetrics() {
        return List.of(
                Aggregates.group("$studentId",
                        Accumulators.sum("totalSubmissions", 1),
                        Accumulators.avg("averageGrade", "$grade")),
                lookupUser("student"),
                Aggregates.unwind("$student"),
                Aggregates.project(Projections.fields(
                        Projections.excludeId(),
                        Projections.computed("studentId", "$_id"),
                        Projections.computed("studentName", fullName("student")),
                        Projections.include("totalSubmissions", "averageGrade")))
        );
    }

    private static Bson lookupUser(String as) {
        return Aggregates.lookup("users", "_id", "userId", as);
    }

    private static Document fullName(String field) {
        return new Document("$concat", List.of("$" + field + ".firstName", " ", "$" + field + ".lastName"));
    }
}
