package com.eduhub.adapter.mongodb;

import com.eduhub.adapter.spi.EduHubCollection;
import com.eduhub.adapter.spi.EduHubConnection;
import com.eduhub.adapter.spi.EduHubRepository;
import com.eduhub.adapter.spi.OperationType;
import com.eduhub.schema.SchemaCatalog;
import com.eduhub.util.TimeSource;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import static com.eduhub.adapter.spi.EduHubCollection.ASSIGNMENTS;
import static com.eduhub.adapter.spi.EduHubCollection.COURSES;
import static com.eduhub.adapter.spi.EduHubCollection.ENROLLMENTS;
import static com.eduhub.adapter.spi.EduHubCollection.LESSONS;
import static com.eduhub.adapter.spi.EduHubCollection.SUBMISSIONS;
import static com.eduhub.adapter.spi.EduHubCollection.USERS;

/**
 * MongoDB implementation of {@link EduHubRepository}.
 *
 * <p>When built with a {@link SchemaCatalog}, inserted documents have their date fields converted
 * from ISO-8601 strings first, the same way seeded documents are.
 */
public class MongoDBEduHubRepository implements EduHubRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(MongoDBEduHubRepository.class);

    static final int DAYS_PER_MONTH = 30;

    private final EduHubConnection connection;
    private final TimeSource timeSource;
    private final SchemaCatalog schemaCatalog;

    public MongoDBEduHubRepository(EduHubConnection connection) {
        this(connection, TimeSource.system(), null);
    }

    /**
     * @param schemaCatalog validators used to convert dates on insert, or {@code null} to insert documents as given
     */
    public MongoDBEduHubRepository(EduHubConnection connection, TimeSource timeSource, SchemaCatalog schemaCatalog) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.schemaCatalog = schemaCatalog;
    }

    // Inserts

    @Override
    public Optional<BsonValue> insertStudent(Document student) {
        student.put("role", "student");
        return insert(USERS, student, "inserting student");
    }

    @Override
    public Optional<BsonValue> insertCourse(Document course) {
        return insert(COURSES, course, "inserting course");
    }

    @Override
    public Optional<BsonValue> insertLesson(Document lesson) {
        return insert(LESSONS, lesson, "adding lesson");
    }

    @Override
    public Optional<BsonValue> registerStudent(String studentId, String courseId) {
        return attempt(OperationType.INSERT, ENROLLMENTS, "registering student", () -> {
            MongoCollection<Document> enrollments = collection(ENROLLMENTS);
            Document enrollment = new Document("enrollmentId", "e" + (enrollments.countDocuments() + 1))
                    .append("studentId", studentId)
                    .append("courseId", courseId)
                    .append("enrollmentDate", timeSource.currentDate())
                    .append("progress", 0.0)
                    .append("completed", false)
                    .append("certificateIssued", false);
            InsertOneResult result = enrollments.insertOne(enrollment);
            return Optional.ofNullable(result.getInsertedId());
        }, Optional.empty());
    }

    private Optional<BsonValue> insert(EduHubCollection target, Document document, String description) {
        Document converted = schemaCatalog == null
                ? document
                : schemaCatalog.converter(target.collectionName()).convert(document);
        return attempt(OperationType.INSERT, target, description, () -> {
            InsertOneResult result = collection(target).insertOne(converted);
            return Optional.ofNullable(result.getInsertedId());
        }, Optional.empty());
    }

    // Reads

    @Override
    public List<Document> findActiveStudents() {
        return find(USERS, Filters.and(Filters.eq("role", "student"), Filters.eq("isActive", true)),
                "fetching active students");
    }

    @Override
    public List<Document> findCourseDetails() {
        return aggregate(COURSES, EduHubAggregations.courseDetails(), "fetching course details");
    }

    @Override
    public List<Document> findCoursesByCategory(String category) {
        return find(COURSES, Filters.eq("category", category), "fetching courses by category");
    }

    @Override
    public List<Document> findStudentsEnrolledInCourse(String courseId) {
        return attempt(OperationType.FIND, ENROLLMENTS, "fetching students enrolled to course", () -> {
            List<Object> studentIds = new ArrayList<>();
            for (Document enrollment : collection(ENROLLMENTS).find(Filters.eq("courseId", courseId))
                    .into(new ArrayList<>())) {
                studentIds.add(enrollment.get("studentId"));
            }
            return collection(USERS).find(Filters.in("userId", studentIds)).into(new ArrayList<>());
        }, List.of());
    }

    @Override
    public List<Document> searchCoursesByTitle(String text) {
        return find(COURSES, Filters.regex("title", Pattern.quote(text), "i"), "searching courses by title");
    }

    @Override
    public List<Document> findCoursesByPriceRange(Number minPrice, Number maxPrice) {
        return find(COURSES, Filters.and(Filters.gte("price", minPrice), Filters.lte("price", maxPrice)),
                "fetching courses by price");
    }

    @Override
    public List<Document> findRecentSignups(int months) {
        Bson filter = Filters.gte("dateJoined", timeSource.dateBefore(Duration.ofDays((long) DAYS_PER_MONTH * months)));
        return find(USERS, filter, "fetching recent signups");
    }

    @Override
    public List<Document> findCoursesWithTags(List<String> tags) {
        return find(COURSES, Filters.in("tags", tags), "fetching courses with keywords");
    }

    @Override
    public List<Document> findUpcomingAssignments(int weeks) {
        Bson filter = Filters.and(
                Filters.gte("dueDate", timeSource.currentDate()),
                Filters.lte("dueDate", timeSource.dateAfter(Duration.ofDays(7L * weeks))));
        return find(ASSIGNMENTS, filter, "fetching upcoming assignments");
    }

    private List<Document> find(EduHubCollection target, Bson filter, String description) {
        return attempt(OperationType.FIND, target, description,
                () -> collection(target).find(filter).into(new ArrayList<>()), List.of());
    }

    // Updates and deletes

    @Override
    public boolean updateProfile(String userId, Document profile) {
        return update(USERS, Filters.eq("userId", userId), Updates.set("profile", profile),
                "updating profile", "No user found with userId: " + userId);
    }

    @Override
    public boolean publishCourse(String courseId) {
        return update(COURSES, Filters.eq("courseId", courseId), Updates.set("isPublished", true),
                "publishing course", "No course found with courseId: " + courseId);
    }

    @Override
    public boolean updateAssignmentGrade(String submissionId, Number grade, String feedback) {
        Bson update = feedback == null
                ? Updates.set("grade", grade)
                : Updates.combine(Updates.set("grade", grade), Updates.set("feedback", feedback));
        return update(SUBMISSIONS, Filters.eq("submissionId", submissionId), update,
                "updating assignment grade", "No submission found with submissionId: " + submissionId);
    }

    @Override
    public boolean addTagsToCourse(String courseId, List<String> tags) {
        return update(COURSES, Filters.eq("courseId", courseId), Updates.addEachToSet("tags", tags),
                "adding tags to course", "No course found with courseId: " + courseId);
    }

    @Override
    public boolean deactivateUser(String userId) {
        return update(USERS, Filters.eq("userId", userId), Updates.set("isActive", false),
                "deactivating user", "No user found with userId: " + userId);
    }

    @Override
    public boolean deleteEnrollment(String enrollmentId) {
        return attempt(OperationType.DELETE, ENROLLMENTS, "deleting enrollment", () -> {
            DeleteResult result = collection(ENROLLMENTS).deleteOne(Filters.eq("enrollmentId", enrollmentId));
            if (result.getDeletedCount() == 0) {
                LOGGER.info("No enrollment found with enrollmentId: {}", enrollmentId);
                return false;
            }
            return true;
        }, false);
    }

    @Override
    public boolean removeLessonFromCourse(String lessonId, String courseId) {
        return update(LESSONS,
                Filters.and(Filters.eq("lessonId", lessonId), Filters.eq("courseId", courseId)),
                Updates.set("courseId", ""),
                "removing lesson from course",
                "No lesson found with lessonId: " + lessonId + " in courseId: " + courseId);
    }

    private boolean update(EduHubCollection target, Bson filter, Bson update, String description, String notFound) {
        return attempt(OperationType.UPDATE, target, description, () -> {
            UpdateResult result = collection(target).updateOne(filter, update);
            if (result.getMatchedCount() == 0) {
                LOGGER.info(notFound);
                return false;
            }
            return true;
        }, false);
    }

    // Aggregations

    @Override
    public List<Document> enrollmentMetrics() {
        return aggregate(ENROLLMENTS, EduHubAggregations.enrollmentMetrics(), "aggregating enrollment metrics");
    }

    @Override
    public Document averageCourseRating() {
        List<Document> result = aggregate(COURSES, EduHubAggregations.averageCourseRating(),
                "calculating average course rating");
        if (result.isEmpty()) {
            return new Document("averageRating", null).append("count", 0);
        }
        return result.get(0);
    }

    @Override
    public List<Document> coursesByCategory() {
        return aggregate(COURSES, EduHubAggregations.coursesByCategory(), "grouping courses by category");
    }

    @Override
    public List<Document> averageGradePerStudent() {
        return aggregate(SUBMISSIONS, EduHubAggregations.averageGradePerStudent(),
                "calculating average grade per student");
    }

    @Override
    public List<Document> courseCompletionRate() {
        return aggregate(ENROLLMENTS, EduHubAggregations.courseCompletionRate(),
                "calculating course completion rate");
    }

    @Override
    public List<Document> topPerformingStudents(int limit) {
        return aggregate(SUBMISSIONS, EduHubAggregations.topPerformingStudents(limit),
                "fetching top-performing students");
    }

    @Override
    public List<Document> studentsPerInstructor() {
        return aggregate(ENROLLMENTS, EduHubAggregations.studentsPerInstructor(),
                "calculating total students by instructor");
    }

    @Override
    public List<Document> averageRatingPerInstructor() {
        return aggregate(COURSES, EduHubAggregations.averageRatingPerInstructor(),
                "calculating average course rating per instructor");
    }

    @Override
    public List<Document> revenuePerInstructor() {
        return aggregate(ENROLLMENTS, EduHubAggregations.revenuePerInstructor(),
                "calculating revenue per instructor");
    }

    @Override
    public List<Document> monthlyEnrollmentTrend() {
        return aggregate(ENROLLMENTS, EduHubAggregations.monthlyEnrollmentTrend(),
                "calculating monthly enrollment trends");
    }

    @Override
    public List<Document> mostPopularCategories(int limit) {
        return aggregate(COURSES, EduHubAggregations.mostPopularCategories(limit),
                "calculating most popular course categories");
    }

    @Override
    public List<Document> studentEngagementMetrics() {
        return aggregate(SUBMISSIONS, EduHubAggregations.studentEngagementMetrics(),
                "calculating student engagement metrics");
    }

    private List<Document> aggregate(EduHubCollection target, List<Bson> pipeline, String description) {
        return attempt(OperationType.AGGREGATE, target, description,
                () -> collection(target).aggregate(pipeline).into(new ArrayList<>()), List.of());
    }

    // Helper methods

    private MongoCollection<Document> collection(EduHubCollection target) {
        return connection.collection(target);
    }

    private <T> T attempt(OperationType type, EduHubCollection target, String description,
                          Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (MongoException e) {
            LOGGER.error("{} on '{}' failed while {}: {}",
                    type, target.collectionName(), description, e.getMessage(), e);
            return fallback;
        }
    }
}
