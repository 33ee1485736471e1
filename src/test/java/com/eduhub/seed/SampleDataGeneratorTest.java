package com.eduhub.seed;

import com.eduhub.schema.DocumentDateConverter;
import com.eduhub.schema.SchemaCatalog;
import com.eduhub.util.TimeSource;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SampleDataGenerator")
class SampleDataGeneratorTest {

    private static final Instant NOW = Instant.parse("2024-07-01T12:00:00Z");

    private SampleDataGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SampleDataGenerator(new Random(42), TimeSource.mockAt(NOW));
    }

    @Test
    @DisplayName("users should carry the validated fields")
    void makeUser_shouldFillFields() {
        Document user = generator.makeUser("u1");

        assertThat(user.getString("userId")).isEqualTo("u1");
        assertThat(user.getString("email")).contains("@").endsWith("example.com");
        assertThat(SampleDataGenerator.ROLES).contains(user.getString("role"));
        assertThat(user.getDate("dateJoined")).isBetween(Date.from(NOW.minus(730, ChronoUnit.DAYS)), Date.from(NOW));
        Document profile = user.get("profile", Document.class);
        assertThat(profile.getList("skills", String.class)).hasSize(3).doesNotHaveDuplicates();
        assertThat(user.get("isActive")).isInstanceOf(Boolean.class);
    }

    @Test
    @DisplayName("courses should reference their instructor and stay in range")
    void makeCourse_shouldFillFields() {
        Document course = generator.makeCourse("c1", "u7");

        assertThat(course.getString("instructorId")).isEqualTo("u7");
        assertThat(SampleDataGenerator.LEVELS).contains(course.getString("level"));
        assertThat(course.getInteger("price")).isBetween(1000, 10000);
        assertThat(course.getInteger("duration")).isBetween(10, 99);
        assertThat(course.getList("tags", String.class)).hasSize(2);
        assertThat(course.getDate("createdAt")).isBefore(course.getDate("updatedAt"));
    }

    @Test
    @DisplayName("lessons should belong to their course")
    void makeLesson_shouldFillFields() {
        Document lesson = generator.makeLesson("l1", "c1");

        assertThat(lesson.getString("courseId")).isEqualTo("c1");
        assertThat(lesson.getInteger("order")).isBetween(0, 99);
        assertThat(lesson.getList("resources", String.class)).containsExactly("intro.pdf");
    }

    @Test
    @DisplayName("should be reproducible for a given seed")
    void generate_withSameSeed_shouldRepeat() {
        SampleDataGenerator other = new SampleDataGenerator(new Random(42), TimeSource.mockAt(NOW));

        Document first = generator.makeCourse("c1", "u1");
        Document second = other.makeCourse("c1", "u1");

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("generated documents should already hold native dates")
    void generatedDocuments_shouldSurviveDateConversionUnchanged() {
        DocumentDateConverter converter = SchemaCatalog.loadDefault().converter("lessons");
        Document lesson = generator.makeLesson("l1", "c1");
        Object createdAt = lesson.get("createdAt");

        converter.convert(lesson);

        assertThat(lesson.get("createdAt")).isSameAs(createdAt);
    }
}
