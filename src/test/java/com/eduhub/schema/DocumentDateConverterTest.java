package com.eduhub.schema;

import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DocumentDateConverter")
class DocumentDateConverterTest {

    private static Date utc(int year, int month, int day, int hour, int minute, int second) {
        return Date.from(LocalDateTime.of(year, month, day, hour, minute, second).toInstant(ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Top-level fields")
    class TopLevelTests {

        private final DocumentDateConverter converter =
                new DocumentDateConverter(DateFieldPaths.of("enrollmentDate"));

        @Test
        @DisplayName("should convert an ISO-8601 string into a date")
        void convert_withIsoString_shouldProduceDate() {
            Document record = new Document("enrollmentDate", "2023-05-01T00:00:00");

            converter.convert(record);

            assertThat(record.get("enrollmentDate"))
                    .isInstanceOf(Date.class)
                    .isEqualTo(utc(2023, 5, 1, 0, 0, 0));
        }

        @Test
        @DisplayName("should leave an unparseable string untouched")
        void convert_withBadString_shouldKeepOriginal() {
            Document record = new Document("enrollmentDate", "not-a-date");

            assertThatCode(() -> converter.convert(record)).doesNotThrowAnyException();

            assertThat(record.get("enrollmentDate")).isEqualTo("not-a-date");
        }

        @Test
        @DisplayName("should return the same instance")
        void convert_shouldMutateInPlace() {
            Document record = new Document("enrollmentDate", "2023-05-01T00:00:00");

            assertThat(converter.convert(record)).isSameAs(record);
        }

        @Test
        @DisplayName("should not touch strings outside the date paths")
        void convert_withOtherStrings_shouldIgnoreThem() {
            Document record = new Document("enrollmentDate", "2023-05-01T00:00:00")
                    .append("courseId", "2023-05-01T00:00:00");

            converter.convert(record);

            assertThat(record.get("courseId")).isEqualTo("2023-05-01T00:00:00");
        }

        @Test
        @DisplayName("should not convert non-string values at a date path")
        void convert_withNumberAtDatePath_shouldKeepIt() {
            Document record = new Document("enrollmentDate", 1_682_899_200_000L);

            converter.convert(record);

            assertThat(record.get("enrollmentDate")).isEqualTo(1_682_899_200_000L);
        }
    }

    @Nested
    @DisplayName("No-op and idempotence")
    class IdempotenceTests {

        private final DocumentDateConverter converter =
                new DocumentDateConverter(DateFieldPaths.of("enrollmentDate", "profile.joinedAt"));

        @Test
        @DisplayName("should leave a record without date strings identical")
        void convert_withoutDateStrings_shouldBeNoOp() {
            Document record = new Document("studentId", "u1")
                    .append("progress", 0.5)
                    .append("profile", new Document("bio", "hi"))
                    .append("tags", new ArrayList<>(List.of("a", "b")));
            Document before = Document.parse(record.toJson());

            converter.convert(record);

            assertThat(record).isEqualTo(before);
        }

        @Test
        @DisplayName("should leave an already converted record unchanged")
        void convert_twice_shouldBeIdempotent() {
            Document record = new Document("enrollmentDate", "2023-05-01T00:00:00")
                    .append("profile", new Document("joinedAt", "2021-09-01T08:00:00Z"));
            converter.convert(record);
            Date enrollmentDate = record.getDate("enrollmentDate");
            Date joinedAt = record.get("profile", Document.class).getDate("joinedAt");

            converter.convert(record);

            assertThat(record.get("enrollmentDate")).isSameAs(enrollmentDate);
            assertThat(record.get("profile", Document.class).get("joinedAt")).isSameAs(joinedAt);
        }
    }

    @Nested
    @DisplayName("Nested structures")
    class NestedTests {

        @Test
        @DisplayName("should convert dates inside nested mappings")
        void convert_withNestedMapping_shouldUseDottedPath() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("profile.joinedAt"));
            Document record = new Document("profile", new Document("joinedAt", "2021-09-01T08:00:00Z")
                    .append("bio", "2021-09-01T08:00:00Z"));

            converter.convert(record);

            Document profile = record.get("profile", Document.class);
            assertThat(profile.get("joinedAt")).isEqualTo(utc(2021, 9, 1, 8, 0, 0));
            assertThat(profile.get("bio")).isEqualTo("2021-09-01T08:00:00Z");
        }

        @Test
        @DisplayName("should convert each mapping of a list and skip bad values")
        void convert_withListOfMappings_shouldConvertEachElement() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("lessons.createdAt"));
            Document record = new Document("lessons", new ArrayList<>(List.of(
                    new Document("createdAt", "2022-01-01T00:00:00"),
                    new Document("createdAt", "bad"))));

            converter.convert(record);

            List<Document> lessons = record.getList("lessons", Document.class);
            assertThat(lessons.get(0).get("createdAt")).isEqualTo(utc(2022, 1, 1, 0, 0, 0));
            assertThat(lessons.get(1).get("createdAt")).isEqualTo("bad");
        }

        @Test
        @DisplayName("should pass non-mapping list elements through")
        void convert_withListOfScalars_shouldKeepThem() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("dates"));
            List<Object> dates = new ArrayList<>(List.of("2022-01-01T00:00:00", 3));
            Document record = new Document("dates", dates);

            converter.convert(record);

            assertThat(record.get("dates")).isSameAs(dates);
            assertThat(dates).containsExactly("2022-01-01T00:00:00", 3);
        }

        @Test
        @DisplayName("should work on plain mutable maps")
        void convert_withHashMap_shouldConvert() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("meta.at"));
            Map<String, Object> meta = new HashMap<>();
            meta.put("at", "2020-02-29");
            Map<String, Object> record = new HashMap<>();
            record.put("meta", meta);

            converter.convert(record);

            assertThat(meta.get("at")).isEqualTo(utc(2020, 2, 29, 0, 0, 0));
        }

        @Test
        @DisplayName("should honour an explicit prefix")
        void convert_withPrefix_shouldPrependIt() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("lessons.createdAt"));
            Document lesson = new Document("createdAt", "2022-01-01T00:00:00");

            converter.convert(lesson, "lessons.");

            assertThat(lesson.get("createdAt")).isEqualTo(utc(2022, 1, 1, 0, 0, 0));
        }
    }

    @Nested
    @DisplayName("Non-mapping roots")
    class NonMappingRootTests {

        private final DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("createdAt"));

        @Test
        @DisplayName("should return a list root unchanged")
        void convert_withListRoot_shouldReturnItUnchanged() {
            List<Document> root = new ArrayList<>(List.of(new Document("createdAt", "2022-01-01T00:00:00")));

            assertThat(converter.convert(root)).isSameAs(root);
            assertThat(root.get(0).get("createdAt")).isEqualTo("2022-01-01T00:00:00");
        }

        @Test
        @DisplayName("should return scalars and null unchanged")
        void convert_withScalarRoot_shouldReturnIt() {
            assertThat(converter.convert("2022-01-01T00:00:00")).isEqualTo("2022-01-01T00:00:00");
            assertThat(converter.convert((Object) null)).isNull();
        }
    }

    @Nested
    @DisplayName("Unmodifiable containers")
    class UnmodifiableContainerTests {

        @Test
        @DisplayName("should return a converted copy of an immutable record")
        void convert_withImmutableRecord_shouldReturnCopy() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("enrollmentDate"));
            Map<String, Object> record = Map.of("enrollmentDate", "2023-05-01T00:00:00", "progress", 0.5);

            Map<String, Object> converted = converter.convert(record);

            assertThat(converted).isNotSameAs(record)
                    .containsEntry("enrollmentDate", utc(2023, 5, 1, 0, 0, 0))
                    .containsEntry("progress", 0.5);
            assertThat(record.get("enrollmentDate")).isEqualTo("2023-05-01T00:00:00");
        }

        @Test
        @DisplayName("should copy an immutable list of immutable mappings")
        void convert_withImmutableList_shouldReplaceItInParent() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("lessons.createdAt"));
            Document record = new Document("lessons", List.of(
                    Map.of("createdAt", "2022-01-01T00:00:00"),
                    Map.of("createdAt", "bad"),
                    "intro"));

            assertThat(converter.convert(record)).isSameAs(record);

            List<?> lessons = record.get("lessons", List.class);
            assertThat(lessons).hasSize(3);
            assertThat(((Map<?, ?>) lessons.get(0)).get("createdAt")).isEqualTo(utc(2022, 1, 1, 0, 0, 0));
            assertThat(((Map<?, ?>) lessons.get(1)).get("createdAt")).isEqualTo("bad");
            assertThat(lessons.get(2)).isEqualTo("intro");
        }

        @Test
        @DisplayName("should copy every level of a fully immutable record")
        void convert_withNestedImmutableRecord_shouldNotThrow() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("lessons.createdAt"));
            Map<String, Object> record = Map.of("lessons", List.of(Map.of("createdAt", "2022-01-01T00:00:00")));

            Map<String, Object> converted = converter.convert(record);

            List<?> lessons = (List<?>) converted.get("lessons");
            assertThat(lessons).singleElement()
                    .satisfies(lesson -> assertThat(((Map<?, ?>) lesson).get("createdAt"))
                            .isEqualTo(utc(2022, 1, 1, 0, 0, 0)));
        }

        @Test
        @DisplayName("should return an immutable record unchanged when nothing converts")
        void convert_withImmutableRecordAndNoDates_shouldReturnSameInstance() {
            DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("enrollmentDate"));
            Map<String, Object> record = Map.of("enrollmentDate", "not-a-date");

            assertThat(converter.convert(record)).isSameAs(record);
        }
    }

    @Test
    @DisplayName("should reject a null prefix")
    void convert_withNullPrefix_shouldThrow() {
        DocumentDateConverter converter = new DocumentDateConverter(DateFieldPaths.of("createdAt"));

        assertThatThrownBy(() -> converter.convert(new Document(), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("prefix");
    }

    @Test
    @DisplayName("forSchema should derive its paths from the schema")
    void forSchema_shouldExtractDateFields() {
        Document schema = new Document("properties", new Document("dueDate", new Document("bsonType", "date")));

        DocumentDateConverter converter = DocumentDateConverter.forSchema(schema);

        assertThat(converter.dateFields().paths()).containsExactly("dueDate");
    }
}
