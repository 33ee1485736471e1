package com.eduhub.seed;

import com.eduhub.util.TimeSource;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Generates plausible users, courses and lessons for seeding a development database.
 * Output is reproducible for a given {@link Random} seed and time source.
 */
public class SampleDataGenerator {

    static final List<String> ROLES = List.of("student", "instructor");
    static final List<String> SKILLS = List.of(
            "Python", "SQL", "Data Engineering", "ETL", "JavaScript",
            "APIs", "Kubernetes", "Machine Learning", "MongoDB", "Cloud Computing");
    static final List<String> LEVELS = List.of("beginner", "intermediate", "advanced");

    private static final List<String> FIRST_NAMES = List.of(
            "Ada", "Grace", "Alan", "Barbara", "Edsger", "Frances", "Donald", "Margaret", "Ken", "Radia");
    private static final List<String> LAST_NAMES = List.of(
            "Lovelace", "Hopper", "Turing", "Liskov", "Dijkstra", "Allen", "Knuth", "Hamilton", "Thompson", "Perlman");
    private static final List<String> WORDS = List.of(
            "learn", "data", "practical", "modern", "build", "systems", "course", "project", "design",
            "query", "pipeline", "deploy", "model", "scale", "secure", "fundamentals", "hands-on", "guide");

    private static final Duration YEAR = Duration.ofDays(365);

    private final Random random;
    private final TimeSource timeSource;

    public SampleDataGenerator(Random random, TimeSource timeSource) {
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
    }

    public Document makeUser(String userId) {
        String firstName = pick(FIRST_NAMES);
        String lastName = pick(LAST_NAMES);
        Instant now = timeSource.now();

        return new Document("_id", new ObjectId())
                .append("userId", userId)
                .append("email", (firstName + "." + lastName + "." + userId + "@example.com").toLowerCase(Locale.ROOT))
                .append("firstName", firstName)
                .append("lastName", lastName)
                .append("role", pick(ROLES))
                .append("dateJoined", dateBetween(now.minus(YEAR.multipliedBy(2)), now))
                .append("profile", new Document("bio", sentence())
                        .append("avatar", "https://picsum.photos/seed/" + userId + "/200")
                        .append("skills", sample(SKILLS, 3)))
                .append("isActive", random.nextBoolean());
    }

    public Document makeCourse(String courseId, String instructorId) {
        Instant now = timeSource.now();

        return new Document("courseId", courseId)
                .append("title", sentence())
                .append("description", paragraph(3))
                .append("instructorId", instructorId)
                .append("category", pick(SKILLS))
                .append("level", pick(LEVELS))
                .append("duration", randomInt(10, 99))
                .append("price", randomInt(1000, 10000))
                .append("tags", sample(SKILLS, 2))
                .append("createdAt", dateBetween(now.minus(YEAR.multipliedBy(3)), now.minus(YEAR.multipliedBy(2))))
                .append("updatedAt", dateBetween(now.minus(YEAR), now))
                .append("isPublished", random.nextBoolean());
    }

    public Document makeLesson(String lessonId, String courseId) {
        Instant now = timeSource.now();

        return new Document("lessonId", lessonId)
                .append("courseId", courseId)
                .append("title", sentence())
                .append("content", paragraph(5))
                .append("order", randomInt(0, 99))
                .append("resources", new ArrayList<>(List.of("intro.pdf")))
                .append("duration", 30)
                .append("createdAt", dateBetween(now.minus(YEAR.multipliedBy(3)), now.minus(YEAR.multipliedBy(2))))
                .append("updatedAt", dateBetween(now.minus(YEAR), now));
    }

    private String pick(List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    private List<String> sample(List<String> values, int count) {
        List<String> shuffled = new ArrayList<>(values);
        Collections.shuffle(shuffled, random);
        return new ArrayList<>(shuffled.subList(0, count));
    }

    // inclusive on both ends
    private int randomInt(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private Date dateBetween(Instant start, Instant end) {
        long span = end.toEpochMilli() - start.toEpochMilli();
        long offset = span <= 0 ? 0 : (long) (random.nextDouble() * span);
        return new Date(start.toEpochMilli() + offset);
    }

    private String sentence() {
        int length = randomInt(4, 8);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            String word = pick(WORDS);
            if (i == 0) {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            } else {
                sb.append(' ').append(word);
            }
        }
        return sb.append('.').toString();
    }

    private String paragraph(int sentences) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < sentences; i++) {
            parts.add(sentence());
        }
        return String.join(" ", parts);
    }
}
