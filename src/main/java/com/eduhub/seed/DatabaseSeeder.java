package com.eduhub.seed;

import com.eduhub.adapter.spi.EduHubCollection;
import com.eduhub.adapter.spi.EduHubConnection;
import com.eduhub.adapter.spi.SetupException;
import com.eduhub.schema.DocumentDateConverter;
import com.eduhub.schema.SchemaCatalog;
import com.eduhub.util.JsonResources;
import com.eduhub.util.TimeSource;
import com.mongodb.MongoException;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CreateCollectionOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ValidationOptions;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Creates the EduHub collections with their validators, loads sample data and builds indexes.
 *
 * <p>Unlike repository operations, every failure here is fatal and surfaces as a
 * {@link SetupException} or {@link com.eduhub.adapter.spi.ConfigurationException}.
 */
public class DatabaseSeeder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseSeeder.class);

    private final EduHubConnection connection;
    private final SchemaCatalog schemaCatalog;
    private final SeedConfig config;
    private final TimeSource timeSource;

    public DatabaseSeeder(EduHubConnection connection, SeedConfig config) {
        this(connection, SchemaCatalog.load(config.schemaPath()), config, TimeSource.system());
    }

    public DatabaseSeeder(EduHubConnection connection, SchemaCatalog schemaCatalog,
                          SeedConfig config, TimeSource timeSource) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.schemaCatalog = Objects.requireNonNull(schemaCatalog, "schemaCatalog must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
    }

    /**
     * Creates every collection of the schema catalog with its validator, dropping existing
     * collections first when configured to.
     *
     * @return the names of the created collections
     */
    public List<String> buildCollections() {
        MongoDatabase database = connection.getDatabase();
        List<String> created = new ArrayList<>();
        try {
            if (config.dropExisting()) {
                for (String name : database.listCollectionNames().into(new ArrayList<>())) {
                    database.getCollection(name).drop();
                    LOGGER.debug("Dropped collection: {}", name);
                }
            }
            for (String name : schemaCatalog.collectionNames()) {
                Document validator = schemaCatalog.validator(name).orElseThrow();
                database.createCollection(name, new CreateCollectionOptions()
                        .validationOptions(new ValidationOptions().validator(validator)));
                created.add(name);
                LOGGER.info("Created collection: {}", name);
            }
        } catch (MongoException e) {
            throw new SetupException("Error initializing database: " + e.getMessage(), e);
        }
        return created;
    }

    /**
     * Inserts the sample data file, converting each document's date fields according to its
     * collection's schema. Entries that are not arrays, or that have no schema, are skipped.
     *
     * @return number of documents inserted per collection
     */
    public Map<String, Integer> seed() {
        Document data = JsonResources.readDocument(config.sampleDataPath());
        Map<String, Integer> seeded = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String name = entry.getKey();
            if (!(entry.getValue() instanceof List<?> values) || !schemaCatalog.contains(name)) {
                LOGGER.warn("Data for '{}' is not a list or schema missing, skipping.", name);
                continue;
            }
            List<Document> documents = new ArrayList<>();
            for (Object value : values) {
                if (value instanceof Document document) {
                    documents.add(document);
                } else {
                    LOGGER.warn("Skipping non-document entry in '{}': {}", name, value);
                }
            }
            seeded.put(name, insertConverted(name, documents));
        }
        return seeded;
    }

    /**
     * Inserts generated users, courses and lessons. Courses are assigned round-robin to the
     * generated instructors, or to the first user when no instructor was generated.
     *
     * @return number of documents inserted per collection
     */
    public Map<String, Integer> seedGenerated(int users, int courses, int lessonsPerCourse, Random random) {
        SampleDataGenerator generator = new SampleDataGenerator(random, timeSource);

        List<Document> userDocs = new ArrayList<>();
        List<String> instructorIds = new ArrayList<>();
        for (int i = 1; i <= users; i++) {
            Document user = generator.makeUser("u" + i);
            userDocs.add(user);
            if ("instructor".equals(user.getString("role"))) {
                instructorIds.add(user.getString("userId"));
            }
        }
        if (instructorIds.isEmpty()) {
            instructorIds.add("u1");
        }

        List<Document> courseDocs = new ArrayList<>();
        List<Document> lessonDocs = new ArrayList<>();
        for (int c = 1; c <= courses; c++) {
            String courseId = "c" + c;
            courseDocs.add(generator.makeCourse(courseId, instructorIds.get((c - 1) % instructorIds.size())));
            for (int l = 1; l <= lessonsPerCourse; l++) {
                lessonDocs.add(generator.makeLesson("l" + c + "_" + l, courseId));
            }
        }

        Map<String, Integer> seeded = new LinkedHashMap<>();
        seeded.put(EduHubCollection.USERS.collectionName(),
                insertConverted(EduHubCollection.USERS.collectionName(), userDocs));
        seeded.put(EduHubCollection.COURSES.collectionName(),
                insertConverted(EduHubCollection.COURSES.collectionName(), courseDocs));
        seeded.put(EduHubCollection.LESSONS.collectionName(),
                insertConverted(EduHubCollection.LESSONS.collectionName(), lessonDocs));
        return seeded;
    }

    private int insertConverted(String name, List<Document> documents) {
        if (documents.isEmpty()) {
            return 0;
        }
        TimeSource.Stopwatch stopwatch = timeSource.startStopwatch();
        DocumentDateConverter converter = schemaCatalog.converter(name);
        documents.replaceAll(converter::convert);
        try {
            connection.getDatabase().getCollection(name).insertMany(documents);
        } catch (MongoException e) {
            throw new SetupException("Error seeding '" + name + "': " + e.getMessage(), e);
        }
        LOGGER.info("Seeded {} documents into '{}' collection in {} ms.",
                documents.size(), name, stopwatch.elapsedMillis());
        return documents.size();
    }

    /**
     * Creates the indexes backing the repository queries.
     */
    public void setupIndexes() {
        MongoDatabase database = connection.getDatabase();
        try {
            database.getCollection(EduHubCollection.USERS.collectionName())
                    .createIndex(Indexes.ascending("email"), new IndexOptions().unique(true));
            database.getCollection(EduHubCollection.COURSES.collectionName())
                    .createIndex(Indexes.text("title"));
            database.getCollection(EduHubCollection.COURSES.collectionName())
                    .createIndex(Indexes.ascending("category"));
            database.getCollection(EduHubCollection.ASSIGNMENTS.collectionName())
                    .createIndex(Indexes.ascending("dueDate"));
            database.getCollection(EduHubCollection.ENROLLMENTS.collectionName())
                    .createIndex(Indexes.ascending("studentId"));
            database.getCollection(EduHubCollection.ENROLLMENTS.collectionName())
                    .createIndex(Indexes.ascending("courseId"));
        } catch (MongoException e) {
            throw new SetupException("Error setting up indexes: " + e.getMessage(), e);
        }
        LOGGER.info("Indexes created successfully.");
    }
}
