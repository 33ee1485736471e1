package com.eduhub.seed;

import com.eduhub.schema.SchemaCatalog;

import java.util.Objects;

/**
 * Where the seeder reads its files from, and whether it starts from an empty database.
 */
public record SeedConfig(
        String schemaPath,
        String sampleDataPath,
        boolean dropExisting
) {

    public static final String DEFAULT_SAMPLE_DATA = "data/sample_data.json";

    public SeedConfig {
        Objects.requireNonNull(schemaPath, "schemaPath must not be null");
        Objects.requireNonNull(sampleDataPath, "sampleDataPath must not be null");
    }

    public static SeedConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String schemaPath = SchemaCatalog.DEFAULT_LOCATION;
        private String sampleDataPath = DEFAULT_SAMPLE_DATA;
        private boolean dropExisting = true;

        private Builder() {}

        public Builder schemaPath(String schemaPath) {
            this.schemaPath = schemaPath;
            return this;
        }

        public Builder sampleDataPath(String sampleDataPath) {
            this.sampleDataPath = sampleDataPath;
            return this;
        }

        public Builder dropExisting(boolean dropExisting) {
            this.dropExisting = dropExisting;
            return this;
        }

        public SeedConfig build() {
            return new SeedConfig(schemaPath, sampleDataPath, dropExisting);
        }
    }
}
