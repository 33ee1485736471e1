package com.eduhub.adapter.mongodb;

import com.eduhub.adapter.spi.ConfigurationException;
import com.eduhub.adapter.spi.ConnectionConfig;
import com.eduhub.adapter.spi.ValidationResult;
import com.mongodb.MongoClientSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MongoDBConnectionFactory")
class MongoDBConnectionFactoryTest {

    private MongoDBConnectionFactory factory;

    @BeforeEach
    void setUp() {
        factory = new MongoDBConnectionFactory();
    }

    @Nested
    @DisplayName("Configuration Validation")
    class ConfigValidationTests {

        @Test
        @DisplayName("should validate valid URI")
        void validateConfig_withValidUri_shouldSucceed() {
            ValidationResult result = factory.validateConfig(ConnectionConfig.fromUri("mongodb://localhost:27017/"));

            assertThat(result.isValid()).isTrue();
        }

        @Test
        @DisplayName("should accept SRV URIs")
        void validateConfig_withSrvUri_shouldSucceed() {
            ValidationResult result = factory.validateConfig(
                    ConnectionConfig.fromUri("mongodb+srv://cluster.example.net/"));

            assertThat(result.isValid()).isTrue();
        }

        @Test
        @DisplayName("should reject empty URI")
        void validateConfig_withEmptyUri_shouldFail() {
            ValidationResult result = factory.validateConfig(ConnectionConfig.fromUri(""));

            assertThat(result.isInvalid()).isTrue();
            assertThat(result.firstErrorMessage()).contains("required");
        }

        @Test
        @DisplayName("should reject missing URI")
        void validateConfig_withoutUri_shouldFail() {
            ValidationResult result = factory.validateConfig(ConnectionConfig.builder().build());

            assertThat(result.isInvalid()).isTrue();
        }

        @Test
        @DisplayName("should reject invalid URI scheme")
        void validateConfig_withInvalidScheme_shouldFail() {
            ValidationResult result = factory.validateConfig(ConnectionConfig.fromUri("http://localhost:27017"));

            assertThat(result.isInvalid()).isTrue();
            assertThat(result.firstErrorMessage()).contains("mongodb://");
        }

        @Test
        @DisplayName("should reject blank database name")
        void validateConfig_withBlankDatabase_shouldFail() {
            ValidationResult result = factory.validateConfig(
                    ConnectionConfig.builder().uri("mongodb://localhost").database(" ").build());

            assertThat(result.allErrorMessages()).contains("database");
        }
    }

    @Nested
    @DisplayName("Settings")
    class SettingsTests {

        @Test
        @DisplayName("should apply pool and timeout options")
        void buildSettings_shouldApplyOptions() {
            ConnectionConfig config = ConnectionConfig.builder()
                    .uri("mongodb://localhost:27017/")
                    .option("maxPoolSize", "12")
                    .option("minPoolSize", "2")
                    .option("connectTimeoutMs", "2500")
                    .build();

            MongoClientSettings settings = factory.buildSettings(config);

            assertThat(settings.getConnectionPoolSettings().getMaxSize()).isEqualTo(12);
            assertThat(settings.getConnectionPoolSettings().getMinSize()).isEqualTo(2);
            assertThat(settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS)).isEqualTo(2500);
        }

        @Test
        @DisplayName("should use defaults when no options are given")
        void buildSettings_withoutOptions_shouldUseDefaults() {
            MongoClientSettings settings = factory.buildSettings(ConnectionConfig.fromUri("mongodb://localhost"));

            assertThat(settings.getConnectionPoolSettings().getMaxSize()).isEqualTo(100);
            assertThat(settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS)).isEqualTo(10000);
        }

        @Test
        @DisplayName("should refuse an invalid configuration")
        void connect_withInvalidConfig_shouldThrow() {
            assertThatThrownBy(() -> factory.connect(ConnectionConfig.fromUri("http://localhost")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("mongodb://");
        }
    }

    @Test
    @DisplayName("should describe its options")
    void getConfigurationOptions_shouldExposeOptions() {
        Map<String, String> options = factory.getConfigurationOptions();

        assertThat(options).containsKeys("maxPoolSize", "minPoolSize", "connectTimeoutMs");
    }
}
