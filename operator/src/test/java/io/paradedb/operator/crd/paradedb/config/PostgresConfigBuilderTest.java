package io.paradedb.operator.crd.paradedb.config;

import io.fabric8.kubernetes.api.model.Quantity;
import io.paradedb.operator.crd.paradedb.ParadeDBSpec;
import io.paradedb.operator.crd.paradedb.StorageSpec;
import io.paradedb.operator.crd.paradedb.TLSSpec;
import org.jspecify.annotations.NullMarked;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@NullMarked
class PostgresConfigBuilderTest {
    @Nested
    class Build {
        @Test
        @DisplayName("Defaults listen on all addresses and preload the ParadeDB libraries")
        void withDefaults_shouldRenderBaseline() {
            // given
            var spec = new ParadeDBSpec();

            // when
            var config = PostgresConfigBuilder.build(spec);

            // then
            assertThat(config)
                    .contains("listen_addresses = '*'\n")
                    .contains("port = 5432\n")
                    .contains("max_connections = 100\n")
                    .contains("shared_buffers = '128MB'\n")
                    .contains("password_encryption = 'scram-sha-256'\n")
                    .contains("shared_preload_libraries = 'pg_search,pg_analytics'\n")
                    .doesNotContain("ssl")
                    .doesNotContain("wal_compression");
        }

        @Test
        @DisplayName("Without search and analytics nothing is preloaded")
        void withoutPreloadedExtensions_shouldOmitPreloadLibraries() {
            // given
            var spec = new ParadeDBSpec();
            spec.getExtensions().setPgSearch(false);
            spec.getExtensions().setPgAnalytics(false);

            // when
            var config = PostgresConfigBuilder.build(spec);

            // then
            assertThat(config).doesNotContain("shared_preload_libraries");
        }

        @Test
        @DisplayName("TLS points the server at the mounted certificate")
        void withTls_shouldRenderSslSettings() {
            // given
            var spec = new ParadeDBSpec();
            var tls = new TLSSpec();
            tls.setEnabled(true);
            spec.setTls(tls);

            // when
            var config = PostgresConfigBuilder.build(spec);

            // then
            assertThat(config)
                    .contains("ssl = on\n")
                    .contains("ssl_cert_file = '/etc/postgresql/tls/tls.crt'\n")
                    .contains("ssl_key_file = '/etc/postgresql/tls/tls.key'\n");
        }

        @Test
        @DisplayName("A dedicated WAL volume enables WAL compression")
        void withWalStorage_shouldEnableWalCompression() {
            // given
            var spec = new ParadeDBSpec();
            var wal = new StorageSpec.WalStorage();
            wal.setSize(new Quantity("2Gi"));
            spec.getStorage().setWalStorage(wal);

            // when
            var config = PostgresConfigBuilder.build(spec);

            // then
            assertThat(config).contains("wal_compression = on\n");
        }

        @Test
        @DisplayName("User parameters override defaults and are rendered once")
        void withOverrides_shouldReplaceDefaults() {
            // given
            var spec = new ParadeDBSpec();
            spec.getPostgresConfig().put("work_mem", "64MB");
            spec.getPostgresConfig().put("max_connections", "250");

            // when
            var config = PostgresConfigBuilder.build(spec);

            // then
            assertThat(config)
                    .contains("max_connections = 250\n")
                    .doesNotContain("max_connections = 100")
                    .contains("work_mem = '64MB'\n");
        }

        @Test
        @DisplayName("Rendering is deterministic")
        void build_twice_shouldBeEqual() {
            // given
            var spec = new ParadeDBSpec();
            spec.getPostgresConfig().put("b_param", "1");
            spec.getPostgresConfig().put("a_param", "2");

            // when / then
            assertThat(PostgresConfigBuilder.build(spec)).isEqualTo(PostgresConfigBuilder.build(spec));
        }
    }

    @Nested
    class FormatValue {
        @ParameterizedTest
        @CsvSource(quoteCharacter = '"', value = {
                "100, 100",
                "-1, -1",
                "0.9, 0.9",
                "on, on",
                "off, off",
                "128MB, '128MB'",
                "'quoted', 'quoted'"
        })
        @DisplayName("Numbers and booleans stay bare, everything else is single-quoted")
        void formatValue(String input, String expected) {
            // given / when
            var result = PostgresConfigBuilder.formatValue(input);

            // then
            assertThat(result).isEqualTo(expected);
        }

        @Test
        @DisplayName("Embedded quotes are doubled")
        void formatValue_withQuote_shouldEscape() {
            // given / when
            var result = PostgresConfigBuilder.formatValue("it's");

            // then
            assertThat(result).isEqualTo("'it''s'");
        }
    }
}
