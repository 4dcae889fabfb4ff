package tech.yump.logs.ingest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import tech.yump.logs.config.LiteLogsProperties;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilenamePolicyTest {

    private FilenamePolicy policy;

    @BeforeEach
    void setUp() {
        policy = new FilenamePolicy(new LiteLogsProperties(
                new LiteLogsProperties.StorageProperties(null, null, null, null),
                null,
                new LiteLogsProperties.UploadProperties(List.of("log", ".TXT")),
                null, null));
    }

    @ParameterizedTest(name = "[{index}] ''{0}'' -> ''{1}''")
    @CsvSource(delimiter = '|', value = {
            "app.log|app.log",
            "../../etc/passwd.log|passwd.log",
            "C:\\logs\\server.log|server.log",
            "my app log.txt|my_app_log.txt",
            "  spaced   out.log  |spaced_out.log",
            "weird$%chars!.log|weirdchars.log",
            "..hidden.log|hidden.log",
            "_under_.log_|under_.log",
            "日本語.log|log"
    })
    @DisplayName("secureFilename: keeps the last segment and strips unsafe characters")
    void secureFilename_normalizes(String raw, String expected) {
        assertThat(FilenamePolicy.secureFilename(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("secureFilename: null becomes empty")
    void secureFilename_null_isEmpty() {
        assertThat(FilenamePolicy.secureFilename(null)).isEmpty();
    }

    @Test
    @DisplayName("validateUpload: returns the normalized name")
    void validateUpload_returnsNormalizedName() {
        assertThat(policy.validateUpload("../nightly run.log")).isEqualTo("nightly_run.log");
        assertThat(policy.validateUpload("NOTES.TXT")).isEqualTo("NOTES.TXT");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("validateUpload: missing name is rejected")
    void validateUpload_blank_isRejected(String raw) {
        assertThatThrownBy(() -> policy.validateUpload(raw))
                .isInstanceOf(LogValidationException.class)
                .hasMessage("No file selected.");
    }

    @Test
    @DisplayName("validateUpload: name without usable characters is rejected")
    void validateUpload_nothingLeft_isRejected() {
        assertThatThrownBy(() -> policy.validateUpload("$$$"))
                .isInstanceOf(LogValidationException.class)
                .hasMessageContaining("no usable characters");
    }

    @ParameterizedTest
    @ValueSource(strings = {"malware.exe", "archive.log.gz", ".log", "noextension"})
    @DisplayName("validateUpload: disallowed extension is rejected")
    void validateUpload_disallowedExtension_isRejected(String raw) {
        assertThatThrownBy(() -> policy.validateUpload(raw))
                .isInstanceOf(LogValidationException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"release..log", "a/b..c.log", "app.log..txt"})
    @DisplayName("validateUpload: name with a double dot is rejected")
    void validateUpload_doubleDot_isRejected(String raw) {
        assertThatThrownBy(() -> policy.validateUpload(raw))
                .isInstanceOf(LogValidationException.class)
                .hasMessageContaining("must not contain '..'");
    }

    @Test
    @DisplayName("validateUpload: reserved sanitized suffix is rejected")
    void validateUpload_sanitizedSuffix_isRejected() {
        assertThatThrownBy(() -> policy.validateUpload("app.log.sanitized"))
                .isInstanceOf(LogValidationException.class)
                .hasMessageContaining("reserved");
    }

    @Test
    @DisplayName("validateStoredName: accepts both variants of an allowed name")
    void validateStoredName_acceptsBothVariants() {
        assertThat(policy.validateStoredName("app.log")).isEqualTo("app.log");
        assertThat(policy.validateStoredName("app.log.sanitized")).isEqualTo("app.log.sanitized");
    }

    @ParameterizedTest
    @ValueSource(strings = {"../app.log", "app log.log", ".app.log", "app.exe", "app.exe.sanitized", "",
            "release..log", "release..log.sanitized"})
    @DisplayName("validateStoredName: names not in normalized form or with bad extensions are rejected")
    void validateStoredName_rejectsUnsafe(String name) {
        assertThatThrownBy(() -> policy.validateStoredName(name))
                .isInstanceOf(LogValidationException.class);
    }

    @Test
    @DisplayName("getAllowedExtensions: configured extensions are lower-cased and dotted")
    void allowedExtensions_areNormalized() {
        assertThat(policy.getAllowedExtensions()).containsExactly(".log", ".txt");
        assertThat(policy.isAllowedExtension("SERVER.LOG")).isTrue();
    }
}
