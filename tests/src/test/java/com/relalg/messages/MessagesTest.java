package com.relalg.messages;

import com.relalg.ast.CodeInfo;
import com.relalg.exception.TranslationException;
import com.relalg.test.TestCategories;
import com.relalg.translate.TranslatorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Unit
@DisplayName("Message Resolution Tests")
public class MessagesTest {

    @Nested
    @DisplayName("Formatting Tests")
    class FormattingTests {

        @Test
        @DisplayName("English text with substituted parameter")
        void testEnglish() {
            String text = Messages.format(TranslatorConfig.ERROR_RELATION_NOT_FOUND, Map.of("name", "R"), Locale.ENGLISH);

            assertThat(text).isEqualTo("Relation \"R\" not found");
        }

        @Test
        @DisplayName("German text with substituted parameter")
        void testGerman() {
            String text = Messages.format(TranslatorConfig.ERROR_RELATION_NOT_FOUND, Map.of("name", "R"), Locale.GERMAN);

            assertThat(text).isEqualTo("Relation \"R\" nicht gefunden");
        }

        @Test
        @DisplayName("Locale without bundle falls back to English")
        void testFallback() {
            String text = Messages.format(TranslatorConfig.ERROR_RELATION_NOT_FOUND, Map.of("name", "R"), Locale.JAPANESE);

            assertThat(text).isEqualTo("Relation \"R\" not found");
        }

        @Test
        @DisplayName("Unknown key resolves to itself")
        void testUnknownKey() {
            assertThat(Messages.format("no.such.key", Locale.ENGLISH)).isEqualTo("no.such.key");
        }

        @Test
        @DisplayName("Every advisory has an English and a German text")
        void testAdvisoriesTranslated() {
            for (String key : new String[] {
                    TranslatorConfig.WARNING_DISTINCT_MISSING,
                    TranslatorConfig.WARNING_IGNORED_ALL_ON_SET_OPERATORS}) {
                String english = Messages.format(key, Locale.ENGLISH);
                String german = Messages.format(key, Locale.GERMAN);
                assertThat(english).isNotEqualTo(key);
                assertThat(german).isNotEqualTo(key).isNotEqualTo(english);
            }
        }
    }

    @Nested
    @DisplayName("Locale Parsing Tests")
    class LocaleParsingTests {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource({
            "en, en",
            "DE, de",
            "de_AT, de",
            "' de ', de",
        })
        @DisplayName("Language tags parse case-insensitively")
        void testParse(String value, String language) {
            assertThat(Messages.parseLocale(value).getLanguage()).isEqualTo(language);
        }

        @Test
        @DisplayName("Missing value defaults to English")
        void testDefault() {
            assertThat(Messages.parseLocale(null)).isEqualTo(Locale.ENGLISH);
            assertThat(Messages.parseLocale("  ")).isEqualTo(Locale.ENGLISH);
        }

        @Test
        @DisplayName("Malformed value is rejected")
        void testMalformed() {
            assertThatThrownBy(() -> Messages.parseLocale("!!"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("!!");
        }

        @Test
        @DisplayName("Default locale comes from the system property")
        void testSystemProperty() {
            withLocaleProperty("de", () ->
                assertThat(Messages.defaultLocale().getLanguage()).isEqualTo("de"));
        }

        @Test
        @DisplayName("Malformed system property falls back to English")
        void testMalformedSystemProperty() {
            withLocaleProperty("12", () ->
                assertThat(Messages.defaultLocale()).isEqualTo(Locale.ENGLISH));
        }
    }

    @Nested
    @DisplayName("Translation Exception Tests")
    class TranslationExceptionTests {

        @Test
        @DisplayName("Message is English with the source position")
        void testMessage() {
            TranslationException e = new TranslationException(
                "db.messages.exec.error-column-not-found", "column", "R.x", CodeInfo.of("R.x", 9));

            assertThat(e.getMessage()).isEqualTo("Column \"R.x\" not found (line 1, column 10)");
            assertThat(e.getLocalizedMessage(Locale.GERMAN)).isEqualTo("Spalte \"R.x\" nicht gefunden");
        }

        @Test
        @DisplayName("Message without position has no location suffix")
        void testMessageWithoutPosition() {
            TranslationException e = new TranslationException(
                "db.messages.exec.error-schemas-not-unifiable", "operator", "∪", null);

            assertThat(e.getMessage()).doesNotContain("line");
            assertThat(e.params()).containsEntry("operator", "∪");
        }

        @Test
        @DisplayName("Malformed locale property does not break error reporting")
        void testReportingWithMalformedLocale() {
            TranslationException e = new TranslationException(
                TranslatorConfig.ERROR_RELATION_NOT_FOUND, "name", "ghost", null);

            withLocaleProperty("12", () -> {
                assertThat(e.getLocalizedMessage()).isEqualTo("Relation \"ghost\" not found");
                assertThat(e.toString()).contains("Relation \"ghost\" not found");
            });
        }
    }

    private static void withLocaleProperty(String value, Runnable body) {
        String previous = System.getProperty(Messages.LOCALE_PROPERTY);
        try {
            System.setProperty(Messages.LOCALE_PROPERTY, value);
            body.run();
        } finally {
            if (previous == null) {
                System.clearProperty(Messages.LOCALE_PROPERTY);
            } else {
                System.setProperty(Messages.LOCALE_PROPERTY, previous);
            }
        }
    }
}
