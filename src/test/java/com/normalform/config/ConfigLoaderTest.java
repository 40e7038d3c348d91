package com.normalform.config;

import com.normalform.exception.ConfigurationException;
import com.normalform.minimizer.NormalForm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load the bundled configuration from the classpath")
    void shouldLoadClasspathConfig() {
        NormalFormConfig config = ConfigLoader.load("classpath:normal-form.yaml");

        assertEquals(NormalForm.CNF, config.defaultForm());
        assertEquals(16, config.maxTerms());
        assertEquals(12, config.warnTerms());
        assertEquals(OutputFormat.TEXT, config.outputFormat());
    }

    @Test
    @DisplayName("Should read settings under the normal-form key")
    void shouldParseNestedSettings() {
        NormalFormConfig config = ConfigLoader.parse(yaml("""
                normal-form:
                  default-form: dnf
                  max-terms: 8
                  warn-terms: 4
                  output-format: json
                """));

        assertEquals(NormalForm.DNF, config.defaultForm());
        assertEquals(8, config.maxTerms());
        assertEquals(4, config.warnTerms());
        assertEquals(OutputFormat.JSON, config.outputFormat());
    }

    @Test
    @DisplayName("Should read settings at the root and default the rest")
    void shouldParseRootSettings() {
        NormalFormConfig config = ConfigLoader.parse(yaml("max-terms: 10\n"));

        assertEquals(NormalForm.CNF, config.defaultForm());
        assertEquals(10, config.maxTerms());
        assertEquals(10, config.warnTerms());
    }

    @Test
    @DisplayName("Empty file yields defaults")
    void shouldDefaultEmptyFile() {
        assertEquals(NormalFormConfig.defaults(), ConfigLoader.parse(yaml("")));
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse(yaml("max-terms: 0\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse(yaml("max-terms: 40\n")));
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parse(yaml("max-terms: 4\nwarn-terms: 5\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse(yaml("max-terms: many\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse(yaml("default-form: xnf\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse(yaml("- a\n- b\n")));
    }

    @Test
    @DisplayName("A normal-form key that is not a mapping is a configuration error")
    void shouldRejectScalarSection() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parse(yaml("normal-form: 5\n")));
        assertTrue(e.getMessage().contains("normal-form"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse(yaml("normal-form:\n  - cnf\n")));
        assertEquals(NormalFormConfig.defaults(), ConfigLoader.parse(yaml("normal-form:\n")));
    }

    @Test
    @DisplayName("Missing file is a configuration error")
    void shouldRejectMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:missing.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/nonexistent/normal-form.yaml"));
    }
}
