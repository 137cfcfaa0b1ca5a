package me.golemcore.memory;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class MemoryEngineApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(MemoryEngineApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(MemoryEngineApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(MemoryEngineApplication.class.getMethod("main", String[].class));
    }
}
