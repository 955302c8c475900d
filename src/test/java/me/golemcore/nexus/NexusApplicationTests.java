package me.golemcore.nexus;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class NexusApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(NexusApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(NexusApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(NexusApplication.class.getMethod("main", String[].class));
    }
}
