package com.seveninterprise.bcavault.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JsonPropertySourceFactoryTest {

    @Test
    void testCreatePropertySource_FlattensNestedKeys() throws Exception {
        String json = "{\"bcavault\":{\"backup\":{"
            + "\"notification\":{\"recipients\":[\"a@example.com\",\"b@example.com\"]},"
            + "\"scheduler\":{\"enabled\":false,\"poll-interval-ms\":30000},"
            + "\"encryption\":{\"key-id\":\"k1\",\"key\":null}}}}";
        EncodedResource resource = new EncodedResource(new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8)));

        PropertySource<?> source = new JsonPropertySourceFactory().createPropertySource("jsonConfig", resource);

        assertEquals("a@example.com,b@example.com", source.getProperty("bcavault.backup.notification.recipients"));
        assertEquals(false, source.getProperty("bcavault.backup.scheduler.enabled"));
        assertEquals(30000L, source.getProperty("bcavault.backup.scheduler.poll-interval-ms"));
        assertEquals("k1", source.getProperty("bcavault.backup.encryption.key-id"));
        assertFalse(source.containsProperty("bcavault.backup.encryption.key"));
    }

    @Test
    void testBundledConfigJson_OnlyAddsKeysAbsentFromApplicationProperties() throws Exception {
        // config.json tem precedência menor; chaves repetidas nunca seriam lidas dele
        Properties applicationProperties = PropertiesLoaderUtils.loadProperties(new ClassPathResource("application.properties"));
        EnumerablePropertySource<?> source = (EnumerablePropertySource<?>) new JsonPropertySourceFactory()
            .createPropertySource("jsonConfig", new EncodedResource(new ClassPathResource("config.json")));

        List<String> duplicated = Arrays.stream(source.getPropertyNames())
            .filter(applicationProperties::containsKey)
            .collect(Collectors.toList());

        assertTrue(source.getPropertyNames().length > 0);
        assertEquals(List.of(), duplicated);
    }

    @Test
    void testCreatePropertySource_InvalidJson() {
        EncodedResource resource = new EncodedResource(new ByteArrayResource("{".getBytes(StandardCharsets.UTF_8)));

        assertThrows(java.io.IOException.class,
            () -> new JsonPropertySourceFactory().createPropertySource("jsonConfig", resource));
    }
}
