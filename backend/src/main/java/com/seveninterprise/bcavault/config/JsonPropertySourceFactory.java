package com.seveninterprise.bcavault.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PropertySourceFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory para criar PropertySource a partir do arquivo config.json
 *
 * Objetos aninhados viram chaves com ponto, ex.:
 * {"bcavault": {"backup": {"notification": {"recipients": "a@b"}}}}
 * → bcavault.backup.notification.recipients
 *
 * Arrays de valores simples viram listas separadas por vírgula.
 */
public class JsonPropertySourceFactory implements PropertySourceFactory {

    private static final Logger log = LoggerFactory.getLogger(JsonPropertySourceFactory.class);

    @Override
    public PropertySource<?> createPropertySource(String name, EncodedResource resource) throws IOException {
        Map<String, Object> properties = new LinkedHashMap<>();

        try (InputStream input = resource.getInputStream()) {
            JsonNode rootNode = new ObjectMapper().readTree(input);
            if (rootNode != null && rootNode.isObject()) {
                flatten(rootNode, "", properties);
            }
        } catch (IOException e) {
            log.error("Erro ao carregar {}: {}", resource.getResource().getFilename(), e.getMessage());
            throw new IOException("Falha ao carregar config.json", e);
        }

        log.info("Carregadas {} propriedades do config.json", properties.size());
        return new MapPropertySource(name != null ? name : "jsonConfig", properties);
    }

    static void flatten(JsonNode node, String prefix, Map<String, Object> properties) {
        node.fields().forEachRemaining(entry -> {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            JsonNode value = entry.getValue();

            if (value.isObject()) {
                flatten(value, key, properties);
            } else if (value.isArray()) {
                StringBuilder joined = new StringBuilder();
                value.forEach(item -> {
                    if (joined.length() > 0) {
                        joined.append(',');
                    }
                    joined.append(item.asText());
                });
                properties.put(key, joined.toString());
            } else if (value.isIntegralNumber()) {
                properties.put(key, value.asLong());
            } else if (value.isNumber()) {
                properties.put(key, value.asDouble());
            } else if (value.isBoolean()) {
                properties.put(key, value.asBoolean());
            } else if (!value.isNull()) {
                properties.put(key, value.asText());
            }
        });
    }
}
