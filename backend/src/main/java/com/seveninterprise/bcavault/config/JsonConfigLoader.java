package com.seveninterprise.bcavault.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * Configuração que carrega propriedades do arquivo config.json (opcional)
 *
 * Fontes de @PropertySource entram depois de application.properties e das
 * variáveis de ambiente, portanto config.json só fornece chaves que não
 * estão definidas nessas fontes. Uma chave repetida aqui é ignorada.
 */
@Configuration
@PropertySource(value = "classpath:config.json", factory = JsonPropertySourceFactory.class, ignoreResourceNotFound = true)
public class JsonConfigLoader {
}
