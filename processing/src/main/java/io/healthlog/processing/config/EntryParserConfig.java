package io.healthlog.processing.config;

import io.healthlog.processing.alias.AliasSource;
import io.healthlog.processing.alias.ClasspathAliasSource;
import io.healthlog.processing.alias.JsonFileAliasSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the parsing engine. {@code healthlog.aliases.path} points at a user alias file; when it is
 * unset the aliases bundled on the classpath are used.
 */
@Configuration
@ComponentScan(basePackages = "io.healthlog.processing")
public class EntryParserConfig {

    private static final Logger log = LoggerFactory.getLogger(EntryParserConfig.class);

    @Value("${healthlog.aliases.path:}")
    private String aliasesPath;

    @Bean
    public AliasSource aliasSource() {
        if (aliasesPath == null || aliasesPath.isBlank()) {
            log.info("No alias file configured, using bundled aliases");
            return new ClasspathAliasSource();
        }
        log.info("Using alias file {}", aliasesPath);
        return new JsonFileAliasSource(Path.of(aliasesPath));
    }
}
