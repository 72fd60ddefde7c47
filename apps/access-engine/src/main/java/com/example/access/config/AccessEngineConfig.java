package com.example.access.config;

import com.example.access.audit.AccessAuditSink;
import com.example.access.audit.LoggingAccessAuditSink;
import com.example.access.config.properties.AccessProperties;
import com.example.access.privilege.catalog.PrivilegeCatalog;
import com.example.access.privilege.defaults.RoleDefaultTable;
import com.example.access.privilege.model.UnitRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the privilege catalog and role default table once at startup.
 * Both are validated on creation; an incomplete table fails context startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AccessProperties.class)
public class AccessEngineConfig {

    @Bean
    public PrivilegeCatalog privilegeCatalog() {
        PrivilegeCatalog catalog = PrivilegeCatalog.standard();

        log.info("Loaded {} privileges in {} categories", catalog.size(), catalog.categories().size());
        catalog.byCategory().forEach((category, definitions) -> log.debug("  - {}: {}",
                category, definitions.stream().map(d -> d.future() ? d.code() + " (future)" : d.code()).toList()));

        return catalog;
    }

    @Bean
    public RoleDefaultTable roleDefaultTable(PrivilegeCatalog catalog, AccessProperties properties) {
        RoleDefaultTable table = RoleDefaultTable.standard(catalog);

        log.info("Role default table validated: {} roles x {} privileges, overridePolicy={}, administratorBypass={}",
                UnitRole.values().length, catalog.size(),
                properties.overridePolicy(), properties.administratorBypass().enabled());
        if (!properties.administratorBypass().superusers().isEmpty()) {
            log.info("Superuser bypass configured for {} user(s)", properties.administratorBypass().superusers().size());
        }

        return table;
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessAuditSink accessAuditSink(ObjectMapper objectMapper) {
        return new LoggingAccessAuditSink(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock accessClock() {
        return Clock.systemUTC();
    }
}
