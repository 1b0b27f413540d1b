package net.tessera.bootstrap.autoconfigure;

import net.tessera.bootstrap.props.TesseraProperties;
import net.tessera.core.backfill.BackfillSummary;
import net.tessera.core.service.InstanceMigrationService;
import net.tessera.integration.spring.TesseraSettings;
import net.tessera.integration.spring.TesseraSpringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration"
})
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(TesseraProperties.class)
@Import(TesseraSpringConfig.class)
public class TesseraAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(TesseraAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TesseraSettings tesseraSettings(TesseraProperties props) {
        return new TesseraSettings(props.getBackfill().getBatchSize(), props.getEventLog().getPageSize());
    }

    @Bean
    @ConditionalOnMissingBean(name = "tesseraMigrationRunner")
    @ConditionalOnProperty(prefix = "tessera.migration", name = "auto-upgrade", havingValue = "true")
    public ApplicationRunner tesseraMigrationRunner(InstanceMigrationService migrations, TesseraProperties props) {
        return args -> {
            var applied = migrations.upgrade();
            applied.forEach((domain, revisions) -> {
                if (!revisions.isEmpty()) log.info("Upgraded {}: {}", domain.displayName(), revisions);
            });
            if (props.getBackfill().isOnStartup()) {
                for (BackfillSummary summary : migrations.migrateData(false)) {
                    log.info("Data migration {}: {}", summary.indexName(),
                            summary.alreadyBuilt() ? "already built" : summary.updated() + " rows updated");
                }
            }
        };
    }
}
