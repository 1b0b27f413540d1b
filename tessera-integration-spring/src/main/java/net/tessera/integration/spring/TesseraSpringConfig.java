package net.tessera.integration.spring;

import net.tessera.adapter.jdbc.JdbcStorages;
import net.tessera.core.serdes.CoreTypes;
import net.tessera.core.serdes.Serdes;
import net.tessera.core.service.EventLogStorage;
import net.tessera.core.service.InstanceMigrationService;
import net.tessera.core.service.InstigatorStorage;
import net.tessera.core.service.RunBundleService;
import net.tessera.core.service.RunStorage;
import net.tessera.core.spi.Clock;
import net.tessera.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** All three storages on the application's data source, with Spring-managed transactions. */
@Configuration
public class TesseraSpringConfig {

    @Bean
    public Serdes tesseraSerdes() {
        return CoreTypes.serdes();
    }

    @Bean
    public Clock tesseraClock() {
        return Clock.system();
    }

    @Bean
    public JdbcStorages jdbcStorages(DataSource ds, PlatformTransactionManager tm, Serdes serdes, Clock clock,
                                     ObjectProvider<TesseraSettings> settings) {
        TesseraSettings s = settings.getIfAvailable(TesseraSettings::defaults);
        return JdbcStorages.builder(ds)
                .serdes(serdes)
                .clock(clock)
                .batchSize(s.batchSize())
                .pageSize(s.pageSize())
                .txRunners(source -> new SpringTxRunner(tm, source))
                .build();
    }

    @Bean public RunStorage runStorage(JdbcStorages s) { return s.runStorage(); }
    @Bean public EventLogStorage eventLogStorage(JdbcStorages s) { return s.eventLogStorage(); }
    @Bean public InstigatorStorage instigatorStorage(JdbcStorages s) { return s.instigatorStorage(); }
    @Bean public InstanceMigrationService instanceMigrationService(JdbcStorages s) { return s.instanceMigrations(); }
    @Bean public RunBundleService runBundleService(JdbcStorages s) { return s.runBundles(); }
}
