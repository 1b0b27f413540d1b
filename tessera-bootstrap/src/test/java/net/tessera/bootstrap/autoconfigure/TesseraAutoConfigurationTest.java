package net.tessera.bootstrap.autoconfigure;

import com.zaxxer.hikari.HikariDataSource;
import net.tessera.adapter.jdbc.SqliteDataSources;
import net.tessera.bootstrap.props.TesseraProperties;
import net.tessera.core.backfill.SecondaryIndexes;
import net.tessera.core.model.Run;
import net.tessera.core.service.EventLogStorage;
import net.tessera.core.service.InstanceMigrationService;
import net.tessera.core.service.InstigatorStorage;
import net.tessera.core.service.RunBundleService;
import net.tessera.core.service.RunStorage;
import net.tessera.integration.spring.TesseraSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TesseraAutoConfigurationTest {

    @TempDir
    static Path tmp;

    private static int databases;

    @Configuration
    static class SqliteConfig {
        @Bean(destroyMethod = "close")
        HikariDataSource dataSource() {
            return SqliteDataSources.create(tmp.resolve("boot-" + (++databases) + ".db"));
        }

        @Bean
        PlatformTransactionManager transactionManager(DataSource ds) {
            return new DataSourceTransactionManager(ds);
        }
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TesseraAutoConfiguration.class));

    @Test
    void backsOff_withoutADataSource() {
        runner.run(ctx -> assertThat(ctx).doesNotHaveBean(RunStorage.class));
    }

    @Test
    void registersStorages_andAMigrationRunner() {
        runner.withUserConfiguration(SqliteConfig.class)
                .withPropertyValues("tessera.migration.auto-upgrade=true")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(RunStorage.class)
                            .hasSingleBean(EventLogStorage.class)
                            .hasSingleBean(InstigatorStorage.class)
                            .hasSingleBean(RunBundleService.class)
                            .hasBean("tesseraMigrationRunner");
                    assertThat(ctx.getBean(TesseraProperties.class).getEventLog().getPageSize()).isEqualTo(1000);

                    InstanceMigrationService migrations = ctx.getBean(InstanceMigrationService.class);
                    assertThat(migrations.status()).noneSatisfy(s -> assertThat(s.atHead()).isTrue());

                    ctx.getBean("tesseraMigrationRunner", ApplicationRunner.class).run(new DefaultApplicationArguments());

                    assertThat(migrations.status()).allSatisfy(s -> assertThat(s.atHead()).isTrue());
                    assertThat(ctx.getBean(RunStorage.class).hasBuiltIndex(SecondaryIndexes.RUN_PARTITIONS)).isFalse();
                });
    }

    @Test
    void startupBackfill_marksEveryIndexBuilt() {
        runner.withUserConfiguration(SqliteConfig.class)
                .withPropertyValues("tessera.migration.auto-upgrade=true", "tessera.backfill.on-startup=true",
                        "tessera.backfill.batch-size=50")
                .run(ctx -> {
                    assertThat(ctx.getBean(TesseraProperties.class).getBackfill().getBatchSize()).isEqualTo(50);

                    ctx.getBean("tesseraMigrationRunner", ApplicationRunner.class).run(new DefaultApplicationArguments());

                    assertThat(ctx.getBean(RunStorage.class).hasBuiltIndex(SecondaryIndexes.RUN_PARTITIONS)).isTrue();
                    EventLogStorage events = ctx.getBean(EventLogStorage.class);
                    assertThat(events.hasBuiltIndex(SecondaryIndexes.EVENT_LOG_COLUMNS)).isTrue();
                    assertThat(events.hasBuiltIndex(SecondaryIndexes.ASSET_KEY_TABLE)).isTrue();
                });
    }

    @Test
    void batchAndPageSizes_reachTheStorages() {
        runner.withUserConfiguration(SqliteConfig.class)
                .withPropertyValues("tessera.backfill.batch-size=2", "tessera.event-log.page-size=7")
                .run(ctx -> {
                    assertThat(ctx.getBean(TesseraSettings.class)).isEqualTo(new TesseraSettings(2, 7));
                    InstanceMigrationService migrations = ctx.getBean(InstanceMigrationService.class);
                    migrations.upgrade();
                    RunStorage runs = ctx.getBean(RunStorage.class);
                    for (int i = 1; i <= 5; i++) {
                        runs.createRun(Run.builder("r" + i, "etl").partition("daily", "2024-01-0" + i).build());
                    }

                    assertThat(migrations.migrateData(true))
                            .filteredOn(s -> s.indexName().equals(SecondaryIndexes.RUN_PARTITIONS))
                            .singleElement()
                            .satisfies(s -> assertThat(s.batches()).isEqualTo(3));
                    assertThat(ctx.getBean(EventLogStorage.class).getLogsForRun("r1").pageSize()).isEqualTo(7);
                });
    }

    @Test
    void withoutAutoUpgrade_noRunnerIsRegistered() {
        runner.withUserConfiguration(SqliteConfig.class).run(ctx -> {
            assertThat(ctx).hasSingleBean(RunStorage.class).doesNotHaveBean("tesseraMigrationRunner");
            assertThat(ctx.getBean(InstanceMigrationService.class).status())
                    .noneSatisfy(s -> assertThat(s.atHead()).isTrue());
        });
    }
}
