package net.tessera.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("tessera")
public class TesseraProperties {
    private Migration migration = new Migration();
    private Backfill backfill = new Backfill();
    private EventLog eventLog = new EventLog();

    public Migration getMigration() {
        return migration;
    }

    public void setMigration(Migration migration) {
        this.migration = migration;
    }

    public Backfill getBackfill() {
        return backfill;
    }

    public void setBackfill(Backfill backfill) {
        this.backfill = backfill;
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    public void setEventLog(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    public static class Migration {
        /** Upgrade every storage domain to its head revision on startup. */
        private boolean autoUpgrade = false;

        public boolean isAutoUpgrade() {
            return autoUpgrade;
        }

        public void setAutoUpgrade(boolean autoUpgrade) {
            this.autoUpgrade = autoUpgrade;
        }
    }

    public static class Backfill {
        private boolean onStartup = false;
        private int batchSize = 500;

        public boolean isOnStartup() {
            return onStartup;
        }

        public void setOnStartup(boolean onStartup) {
            this.onStartup = onStartup;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class EventLog {
        private int pageSize = 1000;

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }
}
