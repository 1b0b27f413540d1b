package net.tessera.core.service;

import net.tessera.core.error.RunAlreadyExistsException;
import net.tessera.core.error.RunNotFoundException;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.Run;
import net.tessera.core.model.RunBundle;
import net.tessera.core.serdes.Serdes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** Debug export and import of a single run with its event log, as gzip-compressed codec JSON. */
public final class RunBundleService {
    private static final Logger log = LoggerFactory.getLogger(RunBundleService.class);

    private final RunStorage runs;
    private final EventLogStorage events;
    private final Serdes serdes;

    public RunBundleService(RunStorage runs, EventLogStorage events, Serdes serdes) {
        this.runs = runs;
        this.events = events;
        this.serdes = serdes;
    }

    public RunBundle exportRun(String runId, OutputStream out) throws Exception {
        Run run = runs.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        List<EventLogEntry> entries = events.getLogsForRun(runId).entries();
        RunBundle bundle = new RunBundle(run, entries);
        GZIPOutputStream gz = new GZIPOutputStream(out);
        gz.write(serdes.serialize(bundle).getBytes(StandardCharsets.UTF_8));
        gz.finish();
        log.info("Exported run {} with {} events", runId, entries.size());
        return bundle;
    }

    /**
     * Recreates the run and appends its events in their original order.
     *
     * <p>Both stores are checked for a writable schema first, so a rejected import leaves no run behind.
     *
     * @throws RunAlreadyExistsException when the run id is already stored
     */
    public Run importRun(InputStream in) throws Exception {
        String json;
        try (GZIPInputStream gz = new GZIPInputStream(in)) {
            json = new String(gz.readAllBytes(), StandardCharsets.UTF_8);
        }
        RunBundle bundle = serdes.deserialize(json, RunBundle.class);
        runs.migrator().requireWritable();
        events.migrator().requireWritable();
        Run run = runs.createRun(bundle.run());
        for (EventLogEntry e : bundle.events()) events.appendEvent(e);
        log.info("Imported run {} with {} events", run.runId(), bundle.events().size());
        return run;
    }
}
