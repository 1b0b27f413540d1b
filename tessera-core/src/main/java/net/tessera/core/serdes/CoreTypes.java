package net.tessera.core.serdes;

import net.tessera.core.model.AssetKey;
import net.tessera.core.model.AssetMaterialization;
import net.tessera.core.model.EngineEvent;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.EventType;
import net.tessera.core.model.InstigatorState;
import net.tessera.core.model.InstigatorStatus;
import net.tessera.core.model.InstigatorType;
import net.tessera.core.model.Run;
import net.tessera.core.model.RunBundle;
import net.tessera.core.model.RunStatus;
import net.tessera.core.model.ScheduleInstigatorData;
import net.tessera.core.model.SensorInstigatorData;
import net.tessera.core.model.SerializableErrorInfo;
import net.tessera.core.model.TickData;
import net.tessera.core.model.TickStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registrations of every persisted model type, including the tags, field names and enum values that
 * earlier releases wrote.
 */
public final class CoreTypes {
    private CoreTypes() {}

    private static final class Holder {
        static final TypeRegistry REGISTRY = builder().build();
        static final Serdes SERDES = new Serdes(REGISTRY);
    }

    public static TypeRegistry registry() {
        return Holder.REGISTRY;
    }

    public static Serdes serdes() {
        return Holder.SERDES;
    }

    /** A builder preloaded with the model types, for registries that add their own. */
    public static TypeRegistry.Builder builder() {
        return TypeRegistry.builder()
                .registerEnum(SerdesEnum.builder("RunStatus", RunStatus.class).legacyTag("PipelineRunStatus").build())
                .registerEnum(SerdesEnum.builder("InstigatorType", InstigatorType.class).legacyTag("JobType").build())
                .registerEnum(SerdesEnum.builder("InstigatorStatus", InstigatorStatus.class)
                        .legacyTag("ScheduleStatus").legacyTag("JobStatus")
                        .renamedValue("ENDED", "STOPPED")
                        .build())
                .registerEnum(SerdesEnum.builder("TickStatus", TickStatus.class).legacyTag("JobTickStatus").build())
                .register(assetKey())
                .register(assetMaterialization())
                .register(run())
                .register(engineEvent())
                .register(eventLogEntry())
                .register(serializableErrorInfo())
                .register(scheduleData())
                .register(sensorData())
                .register(instigatorState())
                .register(tickData())
                .register(runBundle());
    }

    static SerdesType<AssetKey> assetKey() {
        return SerdesType.builder("AssetKey", AssetKey.class)
                .field("path", AssetKey::path)
                .factory(v -> new AssetKey(v.getList("path", String.class)))
                .build();
    }

    static SerdesType<AssetMaterialization> assetMaterialization() {
        return SerdesType.builder("AssetMaterialization", AssetMaterialization.class)
                .field("asset_key", AssetMaterialization::assetKey)
                .optionalField("partition", AssetMaterialization::partition)
                .field("tags", AssetMaterialization::tags, Map::of)
                .optionalField("description", AssetMaterialization::description)
                .factory(v -> new AssetMaterialization(
                        v.value("asset_key", AssetKey.class),
                        v.getString("partition"),
                        v.getMap("tags", String.class),
                        v.getString("description")))
                .build();
    }

    static SerdesType<Run> run() {
        return SerdesType.builder("Run", Run.class)
                .legacyTag("PipelineRun")
                .renamedField("pipeline_name", "job_name")
                .renamedField("pipeline_snapshot_id", "job_snapshot_id")
                .renamedField("solid_selection", "op_selection")
                .field("run_id", Run::runId)
                .field("job_name", Run::jobName)
                .field("status", Run::status, () -> RunStatus.NOT_STARTED)
                .field("run_config", Run::runConfig, Map::of)
                .field("tags", Run::tags, Map::of)
                .optionalField("root_run_id", Run::rootRunId)
                .optionalField("parent_run_id", Run::parentRunId)
                .optionalField("job_snapshot_id", Run::jobSnapshotId)
                .optionalField("execution_plan_snapshot_id", Run::executionPlanSnapshotId)
                .optionalField("op_selection", Run::opSelection)
                .optionalField("step_keys_to_execute", Run::stepKeysToExecute)
                .optionalField("asset_selection", Run::assetSelection)
                .factory(v -> new Run(
                        v.getString("run_id"),
                        v.getString("job_name"),
                        v.getEnum("status", RunStatus.class),
                        v.getMap("run_config", Object.class),
                        v.getMap("tags", String.class),
                        v.getString("root_run_id"),
                        v.getString("parent_run_id"),
                        v.getString("job_snapshot_id"),
                        v.getString("execution_plan_snapshot_id"),
                        v.getList("op_selection", String.class),
                        v.getList("step_keys_to_execute", String.class),
                        v.getSet("asset_selection", AssetKey.class)))
                .build();
    }

    static SerdesType<EngineEvent> engineEvent() {
        return SerdesType.builder("EngineEvent", EngineEvent.class)
                .renamedField("event_type_value", "event_type")
                .renamedField("pipeline_name", "job_name")
                .field("event_type", e -> e.eventType().name())
                .optionalField("job_name", EngineEvent::jobName)
                .optionalField("step_key", EngineEvent::stepKey)
                .optionalField("message", EngineEvent::message)
                .optionalField("event_specific_data", EngineEvent::eventSpecificData)
                .unpackHook(fields -> {
                    if (fields.get("event_type") instanceof String name) {
                        fields.put("event_type", EventType.fromValue(name));
                    }
                    return fields;
                })
                .factory(v -> new EngineEvent(
                        v.getEnum("event_type", EventType.class),
                        v.getString("job_name"),
                        v.getString("step_key"),
                        v.getString("message"),
                        v.get("event_specific_data")))
                .build();
    }

    static SerdesType<EventLogEntry> eventLogEntry() {
        return SerdesType.builder("EventLogEntry", EventLogEntry.class)
                .legacyTag("EventRecord")
                .renamedField("engine_event", "event")
                .renamedField("user_message", "message")
                .field("run_id", EventLogEntry::runId)
                .field("timestamp", EventLogEntry::timestamp)
                .field("level", EventLogEntry::level, () -> EventLogEntry.INFO)
                .field("message", EventLogEntry::message, () -> "")
                .optionalField("step_key", EventLogEntry::stepKey)
                .optionalField("event", EventLogEntry::event)
                .factory(v -> new EventLogEntry(
                        v.getString("run_id"),
                        v.getDouble("timestamp"),
                        v.getInt("level"),
                        v.getString("message"),
                        v.getString("step_key"),
                        v.value("event", EngineEvent.class)))
                .build();
    }

    static SerdesType<SerializableErrorInfo> serializableErrorInfo() {
        return SerdesType.builder("SerializableErrorInfo", SerializableErrorInfo.class)
                .renamedField("cls_name", "class_name")
                .field("message", SerializableErrorInfo::message)
                .optionalField("class_name", SerializableErrorInfo::className)
                .field("stack", SerializableErrorInfo::stack, List::of)
                .optionalField("cause", SerializableErrorInfo::cause)
                .factory(v -> new SerializableErrorInfo(
                        v.getString("message"),
                        v.getString("class_name"),
                        v.getList("stack", String.class),
                        v.value("cause", SerializableErrorInfo.class)))
                .build();
    }

    static SerdesType<ScheduleInstigatorData> scheduleData() {
        return SerdesType.builder("ScheduleInstigatorData", ScheduleInstigatorData.class)
                .legacyTag("ScheduleJobData")
                .field("cron_schedule", ScheduleInstigatorData::cronSchedule)
                .optionalField("start_timestamp", ScheduleInstigatorData::startTimestamp)
                .optionalField("execution_timezone", ScheduleInstigatorData::executionTimezone)
                .factory(v -> new ScheduleInstigatorData(
                        v.getString("cron_schedule"),
                        v.getDouble("start_timestamp"),
                        v.getString("execution_timezone")))
                .build();
    }

    static SerdesType<SensorInstigatorData> sensorData() {
        return SerdesType.builder("SensorInstigatorData", SensorInstigatorData.class)
                .legacyTag("SensorJobData")
                .renamedField("min_interval", "min_interval_seconds")
                .optionalField("last_tick_timestamp", SensorInstigatorData::lastTickTimestamp)
                .optionalField("last_run_key", SensorInstigatorData::lastRunKey)
                .optionalField("min_interval_seconds", SensorInstigatorData::minIntervalSeconds)
                .optionalField("cursor", SensorInstigatorData::cursor)
                .factory(v -> new SensorInstigatorData(
                        v.getDouble("last_tick_timestamp"),
                        v.getString("last_run_key"),
                        v.getInt("min_interval_seconds"),
                        v.getString("cursor")))
                .build();
    }

    static SerdesType<InstigatorState> instigatorState() {
        return SerdesType.builder("InstigatorState", InstigatorState.class)
                .legacyTag("ScheduleState")
                .legacyTag("JobState")
                .renamedField("job_origin_id", "origin_id")
                .renamedField("schedule_origin_id", "origin_id")
                .renamedField("job_name", "instigator_name")
                .renamedField("schedule_name", "instigator_name")
                .renamedField("job_type", "instigator_type")
                .renamedField("job_specific_data", "instigator_data")
                .field("origin_id", InstigatorState::originId)
                .optionalField("instigator_name", InstigatorState::instigatorName)
                .field("instigator_type", InstigatorState::instigatorType, () -> InstigatorType.SCHEDULE)
                .field("status", InstigatorState::status)
                .optionalField("instigator_data", InstigatorState::instigatorData)
                .factory(v -> new InstigatorState(
                        v.getString("origin_id"),
                        v.getString("instigator_name"),
                        v.getEnum("instigator_type", InstigatorType.class),
                        v.getEnum("status", InstigatorStatus.class),
                        v.get("instigator_data")))
                .build();
    }

    static SerdesType<TickData> tickData() {
        return SerdesType.builder("TickData", TickData.class)
                .legacyTag("JobTickData")
                .renamedField("job_origin_id", "origin_id")
                .renamedField("job_name", "instigator_name")
                .renamedField("job_type", "instigator_type")
                .field("origin_id", TickData::originId)
                .optionalField("instigator_name", TickData::instigatorName)
                .field("instigator_type", TickData::instigatorType, () -> InstigatorType.SCHEDULE)
                .field("status", TickData::status)
                .field("timestamp", TickData::timestamp)
                .optionalField("end_timestamp", TickData::endTimestamp)
                .skipWhenEmpty("run_ids", TickData::runIds, List::of)
                .skipWhenEmpty("run_keys", TickData::runKeys, List::of)
                .optionalField("cursor", TickData::cursor)
                .optionalField("skip_reason", TickData::skipReason)
                .optionalField("error", TickData::error)
                .unpackHook(CoreTypes::closeLegacyTick)
                .factory(v -> new TickData(
                        v.getString("origin_id"),
                        v.getString("instigator_name"),
                        v.getEnum("instigator_type", InstigatorType.class),
                        v.getEnum("status", TickStatus.class),
                        v.getDouble("timestamp"),
                        v.getDouble("end_timestamp"),
                        v.getList("run_ids", String.class),
                        v.getList("run_keys", String.class),
                        v.getString("cursor"),
                        v.getString("skip_reason"),
                        v.value("error", SerializableErrorInfo.class)))
                .build();
    }

    /** Ticks written before end timestamps existed end when they started. */
    private static Map<String, Object> closeLegacyTick(Map<String, Object> fields) {
        if (fields.get("status") instanceof TickStatus s && s.isTerminal() && fields.get("end_timestamp") == null) {
            Map<String, Object> copy = new LinkedHashMap<>(fields);
            copy.put("end_timestamp", fields.get("timestamp"));
            return copy;
        }
        return fields;
    }

    static SerdesType<RunBundle> runBundle() {
        return SerdesType.builder("RunBundle", RunBundle.class)
                .field("run", RunBundle::run)
                .field("events", RunBundle::events, List::of)
                .factory(v -> new RunBundle(
                        v.value("run", Run.class),
                        new ArrayList<>(v.getList("events", EventLogEntry.class))))
                .build();
    }
}
