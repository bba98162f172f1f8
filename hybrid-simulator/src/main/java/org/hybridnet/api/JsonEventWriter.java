package org.hybridnet.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.hybridnet.engine.FiringRecord;
import org.hybridnet.engine.FlowRecord;
import org.hybridnet.io.SettingsCodec;
import org.hybridnet.model.SimulationSettings;

/**
 * Writes one JSON object per line for every simulation event.
 */
public class JsonEventWriter implements SimulationListener {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Writer writer;

    public JsonEventWriter(Writer writer) {
        this.writer = writer;
    }

    @Override
    public void onTransitionFired(FiringRecord record) {
        Map<String, Object> event = event("fired");
        event.put("transition", record.getTransitionId());
        event.put("kind", record.getKind().name());
        event.put("time", record.getTime());
        event.put("consumed", record.getConsumed());
        event.put("produced", record.getProduced());
        if (record.getBurst() != null) {
            event.put("burst", record.getBurst());
        }
        if (record.getElapsed() != null) {
            event.put("elapsed", record.getElapsed());
        }
        emit(event);
    }

    @Override
    public void onFlowIntegrated(FlowRecord record) {
        Map<String, Object> event = event("flow");
        event.put("transition", record.getTransitionId());
        event.put("time", record.getTime());
        event.put("rate", record.getRate());
        event.put("dt", record.getDt());
        event.put("consumed", record.getConsumed());
        event.put("produced", record.getProduced());
        event.put("method", record.getMethod());
        event.put("clamped", record.isClamped());
        emit(event);
    }

    @Override
    public void onStepExecuted(StepEvent event) {
        Map<String, Object> json = event("step");
        json.put("step", event.getStep());
        json.put("time", event.getTime());
        json.put("dt", event.getDt());
        json.put("marking", event.getMarking());
        if (!event.getFailures().isEmpty()) {
            json.put("failures", event.getFailures());
        }
        if (!event.getMissedDeadlines().isEmpty()) {
            json.put("missed_deadlines", event.getMissedDeadlines());
        }
        emit(json);
    }

    @Override
    public void onReset() {
        emit(event("reset"));
    }

    @Override
    public void onSettingsChanged(SimulationSettings settings) {
        Map<String, Object> event = event("settings");
        event.put("settings", SettingsCodec.toDocument(settings));
        emit(event);
    }

    private static Map<String, Object> event(String type) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", type);
        return event;
    }

    private void emit(Map<String, Object> event) {
        try {
            writer.write(objectMapper.writeValueAsString(event));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write simulation event", e);
        }
    }
}
