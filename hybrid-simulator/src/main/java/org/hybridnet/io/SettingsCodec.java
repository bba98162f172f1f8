package org.hybridnet.io;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.hybridnet.model.ConflictPolicy;
import org.hybridnet.model.ModelConfigurationException;
import org.hybridnet.model.SimulationSettings;
import org.hybridnet.model.TimeUnits;

/**
 * Reads and writes {@link SimulationSettings} as JSON.
 */
public final class SettingsCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private SettingsCodec() {
    }

    public static SettingsDocument toDocument(SimulationSettings settings) {
        SettingsDocument document = new SettingsDocument();
        document.time_units = settings.getTimeUnits().name().toLowerCase(Locale.ROOT);
        document.duration = settings.getDuration();
        document.time_scale = settings.getTimeScale();
        document.dt_auto = settings.isDtAuto();
        document.dt_manual = settings.getDtManual();
        document.conflict_policy = settings.getConflictPolicy().name().toLowerCase(Locale.ROOT);
        document.random_seed = settings.getRandomSeed();
        return document;
    }

    /**
     * @throws ModelConfigurationException for unknown unit or policy names
     * @throws IllegalArgumentException for out of range values
     */
    public static SimulationSettings fromDocument(SettingsDocument document) {
        SimulationSettings settings = new SimulationSettings();
        if (document.time_units != null) {
            settings.setTimeUnits(TimeUnits.fromName(document.time_units));
        }
        settings.setDuration(document.duration);
        settings.setTimeScale(document.time_scale);
        settings.setDtAuto(document.dt_auto);
        settings.setDtManual(document.dt_manual);
        if (document.conflict_policy != null) {
            settings.setConflictPolicy(ConflictPolicy.fromName(document.conflict_policy));
        }
        settings.setRandomSeed(document.random_seed);
        return settings;
    }

    public static String write(SimulationSettings settings) {
        try {
            return objectMapper.writeValueAsString(toDocument(settings));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize settings", e);
        }
    }

    public static void write(SimulationSettings settings, Writer writer) throws IOException {
        objectMapper.writeValue(writer, toDocument(settings));
    }

    public static SimulationSettings read(String json) {
        try {
            return fromDocument(objectMapper.readValue(json, SettingsDocument.class));
        } catch (JsonProcessingException e) {
            throw new ModelConfigurationException("Malformed settings document: " + e.getOriginalMessage());
        }
    }

    public static SimulationSettings read(Reader reader) throws IOException {
        return fromDocument(objectMapper.readValue(reader, SettingsDocument.class));
    }
}
