package org.hybridnet.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.io.StringWriter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.hybridnet.engine.SimulationController;
import org.hybridnet.model.ConflictPolicy;
import org.hybridnet.model.PetriNetModel;
import org.hybridnet.model.RateFunction;
import org.hybridnet.model.SimulationSettings;
import org.hybridnet.model.TransitionParameters;
import org.junit.jupiter.api.Test;

public class JsonEventWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void testOneObjectPerEvent() throws Exception {
        PetriNetModel net = new PetriNetModel();
        net.addPlace("P1", 1);
        net.addPlace("P2", 0);
        net.addPlace("P3", 4);
        net.addPlace("P4", 0);
        net.addTransition("T1", TransitionParameters.immediate());
        net.addInputArc("P1", "T1");
        net.addOutputArc("T1", "P2");
        net.addTransition("C1", TransitionParameters.continuous(RateFunction.constant(1)));
        net.addInputArc("P3", "C1");
        net.addOutputArc("C1", "P4");
        StringWriter out = new StringWriter();
        SimulationController controller = new SimulationController(net,
                SimulationSettings.builder().manualDt(0.5).build(), new JsonEventWriter(out));

        controller.step();
        controller.setConflictPolicy(ConflictPolicy.PRIORITY);
        controller.reset();

        String[] lines = out.toString().trim().split("\n");
        assertEquals(5, lines.length, "fired, flow, step, settings and reset events");

        JsonNode fired = objectMapper.readTree(lines[0]);
        assertEquals("fired", fired.get("type").asText());
        assertEquals("T1", fired.get("transition").asText());
        assertEquals("IMMEDIATE", fired.get("kind").asText());
        assertEquals(1.0, fired.get("consumed").get("P1").asDouble(), 0.0);

        JsonNode flow = objectMapper.readTree(lines[1]);
        assertEquals("flow", flow.get("type").asText());
        assertEquals("rk4", flow.get("method").asText());
        assertEquals(0.5, flow.get("produced").get("P4").asDouble(), 1e-12);
        assertFalse(flow.get("clamped").asBoolean());

        JsonNode step = objectMapper.readTree(lines[2]);
        assertEquals("step", step.get("type").asText());
        assertEquals(1, step.get("step").asInt());
        assertEquals(3.5, step.get("marking").get("P3").asDouble(), 1e-12);

        JsonNode settings = objectMapper.readTree(lines[3]);
        assertEquals("priority", settings.get("settings").get("conflict_policy").asText());
        assertEquals("reset", objectMapper.readTree(lines[4]).get("type").asText());
    }
}
