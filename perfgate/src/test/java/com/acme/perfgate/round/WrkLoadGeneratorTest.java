package com.acme.perfgate.round;

import com.acme.perfgate.lifecycle.ServiceSettings;
import com.acme.perfgate.util.DurationSpec;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WrkLoadGeneratorTest {

    @Test
    void shouldBuildStandardProfileCommand() {
        ServiceSettings settings = ServiceSettings.fromEnvironment(Map.of());
        WrkLoadGenerator generator = new WrkLoadGenerator(settings, DurationSpec.parse("3s"));

        List<String> command = generator.command(Path.of("/tmp/x.lua"),
            URI.create("http://127.0.0.1:18080/v1/chat/completions"));

        assertEquals(List.of("wrk", "-t1", "-c8", "-d3s", "--timeout", "2s", "--latency",
            "-s", "/tmp/x.lua", "http://127.0.0.1:18080/v1/chat/completions"), command);
    }

    @Test
    void shouldQuotePayloadIntoLuaString() {
        String script = WrkLoadGenerator.luaScript("{\"content\":\"it's\"}");
        assertTrue(script.contains("wrk.method = \"POST\""));
        assertTrue(script.contains("wrk.headers[\"Authorization\"] = \"Bearer sk-client\""));
        assertTrue(script.contains("wrk.body = '{\"content\":\"it\\'s\"}'"));
    }
}
