package io.vigil.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vigil.core.tool.impl.CronTool;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

    @Test
    void shouldRegisterAndResolveTool() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new EchoTool());

        assertThat(registry.find("echo")).isPresent();
        assertThat(registry.find("echo").orElseThrow().execute(Map.of("text", "ok"), new ToolContext(null, null)))
            .isEqualTo("ok");
        assertThat(registry.find("missing")).isEmpty();
    }

    @Test
    void shouldKeepRegistrationOrder() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new EchoTool());
        registry.register(new CronTool());

        assertThat(registry.all()).extracting(Tool::name).containsExactly("echo", "cron");
    }

    @Test
    void contextShouldRejectServiceOfWrongType() {
        ToolContext context = new ToolContext(null, Map.of("cronEngine", "not an engine"));

        assertThat(context.service("missing", String.class)).isNull();
        assertThat(context.service("cronEngine", String.class)).isEqualTo("not an engine");
        assertThatThrownBy(() -> context.service("cronEngine", Integer.class))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class EchoTool implements Tool {
        @Override
        public String name() {
            return "echo";
        }

        @Override
        public String description() {
            return "Echo tool";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            return String.valueOf(input.getOrDefault("text", ""));
        }
    }
}
