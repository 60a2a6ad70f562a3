package io.vigil.core.engine;

import java.util.List;

public record EngineResult(String text, List<String> media) {

    public EngineResult {
        text = text == null ? "" : text;
        media = media == null ? List.of() : List.copyOf(media);
    }

    public static EngineResult text(String text) {
        return new EngineResult(text, List.of());
    }
}
