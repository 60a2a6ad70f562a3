package io.vigil.core.engine;

public record AskOptions(String historyPreamble) {

    public static AskOptions none() {
        return new AskOptions(null);
    }
}
