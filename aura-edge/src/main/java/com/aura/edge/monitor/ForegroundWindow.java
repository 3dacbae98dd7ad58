package com.aura.edge.monitor;

public record ForegroundWindow(String processName, boolean fullscreen) {

    public static final ForegroundWindow UNKNOWN = new ForegroundWindow("", false);

    public ForegroundWindow {
        if (processName == null) {
            processName = "";
        }
    }
}
