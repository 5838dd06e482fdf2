package render;

import engine.EngineConfig;

/** Windowing/input system: owns window creation and the event pump. */
public interface WindowBackend {
    /** Creates the window hidden. Throws if the platform cannot. */
    Window createWindow(EngineConfig cfg);

    /** Dispatches queued events to the installed callbacks on the calling thread. */
    void pollEvents();

    void terminate();
}
