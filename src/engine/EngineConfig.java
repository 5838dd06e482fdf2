package engine;

/** Window and timing tunables. Read once by {@link AppBuilder#build()}. */
public class EngineConfig {
    public int width = 800;
    public int height = 600;
    public String title = "duoloop";
    public double stallThresholdMs = Telemetry.DEFAULT_STALL_MS; // one frame at 60 Hz
    public boolean vsync = true;          // swap interval 1
    public boolean resizable = true;
    public int glMajor = 3, glMinor = 3;  // core profile
    public boolean glDebug = false;       // KHR_debug output through the logger

    public EngineConfig() {}

    public EngineConfig(int width, int height, String title) {
        this.width = width;
        this.height = height;
        this.title = title;
    }

    void validate() {
        if (width <= 0 || height <= 0) throw new IllegalArgumentException("window size must be positive: " + width + "x" + height);
        if (title == null) throw new IllegalArgumentException("title is null");
        if (!(stallThresholdMs > 0)) throw new IllegalArgumentException("stall threshold must be > 0: " + stallThresholdMs);
    }
}
