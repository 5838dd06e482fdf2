package demo;

import static org.lwjgl.glfw.GLFW.*;
import static org.lwjgl.opengl.GL11.*;

import engine.App;
import engine.AppBuilder;
import engine.AppContext;
import log.Level;
import log.Log;
import registry.Registry;
import registry.ResourceKey;
import render.Action;
import render.CursorMode;

/**
 * Draws a triangle and a line. W logs a message, left Alt prints loop timings, Esc quits,
 * C toggles mouse capture.
 */
public class TriangleDemo {
    static final String MESH = ResourceKey.of("demo", "mesh");
    static final String SHADER = ResourceKey.of("demo", "shader");

    private static final String VS_SRC =
        "#version 330 core\n" +
        "layout(location=0) in vec2 aPos;\n" +
        "layout(location=1) in vec3 aColor;\n" +
        "out vec3 vColor;\n" +
        "void main(){ gl_Position = vec4(aPos, 1.0, 1.0); vColor = aColor; }\n";

    private static final String FS_SRC =
        "#version 330 core\n" +
        "in vec3 vColor;\n" +
        "out vec4 fragColor;\n" +
        "void main(){ fragColor = vec4(vColor, 1.0); }\n";

    public static void main(String[] args) {
        Log.setLevel(Level.DEBUG);
        Registry registry = Registry.global();
        InputState input = new InputState();

        AppBuilder builder = new AppBuilder(800, 600, "duoloop");
        AppContext ctx = builder.context();
        boolean[] captured = { false };

        builder.renderInit(() -> {
                    Log.debug(TriangleDemo.class, "render init");
                    registry.register(MESH, TriangleMesh.class, new TriangleMesh());
                    Shader shader = new Shader(VS_SRC, FS_SRC);
                    registry.register(SHADER, Shader.class, shader);
                    shader.use();
                })
               .renderLoop(() -> {
                    glClearColor(0.3f, 0.4f, 0.5f, 1f);
                    glClear(GL_COLOR_BUFFER_BIT);
                    registry.modify(MESH, TriangleMesh.class, TriangleMesh::draw);
                })
               .eventInit(() -> Log.debug(TriangleDemo.class, "event init"))
               .eventLoop(() -> {
                    if (input.isDown(GLFW_KEY_W)) Log.info(TriangleDemo.class, "W key pressed");
                    if (input.isDown(GLFW_KEY_LEFT_ALT)) {
                        Log.debug("event_loop", "E_MS: %8.2f\tE_FPS: %8.2f\tR_MS: %8.2f\tR_FPS: %8.2f",
                                ctx.eventMs(), ctx.eventFps(), ctx.renderMs(), ctx.renderFps());
                    }
                })
               .onKey((key, scancode, action, mods) -> {
                    input.onKey(key, scancode, action, mods);
                    if (key == GLFW_KEY_ESCAPE) ctx.exit();
                    if (key == GLFW_KEY_C && action == Action.PRESS) {
                        captured[0] = !captured[0];
                        ctx.setCursorMode(captured[0] ? CursorMode.DISABLED : CursorMode.NORMAL);
                    }
                })
               .onResize((w, h) -> Log.debug(TriangleDemo.class, "resized to %dx%d", w, h))
               .onClose(() -> Log.info(TriangleDemo.class, "close requested"));

        try (App app = builder.build()) {
            app.run();
            Log.info(TriangleDemo.class, "bye after %d frames", ctx.renderedFrames());
        }
    }
}
