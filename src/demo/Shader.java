package demo;

import static org.lwjgl.opengl.GL20.*;

import log.Log;

/** Vertex + fragment program. Compile and link problems are logged, not thrown. */
final class Shader {
    final int programId;

    Shader(String vs, String fs) {
        int v = compile(GL_VERTEX_SHADER, "vertex", vs);
        int f = compile(GL_FRAGMENT_SHADER, "fragment", fs);

        programId = glCreateProgram();
        glAttachShader(programId, v); glAttachShader(programId, f);
        glLinkProgram(programId);
        if (glGetProgrami(programId, GL_LINK_STATUS) == GL_FALSE) {
            Log.error(Shader.class, "program link error: %s", glGetProgramInfoLog(programId));
        }
        glDeleteShader(v); glDeleteShader(f);
    }

    void use() { glUseProgram(programId); }

    private static int compile(int type, String label, String src) {
        int id = glCreateShader(type);
        glShaderSource(id, src);
        glCompileShader(id);
        if (glGetShaderi(id, GL_COMPILE_STATUS) == GL_FALSE) {
            Log.error(Shader.class, "%s shader compile error: %s", label, glGetShaderInfoLog(id));
        }
        return id;
    }
}
