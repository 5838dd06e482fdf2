package demo;

import static org.lwjgl.opengl.GL11.*;
import static org.lwjgl.opengl.GL15.*;
import static org.lwjgl.opengl.GL20.*;
import static org.lwjgl.opengl.GL30.*;

/** A coloured triangle (vertices 0..2) and a line (vertices 3..4) in one VAO. */
final class TriangleMesh {
    // xy rgb
    static final float[] VERTICES = {
         0.0f,  0.5f,   1f, 0f, 0f,
         0.5f, -0.5f,   0f, 1f, 0f,
        -0.5f, -0.5f,   0f, 0f, 1f,
         0.5f,  0.5f,   1f, 1f, 0f,
        -0.5f,  0.5f,   0f, 1f, 1f,
    };

    final int vao, vbo;

    TriangleMesh() {
        vao = glGenVertexArrays();
        glBindVertexArray(vao);

        vbo = glGenBuffers();
        glBindBuffer(GL_ARRAY_BUFFER, vbo);
        glBufferData(GL_ARRAY_BUFFER, VERTICES, GL_STATIC_DRAW);

        int stride = 5 * Float.BYTES;
        glEnableVertexAttribArray(0);
        glVertexAttribPointer(0, 2, GL_FLOAT, false, stride, 0L);
        glEnableVertexAttribArray(1);
        glVertexAttribPointer(1, 3, GL_FLOAT, false, stride, 2L * Float.BYTES);

        glBindVertexArray(0);
    }

    void draw() {
        glBindVertexArray(vao);
        glDrawArrays(GL_TRIANGLES, 0, 3);
        glDrawArrays(GL_LINES, 3, 2);
        glBindVertexArray(0);
    }
}
