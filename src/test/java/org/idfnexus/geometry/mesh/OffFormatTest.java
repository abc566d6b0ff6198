package org.idfnexus.geometry.mesh;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OffFormatTest {

    @TempDir
    Path tempDir;

    @Test
    void writeThenRead_singleTriangle() throws Exception {
        Mesh triangle = new Mesh(new double[]{0, 0, 0, 1, 0, 0, 0, 1, 0}, new int[]{0}, new int[]{0, 1, 2});
        Path file = tempDir.resolve("out/triangle.off");

        OffFormat.write(triangle, file);
        Mesh read = OffFormat.read(file);

        assertThat(read.vertices()).containsExactly(triangle.vertices());
        assertThat(read.faces()).containsExactly(0);
        assertThat(read.windingOrder()).containsExactly(0, 1, 2);
    }

    @Test
    void format_countsLineUsesFaceCount() {
        Mesh quads = new Mesh(new double[]{0, 0, 0, 1, 0, 0, 1, 1, 0, 0, 1, 0, 0, 0, 1, 1, 0, 1},
                new int[]{0, 4}, new int[]{0, 1, 2, 3, 0, 1, 5, 4});

        String text = OffFormat.format(quads);

        assertThat(text).startsWith("OFF\n");
        assertThat(text).contains("\n6 2 0\n");
        assertThat(text).contains("\n4 0 1 2 3\n").contains("\n4 0 1 5 4\n");
    }

    @Test
    void parse_skipsCommentsBlankLinesAndColours() {
        String text = """
                OFF
                # 一个正方形，两个三角形

                4 2 0
                0 0 0
                1 0 0
                1 1 0
                # 注释也可以出现在顶点之间
                0 1 0
                3 0 1 2 255 0 0
                3 0 2 3
                """;

        Mesh mesh = OffFormat.parse(text);

        assertThat(mesh.vertexCount()).isEqualTo(4);
        assertThat(mesh.faces()).containsExactly(0, 3);
        assertThat(mesh.windingOrder()).containsExactly(0, 1, 2, 0, 2, 3);
        assertThat(mesh.face(1)).containsExactly(0, 2, 3);
    }

    @Test
    void parse_rejectsMalformedInput() {
        assertThatThrownBy(() -> OffFormat.parse("COFF\n1 0 0\n0 0 0\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("OFF");
        assertThatThrownBy(() -> OffFormat.parse("OFF\n3 1 0\n0 0 0\n1 0 0\n0 1 0\n3 0 1 7\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("7");
        assertThatThrownBy(() -> OffFormat.parse("OFF\n2 0 0\n0 0 0\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("顶点不足");
        assertThatThrownBy(() -> OffFormat.parse("OFF\n1 0 0\n0 x 0\n"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void faceVertexMap_flattensRaggedFaces() {
        OffFormat.FaceVertexMap map = OffFormat.faceVertexMap(List.of(new int[]{0, 1, 2}, new int[]{2, 3, 4, 5}));

        assertThat(map.windingOrder()).containsExactly(0, 1, 2, 2, 3, 4, 5);
        assertThat(map.faces()).containsExactly(0, 3);
    }
}
