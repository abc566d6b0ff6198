package org.idfnexus.geometry.mesh;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * OFF（Object File Format）文本的读写。
 * <p>
 * 格式：首行 {@code OFF}；{@code #} 开头为注释、空行忽略；计数行 {@code <顶点数> <面数> <边数>}（边数只占位）；
 * 之后依次是顶点行 {@code x y z} 与面行 {@code n i0 ... i(n-1)}，面行尾部的颜色值读取时忽略。
 */
public final class OffFormat {

    private OffFormat() {
    }

    /**
     * OFF 风格的面（每行“点数 + 下标”）转换成 {@code (windingOrder, faces)}，避免参差数组。
     *
     * @param windingOrder 所有面的顶点下标依次拼接
     * @param faces        每个面在 windingOrder 中的起始下标
     */
    public record FaceVertexMap(int[] windingOrder, int[] faces) {
    }

    public static FaceVertexMap faceVertexMap(List<int[]> offFaces) {
        int total = 0;
        for (int[] face : offFaces) {
            total += face.length;
        }
        int[] windingOrder = new int[total];
        int[] faces = new int[offFaces.size()];
        int next = 0;
        for (int i = 0; i < offFaces.size(); i++) {
            int[] face = offFaces.get(i);
            faces[i] = next;
            System.arraycopy(face, 0, windingOrder, next, face.length);
            next += face.length;
        }
        return new FaceVertexMap(windingOrder, faces);
    }

    public static Mesh read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static Mesh parse(String text) {
        try {
            return read(new StringReader(text));
        } catch (IOException e) {
            // StringReader 理论上不会抛 IOException
            throw new IllegalStateException("解析 OFF 文本失败", e);
        }
    }

    public static Mesh read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        String header = nextContentLine(reader);
        if (header == null || !"OFF".equals(header)) {
            throw new IllegalArgumentException("OFF 文件必须以 \"OFF\" 开头，实际为：" + header);
        }
        String countsLine = nextContentLine(reader);
        if (countsLine == null) {
            throw new IllegalArgumentException("OFF 文件缺少计数行");
        }
        String[] counts = countsLine.split("\\s+");
        int vertexCount = parseInt(counts[0], "顶点数");
        int faceCount = counts.length > 1 ? parseInt(counts[1], "面数") : 0;

        double[] vertices = new double[vertexCount * 3];
        for (int v = 0; v < vertexCount; v++) {
            String line = nextContentLine(reader);
            if (line == null) {
                throw new IllegalArgumentException("OFF 顶点不足：期望 " + vertexCount + "，实际 " + v);
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 3) {
                throw new IllegalArgumentException("OFF 顶点行格式错误：" + line);
            }
            for (int axis = 0; axis < 3; axis++) {
                vertices[3 * v + axis] = parseDouble(parts[axis], line);
            }
        }

        List<int[]> offFaces = new ArrayList<>(faceCount);
        for (int f = 0; f < faceCount; f++) {
            String line = nextContentLine(reader);
            if (line == null) {
                throw new IllegalArgumentException("OFF 面不足：期望 " + faceCount + "，实际 " + f);
            }
            String[] parts = line.split("\\s+");
            int size = parseInt(parts[0], "面的顶点数");
            if (parts.length < size + 1) {
                throw new IllegalArgumentException("OFF 面行格式错误：" + line);
            }
            int[] face = new int[size];
            for (int i = 0; i < size; i++) {
                face[i] = parseInt(parts[i + 1], "顶点下标");
                if (face[i] < 0 || face[i] >= vertexCount) {
                    throw new IllegalArgumentException("OFF 面引用了不存在的顶点：" + face[i]);
                }
            }
            offFaces.add(face);
        }
        FaceVertexMap map = faceVertexMap(offFaces);
        return new Mesh(vertices, map.faces(), map.windingOrder());
    }

    public static void write(Mesh mesh, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(mesh, writer);
        }
    }

    public static String format(Mesh mesh) {
        StringWriter out = new StringWriter();
        try {
            write(mesh, out);
        } catch (IOException e) {
            throw new IllegalStateException("生成 OFF 文本失败", e);
        }
        return out.toString();
    }

    /**
     * 写出 OFF。面数为 {@code faces.length}，边数写 0（OFF 只要求占位）。
     */
    public static void write(Mesh mesh, Writer writer) throws IOException {
        writer.write("OFF\n");
        writer.write("# NVertices NFaces NEdges\n");
        writer.write(mesh.vertexCount() + " " + mesh.faceCount() + " 0\n");
        writer.write("# Vertices\n");
        double[] vertices = mesh.vertices();
        StringBuilder line = new StringBuilder();
        for (int v = 0; v < mesh.vertexCount(); v++) {
            line.setLength(0);
            line.append(vertices[3 * v]).append(' ')
                    .append(vertices[3 * v + 1]).append(' ')
                    .append(vertices[3 * v + 2]).append('\n');
            writer.write(line.toString());
        }
        writer.write("# Faces\n");
        for (int f = 0; f < mesh.faceCount(); f++) {
            int[] face = mesh.face(f);
            line.setLength(0);
            line.append(face.length);
            for (int index : face) {
                line.append(' ').append(index);
            }
            writer.write(line.append('\n').toString());
        }
        writer.flush();
    }

    private static String nextContentLine(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return trimmed;
            }
        }
        return null;
    }

    private static int parseInt(String text, String what) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("OFF " + what + "不是整数：" + text, e);
        }
    }

    private static double parseDouble(String text, String line) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("OFF 顶点坐标不是数字：" + line, e);
        }
    }
}
