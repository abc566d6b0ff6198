package org.idfnexus.geometry.mesh;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * 多边形网格（NXoff_geometry 的内存形式）。
 * <p>
 * {@code faces[i]} 是第 i 个面在 {@code windingOrder} 中的起始下标，该面的顶点下标一直延续到下一个面的起点
 * （最后一个面到 {@code windingOrder} 末尾）。
 *
 * @param vertices     扁平的 xyz 坐标，长度为 3 * 顶点数
 * @param faces        每个面在 windingOrder 中的起始下标
 * @param windingOrder 所有面的顶点下标依次拼接
 */
public record Mesh(double[] vertices, int[] faces, int[] windingOrder) implements GeometryShape {

    public Mesh {
        if (vertices.length % 3 != 0) {
            throw new IllegalArgumentException("顶点数组长度必须是 3 的倍数：" + vertices.length);
        }
    }

    public static Mesh empty() {
        return new Mesh(new double[0], new int[0], new int[0]);
    }

    public int vertexCount() {
        return vertices.length / 3;
    }

    public int faceCount() {
        return faces.length;
    }

    public Vector3D vertex(int index) {
        return new Vector3D(vertices[3 * index], vertices[3 * index + 1], vertices[3 * index + 2]);
    }

    /**
     * 第 {@code faceIndex} 个面的顶点下标。
     */
    public int[] face(int faceIndex) {
        int start = faces[faceIndex];
        int end = faceIndex + 1 < faces.length ? faces[faceIndex + 1] : windingOrder.length;
        int[] out = new int[end - start];
        System.arraycopy(windingOrder, start, out, 0, out.length);
        return out;
    }
}
