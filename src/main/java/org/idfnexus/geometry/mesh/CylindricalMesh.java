package org.idfnexus.geometry.mesh;

/**
 * NXcylindrical_geometry 的内存形式：每个圆柱由 (底面中心, 底面边缘点, 顶面中心) 三个顶点下标描述。
 *
 * @param vertices  扁平的 xyz 坐标
 * @param cylinders 扁平的顶点下标三元组
 */
public record CylindricalMesh(double[] vertices, int[] cylinders) implements GeometryShape {

    public CylindricalMesh {
        if (vertices.length % 3 != 0 || cylinders.length % 3 != 0) {
            throw new IllegalArgumentException("vertices 与 cylinders 的长度都必须是 3 的倍数");
        }
    }

    public int cylinderCount() {
        return cylinders.length / 3;
    }
}
