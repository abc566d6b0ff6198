package org.idfnexus.geometry.nexus;

/**
 * 像素形状在 NeXus 中的表示。
 */
public sealed interface ShapeGeometry permits ShapeGeometry.Parametric, ShapeGeometry.Cylinders {

    /**
     * 长方体像素：只写 {@code x_pixel_size}/{@code y_pixel_size}/{@code thickness}，不生成网格。
     */
    record Parametric(double xPixelSize, double yPixelSize, double thickness) implements ShapeGeometry {
    }

    /**
     * {@code NXcylindrical_geometry}：每个圆柱由 3 个顶点（底面中心、底面边缘一点、顶面中心）描述。
     *
     * @param vertices  扁平的 xyz 坐标，长度为 3 * 顶点数
     * @param cylinders 扁平的顶点下标三元组，长度为 3 * 圆柱数
     */
    record Cylinders(double[] vertices, int[] cylinders) implements ShapeGeometry {

        public int vertexCount() {
            return vertices.length / 3;
        }

        public int cylinderCount() {
            return cylinders.length / 3;
        }
    }
}
