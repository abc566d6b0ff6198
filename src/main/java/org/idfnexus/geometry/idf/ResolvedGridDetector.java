package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.List;

/**
 * StructuredDetector：由角点网格描述的平面四边形像素阵列。
 * <p>
 * 角点按 x 优先排列，共 {@code (xPixels + 1) * (yPixels + 1)} 个；像素按行（y）优先排列。
 *
 * @param name         组件名称
 * @param typeName     StructuredDetector 类型名
 * @param xPixels      x 方向像素数
 * @param yPixels      y 方向像素数
 * @param vertices     角点（NeXus 坐标，相对模块位置）
 * @param pixelCentres 每个像素的中心（四个角点均值）
 * @param idList       像素 id，与 pixelCentres 一一对应
 * @param location     模块位置（NeXus 坐标，已相对原点）
 * @param orientation  模块朝向；没有则为 null
 */
public record ResolvedGridDetector(
        String name,
        String typeName,
        int xPixels,
        int yPixels,
        List<Vector3D> vertices,
        List<Vector3D> pixelCentres,
        List<Integer> idList,
        Vector3D location,
        Orientation orientation
) {

    public ResolvedGridDetector {
        vertices = List.copyOf(vertices);
        pixelCentres = List.copyOf(pixelCentres);
        idList = List.copyOf(idList);
    }

    public int vertexIndex(int column, int row) {
        return column + row * (xPixels + 1);
    }
}
