package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * 像素（或监视器）形状：封闭的标签联合，解析时一次性确定，使用方按类型穷举处理。
 */
public sealed interface PixelShape permits PixelShape.Cuboid, PixelShape.Cylinder {

    /**
     * 长方体像素：只保留参数（尺寸 + 厚度），不生成网格。
     *
     * @param xSize     左→右尺寸
     * @param ySize     前→后尺寸
     * @param thickness 下→上尺寸
     */
    record Cuboid(double xSize, double ySize, double thickness) implements PixelShape {
    }

    /**
     * 圆柱/管状像素。
     *
     * @param axis       单位轴向量（NeXus 坐标）
     * @param radius     半径
     * @param height     高度
     * @param baseCentre 底面中心（NeXus 坐标，相对于像素自身位置）
     */
    record Cylinder(Vector3D axis, double radius, double height, Vector3D baseCentre) implements PixelShape {
    }
}
