package org.idfnexus.geometry.mesh;

/**
 * 从 NeXus 树中找到的一个几何组。
 *
 * @param shape               形状
 * @param owningComponentPath 所属组件（几何组的父组）在本次遍历中的路径
 * @param singlePixelShape    是否为单像素形状（组名为 {@code pixel_shape}），需要先按像素偏移复制
 */
public record GeometryGroup(GeometryShape shape, String owningComponentPath, boolean singlePixelShape) {
}
