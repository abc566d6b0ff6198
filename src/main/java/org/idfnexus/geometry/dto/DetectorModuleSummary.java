package org.idfnexus.geometry.dto;

/**
 * 单个探测器模块的摘要。
 *
 * @param name          组件名
 * @param kind          {@code module}（一般模块/RectangularDetector）或 {@code grid}（StructuredDetector）
 * @param pixelTypeName 像素类型名；网格探测器为网格类型名
 * @param pixelCount    像素数
 * @param firstId       第一个像素的探测器编号（没有像素时为 null）
 * @param lastId        最后一个像素的探测器编号（没有像素时为 null）
 * @param location      模块位置（NeXus 坐标，已减原点）
 */
public record DetectorModuleSummary(
        String name,
        String kind,
        String pixelTypeName,
        int pixelCount,
        Integer firstId,
        Integer lastId,
        double[] location
) {
}
