package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * 解析完成的监视器（不做像素复制）。
 *
 * @param name     名称（来自 location 的 name，缺省为类型名）
 * @param typeName 监视器类型名
 * @param id       探测器 id
 * @param location 位置（NeXus 坐标，已相对原点）
 * @param shape    形状；类型上没有几何图元时为 null
 */
public record ResolvedMonitor(String name, String typeName, int id, Vector3D location, PixelShape shape) {
}
