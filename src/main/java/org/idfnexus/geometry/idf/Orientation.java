package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * 组件朝向：绕单位轴旋转的角度（度）。
 *
 * @param axis         单位旋转轴（NeXus 坐标）
 * @param angleDegrees 旋转角（度）
 */
public record Orientation(Vector3D axis, double angleDegrees) {
}
