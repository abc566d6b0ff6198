package org.idfnexus.geometry.coords;

/**
 * 球坐标（角度单位固定为度）。
 *
 * @param r            半径
 * @param thetaDegrees 极角（与 +z 的夹角）
 * @param phiDegrees   方位角（自 +x 起算）
 */
public record SphericalCoordinates(double r, double thetaDegrees, double phiDegrees) {
}
