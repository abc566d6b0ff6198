package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.w3c.dom.Element;

/**
 * 从 {@code <location>}/{@code <locations>} 读出的一个位置（IDF 原始坐标，未做轴变换）。
 *
 * @param raw     IDF 坐标系中的笛卡尔坐标
 * @param name    位置名；没有则为 null
 * @param element 来源元素（{@code <locations>} 展开的多个位置共享同一元素）
 * @param ranged  是否由 {@code <locations>} 展开得到
 */
record LocatedPoint(Vector3D raw, String name, Element element, boolean ranged) {
}
