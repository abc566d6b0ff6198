package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * 中子源。
 *
 * @param name     源名称（类型名）
 * @param location 位置（NeXus 坐标，已相对原点）
 */
public record ResolvedSource(String name, Vector3D location) {
}
