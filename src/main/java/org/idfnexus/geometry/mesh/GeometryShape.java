package org.idfnexus.geometry.mesh;

/**
 * 几何组中的形状：OFF 多边形网格或圆柱描述。
 */
public sealed interface GeometryShape permits Mesh, CylindricalMesh {
}
