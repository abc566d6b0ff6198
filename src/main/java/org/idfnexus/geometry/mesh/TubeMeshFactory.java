package org.idfnexus.geometry.mesh;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.RealMatrix;
import org.idfnexus.geometry.GeometryMath;

/**
 * 把圆柱描述细分成管状网格：两端各 {@code n} 个点，侧面为四边形，不封端面。
 * <p>
 * 顶点顺序：先底面一圈 {@code [0, n)}，再顶面一圈 {@code [n, 2n)}；第 k 个侧面为
 * {@code [k, n + k, n + k + 1, k + 1]}，最后一个面回绕到 0。
 */
public final class TubeMeshFactory {

    private TubeMeshFactory() {
    }

    /**
     * @param cylinders     圆柱描述
     * @param pointsPerEnd  每个端面圆周上的点数（至少 3）
     */
    public static Mesh tessellate(CylindricalMesh cylinders, int pointsPerEnd) {
        if (pointsPerEnd < 3) {
            throw new IllegalArgumentException("每个端面至少需要 3 个点：" + pointsPerEnd);
        }
        int count = cylinders.cylinderCount();
        int verticesPerTube = 2 * pointsPerEnd;
        double[] vertices = new double[count * verticesPerTube * 3];
        int[] faces = new int[count * pointsPerEnd];
        int[] windingOrder = new int[count * pointsPerEnd * 4];

        double[] source = cylinders.vertices();
        int[] indices = cylinders.cylinders();
        for (int c = 0; c < count; c++) {
            Vector3D bottom = point(source, indices[3 * c]);
            Vector3D edge = point(source, indices[3 * c + 1]);
            Vector3D top = point(source, indices[3 * c + 2]);
            GeometryMath.Normalised axis = GeometryMath.normalise(top.subtract(bottom));
            if (axis.magnitude() == 0.0) {
                throw new IllegalArgumentException("圆柱高度为 0，无法生成管状网格（第 " + c + " 个圆柱）");
            }
            Vector3D radial = edge.subtract(bottom);

            int vertexBase = c * verticesPerTube;
            for (int k = 0; k < pointsPerEnd; k++) {
                RealMatrix rotation = GeometryMath.rotationMatrixFromAxisAngle(axis.unit(), 2.0 * Math.PI * k / pointsPerEnd);
                Vector3D spoke = GeometryMath.rotate(rotation, radial);
                put(vertices, vertexBase + k, bottom.add(spoke));
                put(vertices, vertexBase + pointsPerEnd + k, top.add(spoke));
            }

            int faceBase = c * pointsPerEnd;
            for (int k = 0; k < pointsPerEnd; k++) {
                int next = (k + 1) % pointsPerEnd;
                int w = (faceBase + k) * 4;
                faces[faceBase + k] = w;
                windingOrder[w] = vertexBase + k;
                windingOrder[w + 1] = vertexBase + pointsPerEnd + k;
                windingOrder[w + 2] = vertexBase + pointsPerEnd + next;
                windingOrder[w + 3] = vertexBase + next;
            }
        }
        return new Mesh(vertices, faces, windingOrder);
    }

    private static Vector3D point(double[] vertices, int index) {
        return new Vector3D(vertices[3 * index], vertices[3 * index + 1], vertices[3 * index + 2]);
    }

    private static void put(double[] vertices, int index, Vector3D value) {
        vertices[3 * index] = value.getX();
        vertices[3 * index + 1] = value.getY();
        vertices[3 * index + 2] = value.getZ();
    }
}
