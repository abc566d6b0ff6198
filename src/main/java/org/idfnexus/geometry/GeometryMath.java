package org.idfnexus.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.idfnexus.geometry.error.DegenerateRotationException;

/**
 * 几何计算工具：单位化、向量间旋转（轴-角）、Rodrigues 旋转矩阵、构造正交单位向量。
 * <p>
 * 说明：
 * <ul>
 *   <li>向量统一使用 commons-math3 的 {@link Vector3D}（不可变），矩阵使用 {@link RealMatrix}。</li>
 *   <li>本类所有方法均为纯函数，无状态。</li>
 * </ul>
 */
public final class GeometryMath {

    /**
     * 判断“平行/反向平行”时使用的相对容差。
     */
    private static final double PARALLEL_TOLERANCE = 1e-12;

    private GeometryMath() {
    }

    /**
     * 轴-角表示的旋转。
     *
     * @param axis         单位旋转轴
     * @param angleRadians 旋转角（弧度）
     */
    public record AxisAngle(Vector3D axis, double angleRadians) {

        /**
         * “无需旋转”哨兵值（两向量同向时返回）。
         */
        public static final AxisAngle NO_ROTATION = new AxisAngle(Vector3D.PLUS_K, 0.0);

        public boolean isNoRotation() {
            return angleRadians == 0.0;
        }

        public double angleDegrees() {
            return Math.toDegrees(angleRadians);
        }
    }

    /**
     * 单位向量 + 原始模长。
     *
     * @param unit      单位向量（零向量时为 {@link Vector3D#ZERO}）
     * @param magnitude 模长
     */
    public record Normalised(Vector3D unit, double magnitude) {
    }

    public static Normalised normalise(Vector3D vector) {
        double magnitude = vector.getNorm();
        if (magnitude == 0.0) {
            return new Normalised(Vector3D.ZERO, 0.0);
        }
        return new Normalised(vector.scalarMultiply(1.0 / magnitude), magnitude);
    }

    /**
     * 求把 {@code vectorA} 转到 {@code vectorB} 的轴与角。
     * <p>
     * 轴为 {@code normalize(a × b)}，角为 {@code -acos(a·b / (|a||b|))}（负号与整条变换链的约定一致，不能省略）。
     *
     * @return 同向时返回 {@link AxisAngle#NO_ROTATION}
     * @throws DegenerateRotationException 两向量反向平行（旋转轴不唯一）
     */
    public static AxisAngle axisAngleBetween(Vector3D vectorA, Vector3D vectorB) {
        double normProduct = vectorA.getNorm() * vectorB.getNorm();
        if (normProduct == 0.0) {
            throw new IllegalArgumentException("零向量之间不存在旋转：" + vectorA + " -> " + vectorB);
        }
        Vector3D cross = vectorA.crossProduct(vectorB);
        double cosine = vectorA.dotProduct(vectorB) / normProduct;
        if (cross.getNorm() <= PARALLEL_TOLERANCE * normProduct) {
            if (cosine > 0) {
                return AxisAngle.NO_ROTATION;
            }
            throw new DegenerateRotationException("两个向量方向相反，无法确定唯一的旋转轴：" + vectorA + " -> " + vectorB);
        }
        // 数值误差可能让 cosine 略微超出 [-1, 1]
        double clamped = Math.max(-1.0, Math.min(1.0, cosine));
        return new AxisAngle(cross.normalize(), -Math.acos(clamped));
    }

    /**
     * Rodrigues 公式：绕单位轴 {@code axis} 旋转 {@code theta}（弧度）的 3x3 矩阵。
     * <p>
     * 注意：{@code axis} 必须已经是单位向量，由调用方保证。
     */
    public static RealMatrix rotationMatrixFromAxisAngle(Vector3D axis, double theta) {
        double x = axis.getX();
        double y = axis.getY();
        double z = axis.getZ();
        double c = Math.cos(theta);
        double s = Math.sin(theta);
        double t = 1.0 - c;
        return MatrixUtils.createRealMatrix(new double[][]{
                {c + x * x * t, x * y * t - z * s, x * z * t + y * s},
                {y * x * t + z * s, c + y * y * t, y * z * t - x * s},
                {z * x * t - y * s, z * y * t + x * s, c + z * z * t}
        });
    }

    /**
     * 构造一个与 {@code v} 垂直的单位向量（确定但不唯一）。
     * <p>
     * 仅用于给圆柱截面生成一个垂直基向量，因此任何合法的正交向量都可以。
     */
    public static Vector3D orthogonalUnitVector(Vector3D v) {
        Vector3D first = new Vector3D(v.getY(), -v.getX(), 0.0);
        Vector3D second = new Vector3D(0.0, -v.getZ(), v.getY());
        Vector3D candidate = Math.abs(v.getZ()) < Math.abs(v.getX()) ? second : first;
        if (candidate.getNorm() == 0.0) {
            // v 恰好沿坐标轴时首选公式可能退化为零向量，换用另一个公式
            candidate = (candidate == first) ? second : first;
        }
        if (candidate.getNorm() == 0.0) {
            throw new IllegalArgumentException("零向量不存在正交方向");
        }
        return candidate.normalize();
    }

    public static Vector3D rotate(RealMatrix rotation, Vector3D v) {
        double[] out = rotation.operate(v.toArray());
        return new Vector3D(out[0], out[1], out[2]);
    }
}
