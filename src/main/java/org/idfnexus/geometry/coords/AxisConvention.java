package org.idfnexus.geometry.coords;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * IDF 坐标轴到 NeXus 规范坐标系（束流 +z，向上 +y，右手系）的映射。
 * <p>
 * 语义：NeXus 的第 i 个分量 = {@code sign_i * raw[axis_i]}。例如 {@code xAxis='y', signX=-1}
 * 表示 NeXus x 取 IDF 的 -y。
 *
 * @param xAxis      NeXus x 对应的 IDF 轴字母
 * @param yAxis      NeXus y 对应的 IDF 轴字母
 * @param zAxis      NeXus z 对应的 IDF 轴字母
 * @param signX      NeXus x 的符号（±1）
 * @param signY      NeXus y 的符号（±1）
 * @param signZ      NeXus z 的符号（±1）
 * @param handedness IDF 声明的手性
 */
public record AxisConvention(
        char xAxis,
        char yAxis,
        char zAxis,
        int signX,
        int signY,
        int signZ,
        Handedness handedness
) {

    /**
     * IDF 默认参考系（along-beam=z、pointing-up=y、右手）对应的恒等映射。
     */
    public static final AxisConvention IDENTITY = new AxisConvention('x', 'y', 'z', 1, 1, 1, Handedness.RIGHT);

    public AxisConvention {
        if (axisIndex(xAxis) + axisIndex(yAxis) + axisIndex(zAxis) != 3
                || xAxis == yAxis || yAxis == zAxis || xAxis == zAxis) {
            throw new IllegalArgumentException("坐标轴必须是 {x,y,z} 的一个排列：" + xAxis + yAxis + zAxis);
        }
        if (Math.abs(signX) != 1 || Math.abs(signY) != 1 || Math.abs(signZ) != 1) {
            throw new IllegalArgumentException("坐标轴符号必须为 ±1");
        }
        if (handedness == null) {
            throw new IllegalArgumentException("handedness 不能为空");
        }
    }

    public boolean isIdentity() {
        return xAxis == 'x' && yAxis == 'y' && zAxis == 'z' && signX == 1 && signY == 1 && signZ == 1;
    }

    Vector3D toNexus(Vector3D raw) {
        double[] r = raw.toArray();
        return new Vector3D(
                signX * r[axisIndex(xAxis)],
                signY * r[axisIndex(yAxis)],
                signZ * r[axisIndex(zAxis)]
        );
    }

    Vector3D fromNexus(Vector3D nexus) {
        double[] out = new double[3];
        out[axisIndex(xAxis)] = signX * nexus.getX();
        out[axisIndex(yAxis)] = signY * nexus.getY();
        out[axisIndex(zAxis)] = signZ * nexus.getZ();
        return new Vector3D(out);
    }

    static int axisIndex(char axis) {
        return switch (axis) {
            case 'x' -> 0;
            case 'y' -> 1;
            case 'z' -> 2;
            default -> throw new IllegalArgumentException("未知的坐标轴：" + axis);
        };
    }
}
