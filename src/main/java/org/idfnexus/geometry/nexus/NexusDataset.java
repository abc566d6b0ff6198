package org.idfnexus.geometry.nexus;

import java.util.Arrays;

/**
 * NeXus 数据集：带 dtype 与 shape 的扁平数组（行优先），或标量、字符串。
 * <p>
 * 数据在创建时复制一份，之后只读；访问器直接返回内部数组，调用方不得修改。
 */
public final class NexusDataset extends NexusNode {

    private final NexusDType dtype;
    private final int[] shape;
    private final Object data;

    private NexusDataset(String name, NexusDType dtype, int[] shape, Object data) {
        super(name);
        this.dtype = dtype;
        this.shape = shape.clone();
        this.data = data;
        long expected = 1;
        for (int dimension : shape) {
            expected *= dimension;
        }
        int actual = switch (dtype) {
            case FLOAT64 -> ((double[]) data).length;
            case INT32 -> ((int[]) data).length;
            case INT64 -> ((long[]) data).length;
            case STRING -> 1;
        };
        if (expected != actual) {
            throw new IllegalArgumentException("数据集 " + name + " 的 shape " + Arrays.toString(shape)
                    + " 与数据长度 " + actual + " 不一致");
        }
    }

    public static NexusDataset ofDoubles(String name, double[] values, int... shape) {
        return new NexusDataset(name, NexusDType.FLOAT64, shape, values.clone());
    }

    public static NexusDataset ofInts(String name, int[] values, int... shape) {
        return new NexusDataset(name, NexusDType.INT32, shape, values.clone());
    }

    public static NexusDataset ofLongs(String name, long[] values, int... shape) {
        return new NexusDataset(name, NexusDType.INT64, shape, values.clone());
    }

    public static NexusDataset scalar(String name, double value) {
        return new NexusDataset(name, NexusDType.FLOAT64, new int[0], new double[]{value});
    }

    public static NexusDataset scalar(String name, int value) {
        return new NexusDataset(name, NexusDType.INT32, new int[0], new int[]{value});
    }

    public static NexusDataset text(String name, String value) {
        return new NexusDataset(name, NexusDType.STRING, new int[0], value == null ? "" : value);
    }

    /**
     * 一维 float64 数据集。
     */
    public static NexusDataset vector(String name, double[] values) {
        return ofDoubles(name, values, values.length);
    }

    /**
     * 一维 int32 数据集。
     */
    public static NexusDataset indices(String name, int[] values) {
        return ofInts(name, values, values.length);
    }

    public NexusDType dtype() {
        return dtype;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int size() {
        return switch (dtype) {
            case FLOAT64 -> ((double[]) data).length;
            case INT32 -> ((int[]) data).length;
            case INT64 -> ((long[]) data).length;
            case STRING -> 1;
        };
    }

    /**
     * 数值数据（整数类型转换为 double）。
     */
    public double[] doubles() {
        return switch (dtype) {
            case FLOAT64 -> (double[]) data;
            case INT32 -> Arrays.stream((int[]) data).asDoubleStream().toArray();
            case INT64 -> Arrays.stream((long[]) data).asDoubleStream().toArray();
            case STRING -> throw new IllegalStateException("字符串数据集没有数值：" + path());
        };
    }

    public int[] ints() {
        return switch (dtype) {
            case INT32 -> (int[]) data;
            case INT64 -> Arrays.stream((long[]) data).mapToInt(Math::toIntExact).toArray();
            default -> throw new IllegalStateException("数据集不是整数类型：" + path() + "（" + dtype.dtypeName() + "）");
        };
    }

    public long[] longs() {
        return switch (dtype) {
            case INT64 -> (long[]) data;
            case INT32 -> Arrays.stream((int[]) data).asLongStream().toArray();
            default -> throw new IllegalStateException("数据集不是整数类型：" + path() + "（" + dtype.dtypeName() + "）");
        };
    }

    public String text() {
        if (dtype != NexusDType.STRING) {
            throw new IllegalStateException("数据集不是字符串：" + path());
        }
        return (String) data;
    }

    public double scalarDouble() {
        double[] values = doubles();
        if (values.length != 1) {
            throw new IllegalStateException("数据集不是标量：" + path());
        }
        return values[0];
    }
}
