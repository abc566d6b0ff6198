package org.idfnexus.geometry.nexus;

/**
 * 数据集元素类型（名称与 HDF5/numpy 的 dtype 一致，持久化时原样保存）。
 */
public enum NexusDType {
    FLOAT64("float64"),
    INT32("int32"),
    INT64("int64"),
    STRING("string");

    private final String dtypeName;

    NexusDType(String dtypeName) {
        this.dtypeName = dtypeName;
    }

    public String dtypeName() {
        return dtypeName;
    }

    public static NexusDType fromName(String name) {
        for (NexusDType type : values()) {
            if (type.dtypeName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("不支持的 dtype：" + name);
    }
}
