package org.idfnexus.geometry.nexus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * NeXus 树中的节点（组或数据集）。
 * <p>
 * {@link #path()} 是节点第一次挂到树上时的位置（规范路径）。同一个节点被链接到其他组下时，
 * 规范路径不变，因此 {@code depends_on} 等引用始终指向规范路径。
 */
public abstract sealed class NexusNode permits NexusGroup, NexusDataset {

    private final String name;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private String path;

    protected NexusNode(String name) {
        if (name == null || name.isBlank() || name.contains("/")) {
            throw new IllegalArgumentException("非法的节点名称：" + name);
        }
        this.name = name;
    }

    /**
     * 根节点专用：名称为空，路径为空字符串。
     */
    NexusNode() {
        this.name = "";
        this.path = "";
    }

    public String name() {
        return name;
    }

    public String path() {
        return path;
    }

    void attachTo(String parentPath) {
        if (path == null) {
            path = parentPath + "/" + name;
        }
    }

    /**
     * 属性值只使用 String、Long、Double、double[] 四种类型。
     */
    public NexusNode setAttribute(String key, Object value) {
        if (!(value instanceof String || value instanceof Long || value instanceof Double || value instanceof double[])) {
            throw new IllegalArgumentException("不支持的属性值类型：" + key + "=" + value);
        }
        attributes.put(key, value);
        return this;
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public String stringAttribute(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }

    public double[] vectorAttribute(String key) {
        Object value = attributes.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof double[] vector)) {
            throw new IllegalStateException("属性 " + key + " 不是向量：" + path);
        }
        return vector;
    }
}
