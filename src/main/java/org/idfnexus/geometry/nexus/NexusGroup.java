package org.idfnexus.geometry.nexus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NeXus 组（HDF5 group），{@code NX_class} 作为属性保存。
 */
public final class NexusGroup extends NexusNode {

    public static final String NX_CLASS = "NX_class";

    private final Map<String, NexusNode> children = new LinkedHashMap<>();

    NexusGroup() {
        super();
    }

    NexusGroup(String name, String nxClass) {
        super(name);
        if (nxClass != null) {
            setAttribute(NX_CLASS, nxClass);
        }
    }

    public String nxClass() {
        return stringAttribute(NX_CLASS);
    }

    /**
     * 新建子组；名称中的空格替换为下划线。
     */
    public NexusGroup addGroup(String name, String nxClass) {
        NexusGroup group = new NexusGroup(name.replace(' ', '_'), nxClass);
        attach(group.name(), group);
        return group;
    }

    public NexusDataset addDataset(NexusDataset dataset) {
        attach(dataset.name(), dataset);
        return dataset;
    }

    /**
     * 把已存在的节点以 {@code name} 挂到本组下（硬链接语义：共享同一对象，不复制数据）。
     */
    public void link(String name, NexusNode target) {
        if (target.path() == null) {
            throw new IllegalArgumentException("只能链接已挂到树上的节点：" + target.name());
        }
        attach(name, target);
    }

    private void attach(String name, NexusNode node) {
        if (children.containsKey(name)) {
            throw new IllegalArgumentException("组 " + path() + " 下已存在同名节点：" + name);
        }
        node.attachTo(path());
        children.put(name, node);
    }

    public boolean contains(String name) {
        return children.containsKey(name);
    }

    public NexusNode child(String name) {
        return children.get(name);
    }

    public NexusGroup group(String name) {
        NexusNode node = children.get(name);
        return node instanceof NexusGroup group ? group : null;
    }

    public NexusDataset dataset(String name) {
        NexusNode node = children.get(name);
        return node instanceof NexusDataset dataset ? dataset : null;
    }

    /**
     * 子节点（名称 → 节点），按插入顺序。
     */
    public Map<String, NexusNode> children() {
        return Collections.unmodifiableMap(children);
    }

    public List<NexusGroup> groupsOfClass(String nxClass) {
        List<NexusGroup> out = new ArrayList<>();
        for (NexusNode node : children.values()) {
            if (node instanceof NexusGroup group && nxClass.equals(group.nxClass())) {
                out.add(group);
            }
        }
        return out;
    }

    /**
     * 子节点 {@code name} 是链接（规范路径不在本组下）。
     */
    public boolean isLink(String name) {
        NexusNode node = children.get(name);
        return node != null && !(path() + "/" + name).equals(node.path());
    }
}
