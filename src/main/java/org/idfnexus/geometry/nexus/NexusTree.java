package org.idfnexus.geometry.nexus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * 内存中的 NeXus 层级数据存储（组 / 数据集 / 属性 / 链接）。
 * <p>
 * 路径使用 HDF5 风格的绝对路径，例如 {@code /entry/instrument/detector_1/depends_on}。
 */
public final class NexusTree {

    private final NexusGroup root = new NexusGroup();

    public NexusGroup root() {
        return root;
    }

    /**
     * 按绝对路径查找节点；找不到返回 null。
     */
    public NexusNode node(String path) {
        if (path == null || !path.startsWith("/")) {
            return null;
        }
        NexusNode current = root;
        for (String part : path.substring(1).split("/")) {
            if (part.isEmpty()) {
                continue;
            }
            if (!(current instanceof NexusGroup group)) {
                return null;
            }
            current = group.child(part);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public NexusDataset dataset(String path) {
        NexusNode node = node(path);
        return node instanceof NexusDataset dataset ? dataset : null;
    }

    public NexusGroup group(String path) {
        NexusNode node = node(path);
        return node instanceof NexusGroup group ? group : null;
    }

    /**
     * 按“所在位置”深度优先遍历所有组（经由链接到达的组也会以链接位置再访问一次）。
     */
    public void visitGroups(GroupVisitor visitor) {
        Deque<Visit> stack = new ArrayDeque<>();
        stack.push(new Visit(root, "", null));
        while (!stack.isEmpty()) {
            Visit visit = stack.pop();
            visitor.visit(visit.group(), visit.location(), visit.parent());
            List<Map.Entry<String, NexusNode>> entries = new ArrayList<>(visit.group().children().entrySet());
            // 逆序入栈，保证按插入顺序访问
            for (int i = entries.size() - 1; i >= 0; i--) {
                Map.Entry<String, NexusNode> entry = entries.get(i);
                if (entry.getValue() instanceof NexusGroup child) {
                    stack.push(new Visit(child, visit.location() + "/" + entry.getKey(), visit.group()));
                }
            }
        }
    }

    @FunctionalInterface
    public interface GroupVisitor {

        /**
         * @param group    组
         * @param location 本次访问经过的路径（链接时不同于规范路径）
         * @param parent   本次访问时的父组；根为 null
         */
        void visit(NexusGroup group, String location, NexusGroup parent);
    }

    private record Visit(NexusGroup group, String location, NexusGroup parent) {
    }
}
