package org.idfnexus.geometry.nexus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * NeXus 树与 JSON 文件之间的读写（层级数据存储的持久化形式）。
 * <p>
 * 格式约定：
 * <ul>
 *   <li>组：{@code {"kind":"group","name":...,"attributes":{...},"children":[...]}}；</li>
 *   <li>数据集：{@code {"kind":"dataset","name":...,"dtype":"float64","shape":[n,3],"data":[...]}}，字符串数据集用 {@code "value"}；</li>
 *   <li>链接：{@code {"kind":"link","name":...,"target":"/entry/..."}}，读回时指向同一个节点对象。</li>
 * </ul>
 * dtype 名称原样保存，数值数组按行优先展开。
 */
public final class NexusJsonStore {

    private final ObjectMapper objectMapper;

    public NexusJsonStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(NexusTree tree, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, toJsonNode(tree.root()));
        }
    }

    public NexusTree read(Path file) throws IOException {
        JsonNode rootNode;
        try (InputStream in = Files.newInputStream(file)) {
            rootNode = objectMapper.readTree(in);
        }
        return fromJsonNode(rootNode);
    }

    public String toJson(NexusTree tree) {
        try {
            return objectMapper.writeValueAsString(toJsonNode(tree.root()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("NeXus 树序列化失败", e);
        }
    }

    public NexusTree fromJson(String json) {
        try {
            return fromJsonNode(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("不是合法的 NeXus JSON：" + e.getOriginalMessage(), e);
        }
    }

    // ---- 写 ----

    private ObjectNode toJsonNode(NexusGroup group) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", "group");
        node.put("name", group.name());
        node.set("attributes", attributesNode(group.attributes()));
        ArrayNode children = node.putArray("children");
        for (Map.Entry<String, NexusNode> entry : group.children().entrySet()) {
            String name = entry.getKey();
            NexusNode child = entry.getValue();
            if (group.isLink(name)) {
                ObjectNode link = children.addObject();
                link.put("kind", "link");
                link.put("name", name);
                link.put("target", child.path());
            } else if (child instanceof NexusGroup childGroup) {
                children.add(toJsonNode(childGroup));
            } else {
                children.add(toJsonNode((NexusDataset) child));
            }
        }
        return node;
    }

    private ObjectNode toJsonNode(NexusDataset dataset) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", "dataset");
        node.put("name", dataset.name());
        node.put("dtype", dataset.dtype().dtypeName());
        ArrayNode shape = node.putArray("shape");
        for (int dimension : dataset.shape()) {
            shape.add(dimension);
        }
        switch (dataset.dtype()) {
            case FLOAT64 -> {
                ArrayNode data = node.putArray("data");
                for (double value : dataset.doubles()) {
                    data.add(value);
                }
            }
            case INT32 -> {
                ArrayNode data = node.putArray("data");
                for (int value : dataset.ints()) {
                    data.add(value);
                }
            }
            case INT64 -> {
                ArrayNode data = node.putArray("data");
                for (long value : dataset.longs()) {
                    data.add(value);
                }
            }
            case STRING -> node.put("value", dataset.text());
        }
        node.set("attributes", attributesNode(dataset.attributes()));
        return node;
    }

    private ObjectNode attributesNode(Map<String, Object> attributes) {
        ObjectNode node = objectMapper.createObjectNode();
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String text) {
                node.put(entry.getKey(), text);
            } else if (value instanceof Long number) {
                node.put(entry.getKey(), number);
            } else if (value instanceof Double number) {
                node.put(entry.getKey(), number);
            } else if (value instanceof double[] vector) {
                ArrayNode array = node.putArray(entry.getKey());
                for (double component : vector) {
                    array.add(component);
                }
            }
        }
        return node;
    }

    // ---- 读 ----

    private NexusTree fromJsonNode(JsonNode rootNode) {
        if (rootNode == null || !rootNode.isObject() || !"group".equals(text(rootNode, "kind"))) {
            throw new IllegalArgumentException("NeXus JSON 的根必须是 group 对象");
        }
        NexusTree tree = new NexusTree();
        readAttributes(rootNode, tree.root());
        List<PendingLink> pending = new ArrayList<>();
        readChildren(rootNode, tree.root(), tree, pending);
        // 目标在后面才出现的链接最后再补上
        for (PendingLink link : pending) {
            NexusNode target = tree.node(link.target());
            if (target == null) {
                throw new IllegalArgumentException("链接目标不存在：" + link.target());
            }
            link.parent().link(link.name(), target);
        }
        return tree;
    }

    private void readChildren(JsonNode groupNode, NexusGroup group, NexusTree tree, List<PendingLink> pending) {
        JsonNode children = groupNode.get("children");
        if (children == null || children.isNull()) {
            return;
        }
        for (JsonNode child : children) {
            String kind = text(child, "kind");
            String name = text(child, "name");
            switch (kind) {
                case "group" -> {
                    NexusGroup created = group.addGroup(name, null);
                    readAttributes(child, created);
                    readChildren(child, created, tree, pending);
                }
                case "dataset" -> {
                    NexusDataset dataset = group.addDataset(readDataset(child, name));
                    readAttributes(child, dataset);
                }
                case "link" -> {
                    String target = text(child, "target");
                    NexusNode resolved = tree.node(target);
                    if (resolved != null) {
                        group.link(name, resolved);
                    } else {
                        pending.add(new PendingLink(group, name, target));
                    }
                }
                default -> throw new IllegalArgumentException("未知的节点类型：" + kind);
            }
        }
    }

    private static NexusDataset readDataset(JsonNode node, String name) {
        NexusDType dtype = NexusDType.fromName(text(node, "dtype"));
        JsonNode shapeNode = node.get("shape");
        int[] shape = new int[shapeNode == null ? 0 : shapeNode.size()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = shapeNode.get(i).asInt();
        }
        if (dtype == NexusDType.STRING) {
            return NexusDataset.text(name, text(node, "value"));
        }
        JsonNode data = node.get("data");
        if (data == null || !data.isArray()) {
            throw new IllegalArgumentException("数据集缺少 data 数组：" + name);
        }
        return switch (dtype) {
            case FLOAT64 -> {
                double[] values = new double[data.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = data.get(i).asDouble();
                }
                yield NexusDataset.ofDoubles(name, values, shape);
            }
            case INT32 -> {
                int[] values = new int[data.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = data.get(i).asInt();
                }
                yield NexusDataset.ofInts(name, values, shape);
            }
            default -> {
                long[] values = new long[data.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = data.get(i).asLong();
                }
                yield NexusDataset.ofLongs(name, values, shape);
            }
        };
    }

    private static void readAttributes(JsonNode node, NexusNode target) {
        JsonNode attributes = node.get("attributes");
        if (attributes == null || !attributes.isObject()) {
            return;
        }
        attributes.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isTextual()) {
                target.setAttribute(entry.getKey(), value.asText());
            } else if (value.isIntegralNumber()) {
                target.setAttribute(entry.getKey(), value.asLong());
            } else if (value.isNumber()) {
                target.setAttribute(entry.getKey(), value.asDouble());
            } else if (value.isArray()) {
                double[] vector = new double[value.size()];
                for (int i = 0; i < vector.length; i++) {
                    vector[i] = value.get(i).asDouble();
                }
                target.setAttribute(entry.getKey(), vector);
            } else {
                throw new IllegalArgumentException("不支持的属性值：" + entry.getKey());
            }
        });
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("NeXus JSON 格式错误：缺少字段 " + field);
        }
        return value.asText();
    }

    private record PendingLink(NexusGroup parent, String name, String target) {
    }
}
