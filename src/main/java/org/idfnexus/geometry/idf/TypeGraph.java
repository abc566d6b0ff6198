package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.coords.CoordinateNormalizer;
import org.idfnexus.geometry.error.IdfConversionException;
import org.idfnexus.geometry.error.InconsistentPixelTypeException;
import org.idfnexus.geometry.error.NotFoundInIdfException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * IDF 类型图：按整数下标存放所有 {@code <type>}，并自底向上聚合每个类型包含的像素偏移。
 * <p>
 * 实现要点：
 * <ul>
 *   <li>类型之间只通过下标引用，不持有彼此的对象引用；</li>
 *   <li>聚合用“不动点”迭代：每一轮只处理子类型全部已定的类型，直到没有进展为止（不递归，层级再深也不会爆栈）；</li>
 *   <li>迭代结束仍未定的类型一定处在引用环上（或依赖环上的类型），统一标记为失败；</li>
 *   <li>失败会向上传染给所有包含它的类型，使 SKIP 模式能按顶层组件记录失败原因。</li>
 * </ul>
 */
final class TypeGraph {

    private static final Logger log = LoggerFactory.getLogger(TypeGraph.class);

    /**
     * 类型中的一个子组件声明（{@code <component type="...">}）。
     *
     * @param childIndex 子类型下标；子类型未定义时为 -1
     * @param childName  子类型名
     * @param element    component 元素
     * @param locations  该子组件的所有位置（IDF 坐标）
     * @param offsets    位置换算后的偏移（NeXus 坐标，非顶层，不减原点）
     * @param idListName 子组件上声明的 idlist（可为 null）
     */
    record SubComponent(int childIndex, String childName, Element element, List<LocatedPoint> locations,
                        List<Vector3D> offsets, String idListName) {
    }

    /**
     * 某个类型展开到像素后的聚合结果。
     *
     * @param pixelTypeIndex 像素类型下标
     * @param offsets        所有像素相对该类型原点的偏移
     * @param chain          从该类型到像素类型途经的类型名
     */
    record Aggregate(int pixelTypeIndex, List<Vector3D> offsets, List<String> chain) {
    }

    private enum State {
        PENDING,
        BEARING,
        EMPTY,
        FAILED
    }

    private final List<Element> elements = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final List<String> kinds = new ArrayList<>();
    private final Map<String, Integer> indexByName = new HashMap<>();
    private final List<List<SubComponent>> subComponents = new ArrayList<>();
    private final Set<Integer> referenced = new LinkedHashSet<>();

    private State[] states;
    private Aggregate[] aggregates;
    private IdfConversionException[] failures;

    private TypeGraph() {
    }

    /**
     * 建立类型图并完成聚合。
     * <p>
     * RectangularDetector/StructuredDetector 容器与监视器类型不参与一般聚合（由解析器单独处理）。
     */
    static TypeGraph build(IdfDocument document, CoordinateNormalizer normalizer) {
        TypeGraph graph = new TypeGraph();
        for (Element type : document.types()) {
            String name = IdfDocument.attribute(type, "name");
            if (name == null) {
                throw new IllegalArgumentException("type 缺少 name 属性：" + IdfDocument.describe(type));
            }
            if (graph.indexByName.containsKey(name)) {
                log.warn("重复定义的类型 {}，以首次定义为准", name);
                continue;
            }
            graph.indexByName.put(name, graph.elements.size());
            graph.elements.add(type);
            graph.names.add(name);
            graph.kinds.add(IdfDocument.kindOf(type));
        }
        for (int i = 0; i < graph.elements.size(); i++) {
            graph.subComponents.add(graph.readSubComponents(i, normalizer));
        }
        graph.aggregate();
        return graph;
    }

    private List<SubComponent> readSubComponents(int typeIndex, CoordinateNormalizer normalizer) {
        String kind = kinds.get(typeIndex);
        if (isSpecialContainer(kind)) {
            return List.of();
        }
        List<SubComponent> out = new ArrayList<>();
        for (Element component : IdfDocument.children(elements.get(typeIndex), "component")) {
            String childName = IdfDocument.attribute(component, "type");
            Integer childIndex = childName == null ? null : indexByName.get(childName);
            List<LocatedPoint> locations = LocationReader.read(component, normalizer.angleUnit());
            List<Vector3D> offsets = new ArrayList<>(locations.size());
            for (LocatedPoint location : locations) {
                offsets.add(normalizer.toNexusFrame(location.raw(), false));
                if (!location.ranged() && (location.element().hasAttribute("rot")
                        || IdfDocument.firstChild(location.element(), "facing") != null)) {
                    log.debug("忽略嵌套组件上的旋转/朝向：类型 {} 中的 {}", names.get(typeIndex), childName);
                }
            }
            if (childIndex != null) {
                referenced.add(childIndex);
            }
            out.add(new SubComponent(childIndex == null ? -1 : childIndex, childName, component, locations, offsets,
                    IdfDocument.attribute(component, "idlist")));
        }
        return out;
    }

    private void aggregate() {
        int count = elements.size();
        states = new State[count];
        aggregates = new Aggregate[count];
        failures = new IdfConversionException[count];
        Arrays.fill(states, State.PENDING);

        for (int i = 0; i < count; i++) {
            if ("detector".equals(kinds.get(i))) {
                states[i] = State.BEARING;
                aggregates[i] = new Aggregate(i, List.of(Vector3D.ZERO), List.of(names.get(i)));
            } else if (isSpecialContainer(kinds.get(i)) || "monitor".equals(kinds.get(i))) {
                states[i] = State.EMPTY;
            }
        }

        boolean progress = true;
        while (progress) {
            progress = false;
            for (int i = 0; i < count; i++) {
                if (states[i] == State.PENDING && tryResolve(i)) {
                    progress = true;
                }
            }
        }

        for (int i = 0; i < count; i++) {
            if (states[i] == State.PENDING) {
                states[i] = State.FAILED;
                failures[i] = new IdfConversionException("类型之间存在循环引用", names.get(i));
            }
        }
    }

    /**
     * @return 是否已确定该类型的状态（子类型仍有未定的则返回 false）
     */
    private boolean tryResolve(int typeIndex) {
        List<SubComponent> subs = subComponents.get(typeIndex);
        for (SubComponent sub : subs) {
            if (sub.childIndex() < 0) {
                states[typeIndex] = State.FAILED;
                failures[typeIndex] = new NotFoundInIdfException("引用了未定义的类型：" + sub.childName(), names.get(typeIndex));
                return true;
            }
            if (states[sub.childIndex()] == State.PENDING) {
                return false;
            }
        }
        for (SubComponent sub : subs) {
            if (states[sub.childIndex()] == State.FAILED) {
                states[typeIndex] = State.FAILED;
                failures[typeIndex] = failures[sub.childIndex()];
                return true;
            }
        }

        Set<Integer> pixelTypes = new LinkedHashSet<>();
        List<Vector3D> offsets = new ArrayList<>();
        List<String> chain = null;
        for (SubComponent sub : subs) {
            if (states[sub.childIndex()] != State.BEARING) {
                continue;
            }
            Aggregate child = aggregates[sub.childIndex()];
            pixelTypes.add(child.pixelTypeIndex());
            for (Vector3D parentOffset : sub.offsets()) {
                for (Vector3D childOffset : child.offsets()) {
                    offsets.add(parentOffset.add(childOffset));
                }
            }
            if (chain == null) {
                chain = new ArrayList<>();
                chain.add(names.get(typeIndex));
                chain.addAll(child.chain());
            }
        }

        if (pixelTypes.isEmpty()) {
            states[typeIndex] = State.EMPTY;
            return true;
        }
        if (pixelTypes.size() > 1) {
            List<String> pixelNames = new ArrayList<>();
            for (int pixel : pixelTypes) {
                pixelNames.add(names.get(pixel));
            }
            states[typeIndex] = State.FAILED;
            failures[typeIndex] = new InconsistentPixelTypeException("同一模块的子组件使用了不同的像素类型：" + pixelNames,
                    names.get(typeIndex));
            return true;
        }
        states[typeIndex] = State.BEARING;
        aggregates[typeIndex] = new Aggregate(pixelTypes.iterator().next(), List.copyOf(offsets), List.copyOf(chain));
        return true;
    }

    static boolean isSpecialContainer(String kind) {
        return "rectangulardetector".equals(kind) || "structureddetector".equals(kind);
    }

    int typeCount() {
        return elements.size();
    }

    Integer indexOf(String name) {
        return name == null ? null : indexByName.get(name);
    }

    String name(int typeIndex) {
        return names.get(typeIndex);
    }

    String kind(int typeIndex) {
        return kinds.get(typeIndex);
    }

    Element element(int typeIndex) {
        return elements.get(typeIndex);
    }

    List<SubComponent> subComponents(int typeIndex) {
        return subComponents.get(typeIndex);
    }

    boolean isBearing(int typeIndex) {
        return states[typeIndex] == State.BEARING;
    }

    boolean isFailed(int typeIndex) {
        return states[typeIndex] == State.FAILED;
    }

    /**
     * @return 聚合结果；类型不含像素时返回 null
     * @throws IdfConversionException 类型（或其子类型）聚合失败
     */
    Aggregate aggregate(int typeIndex) {
        if (states[typeIndex] == State.FAILED) {
            throw failures[typeIndex];
        }
        return aggregates[typeIndex];
    }

    /**
     * 顶层类型：含像素（或聚合失败）的类型，减去被其他类型引用过的类型。
     */
    Set<String> topLevelTypeNames() {
        Set<String> out = new LinkedHashSet<>();
        for (int i = 0; i < elements.size(); i++) {
            if ((states[i] == State.BEARING || states[i] == State.FAILED) && !referenced.contains(i)) {
                out.add(names.get(i));
            }
        }
        return out;
    }
}
