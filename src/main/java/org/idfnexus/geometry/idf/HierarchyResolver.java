package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.coords.CoordinateNormalizer;
import org.idfnexus.geometry.error.IdfConversionException;
import org.idfnexus.geometry.error.MalformedIdListException;
import org.idfnexus.geometry.error.NotFoundInIdfException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 把 IDF 的“类型-组件”层级展开成扁平的探测器模块、监视器、样品与中子源。
 * <p>
 * 流程：
 * <ol>
 *   <li>读取参考系与单位，得到 {@link CoordinateNormalizer}；样品位置作为原点（可配置）；</li>
 *   <li>建立 {@link TypeGraph}，自底向上聚合每个类型的像素偏移（笛卡尔组合：父偏移 × 子偏移）；</li>
 *   <li>顶层类型 = 含像素的类型 − 被引用过的类型；instrument 下这些类型的组件即探测器模块；</li>
 *   <li>模块本身没有位置且只有一个子组件时，继承子组件的位置与 idlist（包装层合并）。</li>
 * </ol>
 * <p>
 * 本类无状态：每次调用只依赖入参，可在多线程间共享同一实例。
 */
public final class HierarchyResolver {

    private static final Logger log = LoggerFactory.getLogger(HierarchyResolver.class);

    private final FailureMode failureMode;
    private final boolean originAtSample;

    public HierarchyResolver() {
        this(FailureMode.ABORT, true);
    }

    /**
     * @param failureMode    顶层组件解析失败时的处理方式
     * @param originAtSample 是否以样品位置作为 NeXus 原点
     */
    public HierarchyResolver(FailureMode failureMode, boolean originAtSample) {
        this.failureMode = failureMode == null ? FailureMode.ABORT : failureMode;
        this.originAtSample = originAtSample;
    }

    public FailureMode failureMode() {
        return failureMode;
    }

    /**
     * 解析整台仪器。样品缺失时以零点为原点；中子源缺失时 source 为 null。
     */
    public ResolvedInstrument resolveInstrument(IdfDocument document) {
        CoordinateNormalizer frame = FrameReader.read(document);
        Vector3D samplePosition = Vector3D.ZERO;
        if (document.typesWithKind("samplepos").isEmpty()) {
            log.warn("IDF 中没有样品位置（is=\"SamplePos\"），以坐标原点作为样品位置");
        } else {
            samplePosition = resolveSamplePosition(document, frame);
        }
        CoordinateNormalizer normalizer = originAtSample ? frame.withOrigin(samplePosition) : frame;

        ResolvedSource source = null;
        if (document.typesWithKind("source").isEmpty()) {
            log.warn("IDF 中没有中子源（is=\"Source\"）");
        } else {
            source = resolveSource(document, normalizer);
        }

        List<ResolutionFailure> failures = new ArrayList<>();
        List<ResolvedMonitor> monitors = resolveMonitors(document, normalizer, failures);
        List<ResolvedDetector> detectors = new ArrayList<>();
        if (document.typesWithKind("detector").isEmpty()) {
            log.warn("IDF 中没有 is=\"detector\" 的像素类型");
        } else {
            detectors.addAll(resolveModules(document, normalizer, TypeGraph.build(document, normalizer), failures));
            detectors.addAll(resolveRectangularDetectors(document, normalizer, failures));
        }
        List<ResolvedGridDetector> grids = resolveStructuredDetectors(document, normalizer, failures);

        String name = document.instrumentName();
        log.info("仪器 {} 解析完成：探测器模块 {} 个，网格探测器 {} 个，监视器 {} 个，跳过 {} 个组件",
                name, detectors.size(), grids.size(), monitors.size(), failures.size());
        return new ResolvedInstrument(name, normalizer.lengthUnits(), samplePosition, normalizer.origin(), source,
                List.copyOf(monitors), List.copyOf(detectors), List.copyOf(grids), List.copyOf(failures));
    }

    /**
     * 解析所有一般探测器模块（含 RectangularDetector）。
     *
     * @throws NotFoundInIdfException IDF 中没有 {@code is="detector"} 的类型
     */
    public List<ResolvedDetector> resolveDetectors(IdfDocument document) {
        if (document.typesWithKind("detector").isEmpty()) {
            throw new NotFoundInIdfException("IDF 中没有 is=\"detector\" 的像素类型");
        }
        CoordinateNormalizer normalizer = normalizerFor(document);
        List<ResolutionFailure> failures = new ArrayList<>();
        List<ResolvedDetector> detectors = new ArrayList<>(
                resolveModules(document, normalizer, TypeGraph.build(document, normalizer), failures));
        detectors.addAll(resolveRectangularDetectors(document, normalizer, failures));
        return detectors;
    }

    public List<ResolvedMonitor> resolveMonitors(IdfDocument document) {
        return resolveMonitors(document, normalizerFor(document), new ArrayList<>());
    }

    public List<ResolvedGridDetector> resolveStructuredDetectors(IdfDocument document) {
        return resolveStructuredDetectors(document, normalizerFor(document), new ArrayList<>());
    }

    /**
     * 样品位置（NeXus 坐标，不减原点）。
     *
     * @throws NotFoundInIdfException IDF 中没有 SamplePos
     */
    public Vector3D resolveSamplePosition(IdfDocument document) {
        return resolveSamplePosition(document, FrameReader.read(document));
    }

    /**
     * @throws NotFoundInIdfException IDF 中没有 Source
     */
    public ResolvedSource resolveSource(IdfDocument document) {
        return resolveSource(document, normalizerFor(document));
    }

    private CoordinateNormalizer normalizerFor(IdfDocument document) {
        CoordinateNormalizer frame = FrameReader.read(document);
        if (!originAtSample || document.typesWithKind("samplepos").isEmpty()) {
            return frame;
        }
        return frame.withOrigin(resolveSamplePosition(document, frame));
    }

    private Vector3D resolveSamplePosition(IdfDocument document, CoordinateNormalizer frame) {
        Element component = firstPlacement(document, "samplepos");
        if (component == null) {
            throw new NotFoundInIdfException("IDF 中没有样品位置（is=\"SamplePos\" 的组件）");
        }
        Element location = IdfDocument.firstChild(component, "location");
        return frame.toNexusFrame(LocationReader.rawPoint(location, frame.angleUnit()), false);
    }

    private ResolvedSource resolveSource(IdfDocument document, CoordinateNormalizer normalizer) {
        Element component = firstPlacement(document, "source");
        if (component == null) {
            throw new NotFoundInIdfException("IDF 中没有中子源（is=\"Source\" 的组件）");
        }
        Element location = IdfDocument.firstChild(component, "location");
        Vector3D position = normalizer.toNexusFrame(LocationReader.rawPoint(location, normalizer.angleUnit()), true);
        return new ResolvedSource(component.getAttribute("type"), position);
    }

    private static Element firstPlacement(IdfDocument document, String kind) {
        for (Element type : document.typesWithKind(kind)) {
            List<Element> placed = document.componentsOfType(type.getAttribute("name"));
            if (!placed.isEmpty()) {
                return placed.get(0);
            }
        }
        return null;
    }

    // ---- 一般探测器模块 ----

    private List<ResolvedDetector> resolveModules(IdfDocument document, CoordinateNormalizer normalizer,
                                                  TypeGraph graph, List<ResolutionFailure> failures) {
        Set<String> topLevelTypes = graph.topLevelTypeNames();
        log.debug("顶层探测器类型：{}", topLevelTypes);
        Element defaultFacing = FrameReader.defaultFacing(document);
        Map<Integer, PixelShape> shapes = new HashMap<>();

        List<ResolvedDetector> out = new ArrayList<>();
        for (Element component : document.components()) {
            String typeName = IdfDocument.attribute(component, "type");
            if (typeName == null || !topLevelTypes.contains(typeName)) {
                continue;
            }
            String name = componentName(component, typeName);
            attempt(name, failures, out,
                    () -> resolveModule(document, normalizer, graph, component, name, defaultFacing, shapes));
        }
        return out;
    }

    private ResolvedDetector resolveModule(IdfDocument document, CoordinateNormalizer normalizer, TypeGraph graph,
                                           Element component, String name, Element defaultFacing,
                                           Map<Integer, PixelShape> shapes) {
        int typeIndex = graph.indexOf(component.getAttribute("type"));
        TypeGraph.Aggregate aggregate = graph.aggregate(typeIndex);
        String idListName = IdfDocument.attribute(component, "idlist");

        List<Vector3D> offsets;
        List<String> chain;
        Vector3D location;
        Orientation orientation;

        TypeGraph.SubComponent wrapped = wrappedSubComponent(graph, typeIndex, component);
        if (wrapped != null) {
            // 包装层合并：idlist 取自唯一的子组件；子组件只有一个位置时模块位置、朝向也取自它
            if (idListName == null) {
                idListName = wrapped.idListName();
            }
            if (wrapped.locations().size() == 1 && !wrapped.locations().get(0).ranged()) {
                LocatedPoint inner = wrapped.locations().get(0);
                TypeGraph.Aggregate child = graph.aggregate(wrapped.childIndex());
                offsets = child.offsets();
                chain = child.chain();
                location = normalizer.toNexusFrame(inner.raw(), true);
                orientation = LocationReader.orientation(inner.element(), location, normalizer, defaultFacing);
            } else {
                // 子组件有多个位置：聚合结果已按“子组件位置 + 内层偏移”展开，模块本身放在原点
                offsets = aggregate.offsets();
                chain = aggregate.chain();
                location = normalizer.toNexusFrame(Vector3D.ZERO, true);
                orientation = null;
                log.debug("组件 {} 的子组件有 {} 个位置，按最外层偏移展开", name, wrapped.locations().size());
            }
        } else {
            List<LocatedPoint> placements = LocationReader.read(component, normalizer.angleUnit());
            chain = aggregate.chain();
            if (placements.size() <= 1) {
                LocatedPoint placement = placements.isEmpty() ? null : placements.get(0);
                offsets = aggregate.offsets();
                location = normalizer.toNexusFrame(placement == null ? Vector3D.ZERO : placement.raw(), true);
                Element locationElement = placement == null || placement.ranged() ? null : placement.element();
                orientation = LocationReader.orientation(locationElement, location, normalizer, defaultFacing);
            } else {
                // 同一组件多个位置：位置作为最外层偏移，模块本身放在原点
                offsets = new ArrayList<>(placements.size() * aggregate.offsets().size());
                for (LocatedPoint placement : placements) {
                    Vector3D outer = normalizer.toNexusFrame(placement.raw(), false);
                    for (Vector3D inner : aggregate.offsets()) {
                        offsets.add(outer.add(inner));
                    }
                }
                location = normalizer.toNexusFrame(Vector3D.ZERO, true);
                orientation = null;
                log.debug("组件 {} 有 {} 个位置，按最外层偏移展开，忽略各位置上的朝向", name, placements.size());
            }
        }

        List<Integer> ids = IdListReader.read(document, idListName, name);
        if (ids.size() != offsets.size()) {
            throw new MalformedIdListException("id 数量（" + ids.size() + "）与像素数量（" + offsets.size() + "）不一致", name);
        }
        int pixelType = aggregate.pixelTypeIndex();
        PixelShape pixel = shapes.get(pixelType);
        if (pixel == null) {
            pixel = PixelShapeReader.read(graph.element(pixelType), normalizer);
            shapes.put(pixelType, pixel);
        }
        log.debug("探测器模块 {}：{} 个像素，类型链 {}", name, offsets.size(), chain);
        return new ResolvedDetector(name, chain, graph.name(pixelType), pixel, offsets, ids, location, orientation);
    }

    /**
     * 模块没有自己的位置，且类型只有一个含像素的子组件时，返回该子组件。
     */
    private static TypeGraph.SubComponent wrappedSubComponent(TypeGraph graph, int typeIndex, Element component) {
        if (!LocationReader.hasNoOwnLocation(component)) {
            return null;
        }
        TypeGraph.SubComponent found = null;
        for (TypeGraph.SubComponent sub : graph.subComponents(typeIndex)) {
            if (!graph.isBearing(sub.childIndex())) {
                continue;
            }
            if (found != null) {
                return null;
            }
            found = sub;
        }
        return found;
    }

    // ---- RectangularDetector ----

    private List<ResolvedDetector> resolveRectangularDetectors(IdfDocument document, CoordinateNormalizer normalizer,
                                                               List<ResolutionFailure> failures) {
        Element defaultFacing = FrameReader.defaultFacing(document);
        List<ResolvedDetector> out = new ArrayList<>();
        for (Element type : document.typesWithKind("rectangulardetector")) {
            String typeName = type.getAttribute("name");
            for (Element component : document.componentsOfType(typeName)) {
                List<LocatedPoint> placements = LocationReader.read(component, normalizer.angleUnit());
                if (placements.isEmpty()) {
                    placements = List.of(new LocatedPoint(Vector3D.ZERO, null, null, false));
                }
                for (LocatedPoint placement : placements) {
                    String name = firstNonNull(placement.name(), IdfDocument.attribute(component, "name"), typeName);
                    attempt(name, failures, out,
                            () -> resolveRectangular(document, normalizer, type, component, placement, name, defaultFacing));
                }
            }
        }
        return out;
    }

    private ResolvedDetector resolveRectangular(IdfDocument document, CoordinateNormalizer normalizer, Element type,
                                                Element component, LocatedPoint placement, String name,
                                                Element defaultFacing) {
        String typeName = type.getAttribute("name");
        Element pixelType = pixelTypeOf(document, type);
        PixelShape pixel = PixelShapeReader.read(pixelType, normalizer);

        int xPixels = requiredPositive(type, "xpixels", typeName);
        int yPixels = requiredPositive(type, "ypixels", typeName);
        double xStart = IdfDocument.doubleAttribute(type, "xstart", 0.0);
        double xStep = IdfDocument.doubleAttribute(type, "xstep", 0.0);
        double yStart = IdfDocument.doubleAttribute(type, "ystart", 0.0);
        double yStep = IdfDocument.doubleAttribute(type, "ystep", 0.0);
        GridNumbering numbering = GridNumbering.of(component, xPixels, yPixels);

        List<Vector3D> offsets = new ArrayList<>(xPixels * yPixels);
        List<Integer> ids = new ArrayList<>(xPixels * yPixels);
        for (int y = 0; y < yPixels; y++) {
            for (int x = 0; x < xPixels; x++) {
                offsets.add(normalizer.toNexusFrame(new Vector3D(xStart + x * xStep, yStart + y * yStep, 0.0), false));
                ids.add(numbering.id(x, y));
            }
        }
        Vector3D location = normalizer.toNexusFrame(placement.raw(), true);
        Orientation orientation = LocationReader.orientation(placement.element(), location, normalizer, defaultFacing);
        return new ResolvedDetector(name, List.of(typeName, pixelType.getAttribute("name")), pixelType.getAttribute("name"),
                pixel, offsets, ids, location, orientation);
    }

    // ---- StructuredDetector ----

    private List<ResolvedGridDetector> resolveStructuredDetectors(IdfDocument document, CoordinateNormalizer normalizer,
                                                                  List<ResolutionFailure> failures) {
        Element defaultFacing = FrameReader.defaultFacing(document);
        List<ResolvedGridDetector> out = new ArrayList<>();
        for (Element type : document.typesWithKind("structureddetector")) {
            String typeName = type.getAttribute("name");
            for (Element component : document.componentsOfType(typeName)) {
                Element location = IdfDocument.firstChild(component, "location");
                String name = firstNonNull(IdfDocument.attribute(location, "name"),
                        IdfDocument.attribute(component, "name"), typeName);
                attempt(name, failures, out,
                        () -> resolveStructured(normalizer, type, component, location, name, defaultFacing));
            }
        }
        return out;
    }

    private ResolvedGridDetector resolveStructured(CoordinateNormalizer normalizer, Element type, Element component,
                                                   Element locationElement, String name, Element defaultFacing) {
        String typeName = type.getAttribute("name");
        int xPixels = requiredPositive(type, "xpixels", typeName);
        int yPixels = requiredPositive(type, "ypixels", typeName);
        List<Element> vertexElements = IdfDocument.children(type, "vertex");
        int expected = (xPixels + 1) * (yPixels + 1);
        if (vertexElements.size() != expected) {
            throw new IdfConversionException("StructuredDetector 角点数量应为 (xpixels+1)*(ypixels+1)=" + expected
                    + "，实际为 " + vertexElements.size(), typeName);
        }
        List<Vector3D> vertices = new ArrayList<>(expected);
        for (Element vertex : vertexElements) {
            vertices.add(normalizer.toNexusFrame(LocationReader.rawPoint(vertex, normalizer.angleUnit()), false));
        }

        GridNumbering numbering = GridNumbering.of(component, xPixels, yPixels);
        List<Vector3D> centres = new ArrayList<>(xPixels * yPixels);
        List<Integer> ids = new ArrayList<>(xPixels * yPixels);
        for (int row = 0; row < yPixels; row++) {
            for (int column = 0; column < xPixels; column++) {
                int first = column + row * (xPixels + 1);
                Vector3D sum = vertices.get(first)
                        .add(vertices.get(first + xPixels + 1))
                        .add(vertices.get(first + xPixels + 2))
                        .add(vertices.get(first + 1));
                centres.add(sum.scalarMultiply(0.25));
                ids.add(numbering.id(column, row));
            }
        }
        Vector3D location = normalizer.toNexusFrame(LocationReader.rawPoint(locationElement, normalizer.angleUnit()), true);
        Orientation orientation = LocationReader.orientation(locationElement, location, normalizer, defaultFacing);
        return new ResolvedGridDetector(name, typeName, xPixels, yPixels, vertices, centres, ids, location, orientation);
    }

    /**
     * RectangularDetector/StructuredDetector 的 id 编号规则（属性在 component 上）。
     * <p>
     * {@code idfillbyfirst="y"}（默认）时先沿 y 递增 {@code idstep}，换列加 {@code idstepbyrow}；为 x 时反之。
     */
    private record GridNumbering(int start, boolean fillByY, int step, int stepByRow) {

        static GridNumbering of(Element component, int xPixels, int yPixels) {
            String fillByFirst = IdfDocument.attribute(component, "idfillbyfirst");
            boolean fillByY = fillByFirst == null || "y".equals(fillByFirst.toLowerCase(Locale.ROOT));
            return new GridNumbering(
                    IdfDocument.intAttribute(component, "idstart", 0),
                    fillByY,
                    IdfDocument.intAttribute(component, "idstep", 1),
                    IdfDocument.intAttribute(component, "idstepbyrow", fillByY ? yPixels : xPixels));
        }

        int id(int x, int y) {
            return fillByY ? start + x * stepByRow + y * step : start + y * stepByRow + x * step;
        }
    }

    // ---- 监视器 ----

    private List<ResolvedMonitor> resolveMonitors(IdfDocument document, CoordinateNormalizer normalizer,
                                                  List<ResolutionFailure> failures) {
        Map<String, Element> monitorTypes = new HashMap<>();
        for (Element type : document.typesWithKind("monitor")) {
            monitorTypes.putIfAbsent(type.getAttribute("name"), type);
        }
        Map<String, Element> allTypes = new HashMap<>();
        for (Element type : document.types()) {
            allTypes.putIfAbsent(type.getAttribute("name"), type);
        }

        List<ResolvedMonitor> out = new ArrayList<>();
        for (Element component : document.components()) {
            String typeName = component.getAttribute("type");
            Element type = allTypes.get(typeName);
            if (type == null) {
                continue;
            }
            String groupName = firstNonNull(IdfDocument.attribute(component, "name"), typeName);
            if (monitorTypes.containsKey(typeName)) {
                attemptAll(groupName, failures, out,
                        () -> placedMonitors(document, normalizer, component, type, monitorTypes));
            } else if (containsMonitors(type, monitorTypes)) {
                attemptAll(groupName, failures, out,
                        () -> groupedMonitors(document, normalizer, component, type, monitorTypes));
            }
        }
        return out;
    }

    private static boolean containsMonitors(Element type, Map<String, Element> monitorTypes) {
        for (Element sub : IdfDocument.children(type, "component")) {
            if (monitorTypes.containsKey(sub.getAttribute("type"))) {
                return true;
            }
        }
        return false;
    }

    /**
     * instrument 下直接放置的监视器组件。
     */
    private List<ResolvedMonitor> placedMonitors(IdfDocument document, CoordinateNormalizer normalizer,
                                                 Element component, Element type, Map<String, Element> monitorTypes) {
        String typeName = type.getAttribute("name");
        List<LocatedPoint> placements = LocationReader.read(component, normalizer.angleUnit());
        String componentName = firstNonNull(IdfDocument.attribute(component, "name"), typeName);
        List<Integer> ids = IdListReader.read(document, IdfDocument.attribute(component, "idlist"), componentName);
        checkEnoughIds(ids, placements.size(), componentName);
        PixelShape shape = PixelShapeReader.readOptional(monitorTypes.get(typeName), normalizer);
        List<ResolvedMonitor> out = new ArrayList<>();
        for (int i = 0; i < placements.size(); i++) {
            LocatedPoint placement = placements.get(i);
            out.add(new ResolvedMonitor(firstNonNull(placement.name(), IdfDocument.attribute(component, "name"), typeName),
                    typeName, ids.get(i), normalizer.toNexusFrame(placement.raw(), true), shape));
        }
        return out;
    }

    /**
     * 包含监视器子组件的分组类型（例如 “monitors”）；id 取自分组组件的 idlist，按声明顺序分配。
     */
    private List<ResolvedMonitor> groupedMonitors(IdfDocument document, CoordinateNormalizer normalizer,
                                                  Element component, Element groupType,
                                                  Map<String, Element> monitorTypes) {
        String groupName = firstNonNull(IdfDocument.attribute(component, "name"), groupType.getAttribute("name"));
        Vector3D groupOrigin = LocationReader.rawPoint(IdfDocument.firstChild(component, "location"), normalizer.angleUnit());

        List<ResolvedMonitor> out = new ArrayList<>();
        List<String> names = new ArrayList<>();
        List<String> typeNames = new ArrayList<>();
        List<Vector3D> positions = new ArrayList<>();
        List<PixelShape> shapes = new ArrayList<>();
        for (Element sub : IdfDocument.children(groupType, "component")) {
            String subType = sub.getAttribute("type");
            if (!monitorTypes.containsKey(subType)) {
                continue;
            }
            PixelShape shape = PixelShapeReader.readOptional(monitorTypes.get(subType), normalizer);
            for (LocatedPoint placement : LocationReader.read(sub, normalizer.angleUnit())) {
                names.add(firstNonNull(placement.name(), IdfDocument.attribute(sub, "name"), subType));
                typeNames.add(subType);
                positions.add(normalizer.toNexusFrame(groupOrigin.add(placement.raw()), true));
                shapes.add(shape);
            }
        }
        List<Integer> ids = IdListReader.read(document, IdfDocument.attribute(component, "idlist"), groupName);
        checkEnoughIds(ids, names.size(), groupName);
        for (int i = 0; i < names.size(); i++) {
            out.add(new ResolvedMonitor(names.get(i), typeNames.get(i), ids.get(i), positions.get(i), shapes.get(i)));
        }
        return out;
    }

    private static void checkEnoughIds(List<Integer> ids, int required, String componentName) {
        if (ids.size() < required) {
            throw new MalformedIdListException("id 数量（" + ids.size() + "）少于监视器数量（" + required + "）", componentName);
        }
    }

    // ---- 公共辅助 ----

    private static Element pixelTypeOf(IdfDocument document, Element containerType) {
        String containerName = containerType.getAttribute("name");
        String pixelTypeName = IdfDocument.attribute(containerType, "type");
        if (pixelTypeName == null) {
            throw new NotFoundInIdfException("没有声明像素类型（type 属性）", containerName);
        }
        for (Element type : document.types()) {
            if (pixelTypeName.equals(type.getAttribute("name"))) {
                return type;
            }
        }
        throw new NotFoundInIdfException("找不到像素类型：" + pixelTypeName, containerName);
    }

    private static int requiredPositive(Element type, String attribute, String typeName) {
        int value = IdfDocument.intAttribute(type, attribute, -1);
        if (value < 1) {
            throw new IdfConversionException("缺少或非法的 " + attribute + " 属性", typeName);
        }
        return value;
    }

    private static String componentName(Element component, String typeName) {
        Element location = IdfDocument.firstChild(component, "location");
        return firstNonNull(IdfDocument.attribute(component, "name"), IdfDocument.attribute(location, "name"), typeName);
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private <T> void attempt(String componentName, List<ResolutionFailure> failures, List<T> out, Supplier<T> work) {
        attemptAll(componentName, failures, out, () -> List.of(work.get()));
    }

    private <T> void attemptAll(String componentName, List<ResolutionFailure> failures, List<T> out,
                                Supplier<List<T>> work) {
        try {
            out.addAll(work.get());
        } catch (IdfConversionException | IllegalArgumentException e) {
            if (failureMode == FailureMode.ABORT) {
                throw e;
            }
            log.warn("跳过组件 {}：{}", componentName, e.getMessage());
            failures.add(ResolutionFailure.of(componentName, e));
        }
    }
}
