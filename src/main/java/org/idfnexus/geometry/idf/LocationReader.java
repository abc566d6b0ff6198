package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.GeometryMath;
import org.idfnexus.geometry.coords.AngleUnit;
import org.idfnexus.geometry.coords.CoordinateNormalizer;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code <location>}、{@code <locations>}、{@code <facing>}、{@code rot} 的读取。
 * <p>
 * 说明：
 * <ul>
 *   <li>位置既可以用笛卡尔 {@code x/y/z}，也可以用球坐标 {@code r/t/p}（角度单位取自 defaults）。</li>
 *   <li>{@code <locations>} 中所有声明了 {@code -end} 的坐标同步等分（包含端点）。</li>
 * </ul>
 */
final class LocationReader {

    private static final Vector3D PIXEL_FORWARD = new Vector3D(0.0, 0.0, -1.0);

    private LocationReader() {
    }

    static boolean isSpherical(Element element) {
        return element.hasAttribute("r") || element.hasAttribute("t") || element.hasAttribute("p");
    }

    /**
     * 读取单个点（IDF 坐标）；缺省分量为 0。
     */
    static Vector3D rawPoint(Element element, AngleUnit angleUnit) {
        if (element == null) {
            return Vector3D.ZERO;
        }
        if (isSpherical(element)) {
            return CoordinateNormalizer.sphericalToCartesian(
                    IdfDocument.doubleAttribute(element, "r", 0.0),
                    IdfDocument.doubleAttribute(element, "t", 0.0),
                    IdfDocument.doubleAttribute(element, "p", 0.0),
                    angleUnit);
        }
        return new Vector3D(
                IdfDocument.doubleAttribute(element, "x", 0.0),
                IdfDocument.doubleAttribute(element, "y", 0.0),
                IdfDocument.doubleAttribute(element, "z", 0.0));
    }

    /**
     * 按声明顺序读取 component 下的所有位置。
     */
    static List<LocatedPoint> read(Element component, AngleUnit angleUnit) {
        List<LocatedPoint> out = new ArrayList<>();
        for (Element child : IdfDocument.children(component, "location")) {
            out.add(new LocatedPoint(rawPoint(child, angleUnit), IdfDocument.attribute(child, "name"), child, false));
        }
        for (Element child : IdfDocument.children(component, "locations")) {
            out.addAll(expand(child, angleUnit));
        }
        if (!IdfDocument.children(component, "location").isEmpty()
                && !IdfDocument.children(component, "locations").isEmpty()) {
            // 混用时恢复文档顺序
            out.sort((a, b) -> Integer.compare(documentIndex(component, a.element()), documentIndex(component, b.element())));
        }
        return out;
    }

    /**
     * 没有 location，或只有一个没有任何坐标属性的 location。
     */
    static boolean hasNoOwnLocation(Element component) {
        List<Element> locations = IdfDocument.children(component, "location");
        if (!IdfDocument.children(component, "locations").isEmpty() || locations.size() > 1) {
            return false;
        }
        if (locations.isEmpty()) {
            return true;
        }
        Element location = locations.get(0);
        for (String name : List.of("x", "y", "z", "r", "t", "p", "rot")) {
            if (location.hasAttribute(name)) {
                return false;
            }
        }
        return IdfDocument.firstChild(location, "facing") == null;
    }

    private static List<LocatedPoint> expand(Element locations, AngleUnit angleUnit) {
        int count = IdfDocument.intAttribute(locations, "n-elements", -1);
        if (count < 1) {
            throw new IllegalArgumentException("<locations> 的 n-elements 必须为正整数：" + IdfDocument.describe(locations));
        }
        boolean spherical = isSpherical(locations);
        List<String> axes = spherical ? List.of("r", "t", "p") : List.of("x", "y", "z");
        double[] base = new double[3];
        double[] end = new double[3];
        boolean[] ranged = new boolean[3];
        for (int i = 0; i < 3; i++) {
            base[i] = IdfDocument.doubleAttribute(locations, axes.get(i), 0.0);
            ranged[i] = IdfDocument.attribute(locations, axes.get(i) + "-end") != null;
            end[i] = ranged[i] ? IdfDocument.doubleAttribute(locations, axes.get(i) + "-end", 0.0) : base[i];
        }

        String name = IdfDocument.attribute(locations, "name");
        int nameCountStart = IdfDocument.intAttribute(locations, "name-count-start", 0);
        List<LocatedPoint> out = new ArrayList<>(count);
        for (int k = 0; k < count; k++) {
            double[] values = base.clone();
            // 所有带 -end 的坐标同步等分
            for (int i = 0; i < 3; i++) {
                if (ranged[i] && count > 1) {
                    values[i] = base[i] + (end[i] - base[i]) * k / (count - 1);
                }
            }
            Vector3D raw = spherical
                    ? CoordinateNormalizer.sphericalToCartesian(values[0], values[1], values[2], angleUnit)
                    : new Vector3D(values);
            out.add(new LocatedPoint(raw, name == null ? null : name + (nameCountStart + k), locations, true));
        }
        return out;
    }

    /**
     * 顶层位置的朝向：{@code <facing>} 优先，其次 {@code rot}，最后是 instrument 级 {@code <components-are-facing>}。
     *
     * @param location       location 元素（可为 null）
     * @param nexusLocation  该位置的 NeXus 坐标（已减原点）
     * @param normalizer     坐标变换
     * @param defaultFacing  {@code <components-are-facing>} 元素；没有则为 null
     * @return 不需要旋转时返回 null
     */
    static Orientation orientation(Element location, Vector3D nexusLocation, CoordinateNormalizer normalizer,
                                   Element defaultFacing) {
        Element facing = location == null ? null : IdfDocument.firstChild(location, "facing");
        if (facing != null) {
            return facingOrientation(facing, nexusLocation, normalizer);
        }
        if (location != null && location.hasAttribute("rot")) {
            double angle = normalizer.toDegrees(IdfDocument.doubleAttribute(location, "rot", 0.0));
            Vector3D axis = normalizer.toNexusDirection(new Vector3D(
                    IdfDocument.doubleAttribute(location, "axis-x", 0.0),
                    IdfDocument.doubleAttribute(location, "axis-y", 0.0),
                    IdfDocument.doubleAttribute(location, "axis-z", 1.0)));
            if (angle == 0.0) {
                return null;
            }
            GeometryMath.Normalised normalised = GeometryMath.normalise(axis);
            if (normalised.magnitude() == 0.0) {
                throw new IllegalArgumentException("rot 的旋转轴不能为零向量：" + IdfDocument.describe(location));
            }
            return new Orientation(normalised.unit(), angle);
        }
        if (defaultFacing != null) {
            return facingOrientation(defaultFacing, nexusLocation, normalizer);
        }
        return null;
    }

    private static Orientation facingOrientation(Element facing, Vector3D nexusLocation, CoordinateNormalizer normalizer) {
        Vector3D target = normalizer.toNexusFrame(rawPoint(facing, normalizer.angleUnit()), true);
        Vector3D direction = target.subtract(nexusLocation);
        if (direction.getNorm() == 0.0) {
            return null;
        }
        GeometryMath.AxisAngle axisAngle = GeometryMath.axisAngleBetween(PIXEL_FORWARD, direction);
        if (axisAngle.isNoRotation()) {
            return null;
        }
        return new Orientation(axisAngle.axis(), axisAngle.angleDegrees());
    }

    private static int documentIndex(Element parent, Element child) {
        int index = 0;
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node == child) {
                return index;
            }
            index++;
        }
        return index;
    }
}
