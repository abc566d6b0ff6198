package org.idfnexus.geometry.nexus;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.GeometryMath;
import org.idfnexus.geometry.idf.Orientation;
import org.idfnexus.geometry.idf.PixelShape;
import org.idfnexus.geometry.idf.ResolvedDetector;
import org.idfnexus.geometry.idf.ResolvedGridDetector;
import org.idfnexus.geometry.idf.ResolvedInstrument;
import org.idfnexus.geometry.idf.ResolvedMonitor;
import org.idfnexus.geometry.idf.ResolvedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把 {@link ResolvedInstrument} 写成 NeXus 树。
 * <p>
 * 树结构：
 * <pre>
 * /entry                      NXentry
 *   /instrument               NXinstrument（name 带 short_name 属性）
 *     /source                 NXsource
 *     /detector_N             NXdetector（local_name、detector_number、*_pixel_offset、形状、transformations）
 *     /&lt;monitor name&gt;         NXmonitor（detector_id、transformations）
 *   /sample                   NXsample
 * </pre>
 * <p>
 * 类型链相同（且像素偏移相同）的探测器模块共享同一个 {@code pixel_shape} 组和偏移数据集（链接，不复制）。
 */
public final class GeometryBuilder {

    private static final Logger log = LoggerFactory.getLogger(GeometryBuilder.class);

    public static final String PIXEL_SHAPE = "pixel_shape";
    public static final String DETECTOR_SHAPE = "detector_shape";
    public static final String TRANSFORMATIONS = "transformations";
    public static final String DEPENDS_ON = "depends_on";

    private static final String[] OFFSET_NAMES = {"x_pixel_offset", "y_pixel_offset", "z_pixel_offset"};

    private final String entryName;

    public GeometryBuilder() {
        this("entry");
    }

    public GeometryBuilder(String entryName) {
        this.entryName = entryName == null || entryName.isBlank() ? "entry" : entryName;
    }

    public NexusTree build(ResolvedInstrument instrument) {
        NexusTree tree = new NexusTree();
        NexusGroup entry = tree.root().addGroup(entryName, "NXentry");
        String units = instrument.lengthUnits();

        NexusGroup nxInstrument = entry.addGroup("instrument", "NXinstrument");
        String name = instrument.name() == null ? "unknown" : instrument.name();
        nxInstrument.addDataset(NexusDataset.text("name", name))
                .setAttribute("short_name", name.length() > 2 ? name.substring(0, 3) : name);

        ResolvedSource source = instrument.source();
        if (source != null) {
            NexusGroup nxSource = nxInstrument.addGroup("source", "NXsource");
            nxSource.addDataset(NexusDataset.text("name", source.name()));
            emitTransformChain(nxSource, source.location(), null, units);
        }

        int detectorNumber = 0;
        Map<List<String>, List<NexusGroup>> sharedByChain = new HashMap<>();
        for (ResolvedDetector detector : instrument.detectors()) {
            detectorNumber++;
            addDetector(nxInstrument, detectorNumber, detector, units, sharedByChain);
        }
        for (ResolvedGridDetector grid : instrument.gridDetectors()) {
            detectorNumber++;
            addGridDetector(nxInstrument, detectorNumber, grid, units);
        }
        addMonitors(nxInstrument, instrument.monitors(), units);

        NexusGroup sample = entry.addGroup("sample", "NXsample");
        sample.addDataset(NexusDataset.text("name", "sample"));
        emitTransformChain(sample, instrument.samplePosition().subtract(instrument.origin()), null, units);

        log.info("NeXus 树构建完成：{} 个探测器，{} 个监视器", detectorNumber, instrument.monitors().size());
        return tree;
    }

    /**
     * 像素形状：长方体保持参数形式；圆柱转换为 3 点描述的 {@code NXcylindrical_geometry}。
     * <p>
     * 三个点依次为底面中心 a、底面边缘一点 b = a + radius * orth(a - c)、顶面中心 c，{@code cylinders = [[0, 1, 2]]}。
     */
    public static ShapeGeometry buildShape(PixelShape shape) {
        if (shape instanceof PixelShape.Cuboid cuboid) {
            return new ShapeGeometry.Parametric(cuboid.xSize(), cuboid.ySize(), cuboid.thickness());
        }
        PixelShape.Cylinder cylinder = (PixelShape.Cylinder) shape;
        Vector3D bottom = cylinder.baseCentre();
        Vector3D top = bottom.add(cylinder.height(), cylinder.axis());
        Vector3D edge = bottom.add(cylinder.radius(), GeometryMath.orthogonalUnitVector(bottom.subtract(top)));
        return new ShapeGeometry.Cylinders(new double[]{
                bottom.getX(), bottom.getY(), bottom.getZ(),
                edge.getX(), edge.getY(), edge.getZ(),
                top.getX(), top.getY(), top.getZ()
        }, new int[]{0, 1, 2});
    }

    /**
     * 为组件写出变换链并写入组件的 {@code depends_on}。
     * <p>
     * 有朝向：{@code orientation}（旋转，depends_on = "."）← {@code location}（平移，依赖旋转）；
     * 只有位置：单个平移。组件的 depends_on 指向平移，因此先旋转后平移。
     * 零长度平移写成方向 (0,0,1)、距离 0。
     *
     * @return 组件 depends_on 指向的变换路径
     */
    public static String emitTransformChain(NexusGroup component, Vector3D location, Orientation orientation,
                                            String lengthUnits) {
        NexusGroup transformations = component.addGroup(TRANSFORMATIONS, "NXtransformations");
        String dependsOn = TransformNode.TERMINAL;
        if (orientation != null) {
            TransformNode rotation = new TransformNode("orientation", TransformNode.Kind.ROTATION,
                    orientation.angleDegrees(), "degrees", orientation.axis(), null, TransformNode.TERMINAL);
            dependsOn = transformations.addDataset(rotation.toDataset()).path();
        }
        GeometryMath.Normalised normalised = GeometryMath.normalise(location == null ? Vector3D.ZERO : location);
        Vector3D direction = normalised.magnitude() == 0.0 ? Vector3D.PLUS_K : normalised.unit();
        TransformNode translation = new TransformNode("location", TransformNode.Kind.TRANSLATION,
                normalised.magnitude(), lengthUnits, direction, null, dependsOn);
        String path = transformations.addDataset(translation.toDataset()).path();
        component.addDataset(NexusDataset.text(DEPENDS_ON, path));
        return path;
    }

    private void addDetector(NexusGroup nxInstrument, int number, ResolvedDetector detector, String units,
                             Map<List<String>, List<NexusGroup>> sharedByChain) {
        NexusGroup group = nxInstrument.addGroup("detector_" + number, "NXdetector");
        group.addDataset(NexusDataset.text("local_name", detector.name()));

        int[] ids = detector.idList().stream().mapToInt(Integer::intValue).toArray();
        group.addDataset(NexusDataset.indices("detector_number", ids));

        List<NexusGroup> candidates = sharedByChain.computeIfAbsent(detector.subComponentTypeChain(), k -> new ArrayList<>());
        NexusGroup shared = null;
        for (NexusGroup candidate : candidates) {
            if (sameOffsets(candidate, detector)) {
                shared = candidate;
                break;
            }
        }
        if (shared != null) {
            for (String offsetName : OFFSET_NAMES) {
                if (shared.contains(offsetName)) {
                    group.link(offsetName, shared.child(offsetName));
                }
            }
            if (shared.contains(PIXEL_SHAPE)) {
                group.link(PIXEL_SHAPE, shared.child(PIXEL_SHAPE));
            }
            log.debug("探测器 {} 复用 {} 的像素几何", detector.name(), shared.path());
        } else {
            writeOffsets(group, detector.offsets(), units);
            ShapeGeometry geometry = buildShape(detector.pixel());
            if (geometry instanceof ShapeGeometry.Cylinders cylinders) {
                writeCylinders(group, PIXEL_SHAPE, cylinders, units);
            }
            candidates.add(group);
        }

        if (detector.pixel() instanceof PixelShape.Cuboid cuboid) {
            group.addDataset(NexusDataset.scalar("x_pixel_size", cuboid.xSize())).setAttribute("units", units);
            group.addDataset(NexusDataset.scalar("y_pixel_size", cuboid.ySize())).setAttribute("units", units);
            group.addDataset(NexusDataset.scalar("thickness", cuboid.thickness())).setAttribute("units", units);
        }
        emitTransformChain(group, detector.location(), detector.orientation(), units);
    }

    private static boolean sameOffsets(NexusGroup shared, ResolvedDetector detector) {
        double[] xs = shared.dataset(OFFSET_NAMES[0]).doubles();
        if (xs.length != detector.pixelCount()) {
            return false;
        }
        NexusDataset zDataset = shared.dataset(OFFSET_NAMES[2]);
        double[] ys = shared.dataset(OFFSET_NAMES[1]).doubles();
        double[] zs = zDataset == null ? null : zDataset.doubles();
        List<Vector3D> offsets = detector.offsets();
        for (int i = 0; i < xs.length; i++) {
            Vector3D offset = offsets.get(i);
            double z = zs == null ? 0.0 : zs[i];
            if (xs[i] != offset.getX() || ys[i] != offset.getY() || z != offset.getZ()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 写 x/y/z_pixel_offset；z 全为 0 时省略。
     */
    private static void writeOffsets(NexusGroup group, List<Vector3D> offsets, String units) {
        int n = offsets.size();
        double[][] columns = new double[3][n];
        boolean anyZ = false;
        for (int i = 0; i < n; i++) {
            Vector3D offset = offsets.get(i);
            columns[0][i] = offset.getX();
            columns[1][i] = offset.getY();
            columns[2][i] = offset.getZ();
            anyZ |= offset.getZ() != 0.0;
        }
        for (int axis = 0; axis < 3; axis++) {
            if (axis == 2 && !anyZ) {
                continue;
            }
            group.addDataset(NexusDataset.vector(OFFSET_NAMES[axis], columns[axis])).setAttribute("units", units);
        }
    }

    private static void writeCylinders(NexusGroup parent, String name, ShapeGeometry.Cylinders cylinders, String units) {
        NexusGroup shape = parent.addGroup(name, "NXcylindrical_geometry");
        shape.addDataset(NexusDataset.ofDoubles("vertices", cylinders.vertices(), cylinders.vertexCount(), 3))
                .setAttribute("units", units);
        shape.addDataset(NexusDataset.ofInts("cylinders", cylinders.cylinders(), cylinders.cylinderCount(), 3));
    }

    /**
     * 写 {@code NXoff_geometry}：{@code faces[i]} 是第 i 个面在 {@code winding_order} 中的起始下标。
     */
    static NexusGroup writeOffGeometry(NexusGroup parent, String name, double[] vertices, int[] windingOrder,
                                       int[] faces, String units) {
        NexusGroup shape = parent.addGroup(name, "NXoff_geometry");
        shape.addDataset(NexusDataset.ofDoubles("vertices", vertices, vertices.length / 3, 3)).setAttribute("units", units);
        shape.addDataset(NexusDataset.indices("winding_order", windingOrder));
        shape.addDataset(NexusDataset.indices("faces", faces));
        return shape;
    }

    private void addGridDetector(NexusGroup nxInstrument, int number, ResolvedGridDetector grid, String units) {
        NexusGroup group = nxInstrument.addGroup("detector_" + number, "NXdetector");
        group.addDataset(NexusDataset.text("local_name", grid.name()));

        int pixels = grid.xPixels() * grid.yPixels();
        double[] vertices = new double[grid.vertices().size() * 3];
        for (int i = 0; i < grid.vertices().size(); i++) {
            Vector3D vertex = grid.vertices().get(i);
            vertices[3 * i] = vertex.getX();
            vertices[3 * i + 1] = vertex.getY();
            vertices[3 * i + 2] = vertex.getZ();
        }
        int[] windingOrder = new int[pixels * 4];
        int[] faces = new int[pixels];
        int[] detectorFaces = new int[pixels * 2];
        int face = 0;
        for (int row = 0; row < grid.yPixels(); row++) {
            for (int column = 0; column < grid.xPixels(); column++) {
                int first = grid.vertexIndex(column, row);
                faces[face] = face * 4;
                windingOrder[face * 4] = first;
                windingOrder[face * 4 + 1] = first + grid.xPixels() + 1;
                windingOrder[face * 4 + 2] = first + grid.xPixels() + 2;
                windingOrder[face * 4 + 3] = first + 1;
                detectorFaces[face * 2] = face;
                detectorFaces[face * 2 + 1] = grid.idList().get(face);
                face++;
            }
        }
        NexusGroup shape = writeOffGeometry(group, DETECTOR_SHAPE, vertices, windingOrder, faces, units);
        shape.addDataset(NexusDataset.ofInts("detector_faces", detectorFaces, pixels, 2));

        group.addDataset(NexusDataset.indices("detector_number",
                grid.idList().stream().mapToInt(Integer::intValue).toArray()));
        writeOffsets(group, grid.pixelCentres(), units);
        emitTransformChain(group, grid.location(), grid.orientation(), units);
    }

    private void addMonitors(NexusGroup nxInstrument, List<ResolvedMonitor> monitors, String units) {
        Map<String, Integer> nameCounts = new HashMap<>();
        for (ResolvedMonitor monitor : monitors) {
            nameCounts.merge(monitor.name(), 1, Integer::sum);
        }
        List<String> written = new ArrayList<>();
        for (ResolvedMonitor monitor : monitors) {
            String name = nameCounts.get(monitor.name()) > 1 ? monitor.name() + "_" + monitor.id() : monitor.name();
            NexusGroup group = nxInstrument.addGroup(name, "NXmonitor");
            group.addDataset(NexusDataset.scalar("detector_id", monitor.id()));
            if (monitor.shape() != null) {
                ShapeGeometry geometry = buildShape(monitor.shape());
                if (geometry instanceof ShapeGeometry.Cylinders cylinders) {
                    writeCylinders(group, "shape", cylinders, units);
                } else {
                    writeBox(group, (ShapeGeometry.Parametric) geometry, units);
                }
            }
            emitTransformChain(group, monitor.location(), null, units);
            written.add(group.name());
        }
        if (!written.isEmpty()) {
            log.debug("写入监视器：{}", written);
        }
    }

    /**
     * 长方体监视器写成以原点为中心的 8 顶点 6 面网格（x 宽、y 厚度、z 深）。
     */
    private static void writeBox(NexusGroup group, ShapeGeometry.Parametric box, String units) {
        double hx = box.xPixelSize() / 2;
        double hy = box.thickness() / 2;
        double hz = box.yPixelSize() / 2;
        double[] vertices = {
                -hx, -hy, -hz, hx, -hy, -hz, hx, hy, -hz, -hx, hy, -hz,
                -hx, -hy, hz, hx, -hy, hz, hx, hy, hz, -hx, hy, hz
        };
        int[] windingOrder = {
                0, 3, 2, 1,
                4, 5, 6, 7,
                0, 1, 5, 4,
                2, 3, 7, 6,
                1, 2, 6, 5,
                0, 4, 7, 3
        };
        writeOffGeometry(group, "shape", vertices, windingOrder, new int[]{0, 4, 8, 12, 16, 20}, units);
    }
}
