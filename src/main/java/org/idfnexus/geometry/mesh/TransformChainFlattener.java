package org.idfnexus.geometry.mesh;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.RealMatrix;
import org.idfnexus.geometry.GeometryMath;
import org.idfnexus.geometry.nexus.GeometryBuilder;
import org.idfnexus.geometry.nexus.NexusDataset;
import org.idfnexus.geometry.nexus.NexusGroup;
import org.idfnexus.geometry.nexus.NexusTree;
import org.idfnexus.geometry.nexus.TransformNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * 把 NeXus 树中的所有几何组展开到同一个坐标系，合并成一个网格。
 * <p>
 * 对每个 {@code NXoff_geometry}/{@code NXcylindrical_geometry} 组：
 * <ol>
 *   <li>取出网格（圆柱先细分成管状网格）；</li>
 *   <li>组名为 {@code pixel_shape} 时，按父组的 {@code x/y/z_pixel_offset} 复制到每个像素；</li>
 *   <li>沿父组 {@code depends_on} 收集变换链，按发现顺序的逆序作用到所有顶点；</li>
 *   <li>追加到结果中，面与顶点下标整体平移。</li>
 * </ol>
 */
public final class TransformChainFlattener {

    private static final Logger log = LoggerFactory.getLogger(TransformChainFlattener.class);

    public static final int DEFAULT_TUBE_POINTS_PER_END = 5;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 4096;

    private final int tubePointsPerEnd;
    private final int parallelThreshold;

    public TransformChainFlattener() {
        this(DEFAULT_TUBE_POINTS_PER_END, DEFAULT_PARALLEL_THRESHOLD);
    }

    /**
     * @param tubePointsPerEnd  圆柱细分时每个端面的点数
     * @param parallelThreshold 像素数达到该值时并行复制
     */
    public TransformChainFlattener(int tubePointsPerEnd, int parallelThreshold) {
        this.tubePointsPerEnd = tubePointsPerEnd;
        this.parallelThreshold = parallelThreshold;
    }

    /**
     * 从 {@code dependsOn} 出发沿 depends_on 属性收集变换，顺序为“子 → 根”。
     *
     * @throws IllegalArgumentException 路径不存在
     * @throws IllegalStateException    链中出现环
     */
    public static List<TransformNode> collectChain(String dependsOn, NexusTree tree) {
        List<TransformNode> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String path = dependsOn;
        while (path != null && !TransformNode.TERMINAL.equals(path)) {
            if (!visited.add(path)) {
                throw new IllegalStateException("depends_on 链中存在环：" + path);
            }
            NexusDataset dataset = tree.dataset(path);
            if (dataset == null) {
                throw new IllegalArgumentException("depends_on 指向不存在的变换：" + path);
            }
            TransformNode node = TransformNode.fromDataset(dataset);
            chain.add(node);
            path = node.dependsOn();
        }
        return chain;
    }

    /**
     * 按发现顺序的逆序（从根往子）作用变换链，返回新数组。
     * <p>
     * 旋转：{@code v' = R(axis, angle) v + offset}；平移：{@code v' = v + vector * magnitude + offset}。
     */
    public static double[] applyChain(double[] vertices, List<TransformNode> chain) {
        double[] out = vertices.clone();
        for (int i = chain.size() - 1; i >= 0; i--) {
            TransformNode node = chain.get(i);
            Vector3D offset = node.offset() == null ? Vector3D.ZERO : node.offset();
            if (node.kind() == TransformNode.Kind.ROTATION) {
                Vector3D axis = GeometryMath.normalise(node.vector()).unit();
                RealMatrix rotation = GeometryMath.rotationMatrixFromAxisAngle(axis, toRadians(node.magnitude(), node.units()));
                double[][] m = rotation.getData();
                for (int v = 0; v < out.length; v += 3) {
                    double x = out[v];
                    double y = out[v + 1];
                    double z = out[v + 2];
                    out[v] = m[0][0] * x + m[0][1] * y + m[0][2] * z + offset.getX();
                    out[v + 1] = m[1][0] * x + m[1][1] * y + m[1][2] * z + offset.getY();
                    out[v + 2] = m[2][0] * x + m[2][1] * y + m[2][2] * z + offset.getZ();
                }
            } else {
                Vector3D shift = node.vector().scalarMultiply(node.magnitude()).add(offset);
                for (int v = 0; v < out.length; v += 3) {
                    out[v] += shift.getX();
                    out[v + 1] += shift.getY();
                    out[v + 2] += shift.getZ();
                }
            }
        }
        return out;
    }

    private static double toRadians(double angle, String units) {
        if (units != null && units.toLowerCase(Locale.ROOT).startsWith("rad")) {
            return angle;
        }
        return Math.toRadians(angle);
    }

    public Mesh replicatePixelShape(Mesh pixel, List<Vector3D> offsets) {
        double[] xs = new double[offsets.size()];
        double[] ys = new double[offsets.size()];
        double[] zs = new double[offsets.size()];
        for (int i = 0; i < offsets.size(); i++) {
            xs[i] = offsets.get(i).getX();
            ys[i] = offsets.get(i).getY();
            zs[i] = offsets.get(i).getZ();
        }
        return replicatePixelShape(pixel, xs, ys, zs);
    }

    /**
     * 把单像素网格复制到每个像素偏移处。
     * <p>
     * 结果预先分配：{@code n*v} 个顶点、{@code n*f} 个面、{@code n*w} 个 winding 下标；第 k 份的面下标加 {@code k*w}，
     * winding 下标加 {@code k*v}。各份写入互不重叠的区间，因此像素多时可以并行填充。
     */
    public Mesh replicatePixelShape(Mesh pixel, double[] xs, double[] ys, double[] zs) {
        int n = xs.length;
        if (ys.length != n || zs.length != n) {
            throw new IllegalArgumentException("像素偏移数组长度不一致：" + n + "/" + ys.length + "/" + zs.length);
        }
        int v = pixel.vertexCount();
        int f = pixel.faceCount();
        int w = pixel.windingOrder().length;
        double[] vertices = new double[n * v * 3];
        int[] faces = new int[n * f];
        int[] windingOrder = new int[n * w];

        double[] pixelVertices = pixel.vertices();
        int[] pixelFaces = pixel.faces();
        int[] pixelWinding = pixel.windingOrder();
        IntStream copies = IntStream.range(0, n);
        if (n >= parallelThreshold) {
            copies = copies.parallel();
        }
        copies.forEach(k -> {
            int vertexBase = k * v * 3;
            for (int i = 0; i < v; i++) {
                vertices[vertexBase + 3 * i] = pixelVertices[3 * i] + xs[k];
                vertices[vertexBase + 3 * i + 1] = pixelVertices[3 * i + 1] + ys[k];
                vertices[vertexBase + 3 * i + 2] = pixelVertices[3 * i + 2] + zs[k];
            }
            for (int i = 0; i < f; i++) {
                faces[k * f + i] = pixelFaces[i] + k * w;
            }
            for (int i = 0; i < w; i++) {
                windingOrder[k * w + i] = pixelWinding[i] + k * v;
            }
        });
        return new Mesh(vertices, faces, windingOrder);
    }

    /**
     * 找出树中所有几何组（经由链接到达的也算，所属组件为链接所在的父组）。
     */
    public List<GeometryGroup> findGeometryGroups(NexusTree tree) {
        List<GeometryGroup> found = new ArrayList<>();
        tree.visitGroups((group, location, parent) -> {
            if (parent == null) {
                return;
            }
            String nxClass = group.nxClass();
            String parentLocation = location.substring(0, location.lastIndexOf('/'));
            boolean singlePixel = location.endsWith("/" + GeometryBuilder.PIXEL_SHAPE);
            if ("NXoff_geometry".equals(nxClass)) {
                found.add(new GeometryGroup(readOff(group), parentLocation, singlePixel));
            } else if ("NXcylindrical_geometry".equals(nxClass)) {
                found.add(new GeometryGroup(readCylinders(group), parentLocation, singlePixel));
            }
        });
        return found;
    }

    /**
     * 展开单个几何组：细分、复制、变换。
     */
    public Mesh flattenGroup(GeometryGroup geometry, NexusTree tree) {
        Mesh mesh = geometry.shape() instanceof CylindricalMesh cylinders
                ? TubeMeshFactory.tessellate(cylinders, tubePointsPerEnd)
                : (Mesh) geometry.shape();
        NexusGroup owner = tree.group(geometry.owningComponentPath());
        if (owner == null) {
            throw new IllegalStateException("找不到几何组所属的组件：" + geometry.owningComponentPath());
        }
        if (geometry.singlePixelShape()) {
            mesh = replicatePixelShape(mesh,
                    requiredOffsets(owner, "x_pixel_offset", geometry),
                    requiredOffsets(owner, "y_pixel_offset", geometry),
                    optionalOffsets(owner, "z_pixel_offset", owner.dataset("x_pixel_offset").size()));
        }
        NexusDataset dependsOn = owner.dataset(GeometryBuilder.DEPENDS_ON);
        List<TransformNode> chain = collectChain(dependsOn == null ? TransformNode.TERMINAL : dependsOn.text(), tree);
        return new Mesh(applyChain(mesh.vertices(), chain), mesh.faces(), mesh.windingOrder());
    }

    /**
     * 整台仪器展开成一个网格。
     */
    public Mesh flattenInstrument(NexusTree tree) {
        return flattenInstrument(tree, findGeometryGroups(tree));
    }

    /**
     * 按给定的几何组（通常来自 {@link #findGeometryGroups}）展开并合并。
     */
    public Mesh flattenInstrument(NexusTree tree, List<GeometryGroup> groups) {
        List<Mesh> parts = new ArrayList<>(groups.size());
        for (GeometryGroup group : groups) {
            parts.add(flattenGroup(group, tree));
        }
        Mesh merged = concatenate(parts);
        log.info("几何展开完成：{} 个几何组，{} 个顶点，{} 个面", groups.size(), merged.vertexCount(), merged.faceCount());
        return merged;
    }

    /**
     * 依次拼接网格：后一个网格的面下标加上已有 winding 长度，winding 下标加上已有顶点数。
     */
    public static Mesh concatenate(List<Mesh> parts) {
        int vertexTotal = 0;
        int faceTotal = 0;
        int windingTotal = 0;
        for (Mesh part : parts) {
            vertexTotal += part.vertices().length;
            faceTotal += part.faces().length;
            windingTotal += part.windingOrder().length;
        }
        double[] vertices = new double[vertexTotal];
        int[] faces = new int[faceTotal];
        int[] windingOrder = new int[windingTotal];
        int nextVertex = 0;
        int nextFace = 0;
        int nextWinding = 0;
        for (Mesh part : parts) {
            System.arraycopy(part.vertices(), 0, vertices, nextVertex, part.vertices().length);
            for (int face : part.faces()) {
                faces[nextFace++] = face + nextWinding;
            }
            int vertexOffset = nextVertex / 3;
            for (int index : part.windingOrder()) {
                windingOrder[nextWinding++] = index + vertexOffset;
            }
            nextVertex += part.vertices().length;
        }
        return new Mesh(vertices, faces, windingOrder);
    }

    private static Mesh readOff(NexusGroup group) {
        return new Mesh(
                required(group, "vertices").doubles(),
                required(group, "faces").ints(),
                required(group, "winding_order").ints());
    }

    private static CylindricalMesh readCylinders(NexusGroup group) {
        return new CylindricalMesh(required(group, "vertices").doubles(), required(group, "cylinders").ints());
    }

    private static NexusDataset required(NexusGroup group, String name) {
        NexusDataset dataset = group.dataset(name);
        if (dataset == null) {
            throw new IllegalStateException("几何组 " + group.path() + " 缺少数据集 " + name);
        }
        return dataset;
    }

    private static double[] requiredOffsets(NexusGroup owner, String name, GeometryGroup geometry) {
        NexusDataset dataset = owner.dataset(name);
        if (dataset == null) {
            throw new IllegalStateException("像素形状的父组 " + geometry.owningComponentPath() + " 缺少 " + name);
        }
        return dataset.doubles();
    }

    private static double[] optionalOffsets(NexusGroup owner, String name, int size) {
        NexusDataset dataset = owner.dataset(name);
        return dataset == null ? new double[size] : dataset.doubles();
    }
}
