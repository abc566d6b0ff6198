package org.idfnexus.geometry;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.dto.DetectorModuleSummary;
import org.idfnexus.geometry.dto.InstrumentDescription;
import org.idfnexus.geometry.dto.NexusConversionResult;
import org.idfnexus.geometry.dto.OffExportResult;
import org.idfnexus.geometry.dto.SkippedComponent;
import org.idfnexus.geometry.idf.HierarchyResolver;
import org.idfnexus.geometry.idf.IdfDocument;
import org.idfnexus.geometry.idf.ResolutionFailure;
import org.idfnexus.geometry.idf.ResolvedDetector;
import org.idfnexus.geometry.idf.ResolvedGridDetector;
import org.idfnexus.geometry.idf.ResolvedInstrument;
import org.idfnexus.geometry.mesh.GeometryGroup;
import org.idfnexus.geometry.mesh.Mesh;
import org.idfnexus.geometry.mesh.OffFormat;
import org.idfnexus.geometry.mesh.TransformChainFlattener;
import org.idfnexus.geometry.nexus.GeometryBuilder;
import org.idfnexus.geometry.nexus.NexusGroup;
import org.idfnexus.geometry.nexus.NexusJsonStore;
import org.idfnexus.geometry.nexus.NexusTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 转换流程编排：IDF 读取 → 层级解析 → NeXus 树构建 → JSON 落盘 / 几何展开 → OFF 落盘。
 * <p>
 * 路径全部经 {@link WorkspacePathResolver} 校验；核心组件都是无状态的，本类可被多个工具调用并发使用。
 */
public class IdfConversionService {

    private static final Logger log = LoggerFactory.getLogger(IdfConversionService.class);

    private final IdfConverterProperties properties;
    private final WorkspacePathResolver pathResolver;
    private final HierarchyResolver hierarchyResolver;
    private final GeometryBuilder geometryBuilder;
    private final TransformChainFlattener flattener;
    private final NexusJsonStore nexusStore;

    public IdfConversionService(IdfConverterProperties properties,
                                WorkspacePathResolver pathResolver,
                                HierarchyResolver hierarchyResolver,
                                GeometryBuilder geometryBuilder,
                                TransformChainFlattener flattener,
                                NexusJsonStore nexusStore) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.hierarchyResolver = hierarchyResolver;
        this.geometryBuilder = geometryBuilder;
        this.flattener = flattener;
        this.nexusStore = nexusStore;
    }

    public InstrumentDescription describe(String rootId, String idfPath, Integer maxDetectors) {
        WorkspacePathResolver.ResolvedPath input = pathResolver.resolveInput(rootId, idfPath);
        ResolvedInstrument instrument = hierarchyResolver.resolveInstrument(loadIdf(input));

        int limit = maxDetectors == null || maxDetectors <= 0
                ? properties.getDescribeMaxDetectors()
                : Math.min(maxDetectors, properties.getDescribeMaxDetectors());
        List<DetectorModuleSummary> summaries = new ArrayList<>(Math.min(limit, 64));
        int moduleCount = instrument.detectors().size() + instrument.gridDetectors().size();
        for (ResolvedDetector detector : instrument.detectors()) {
            if (summaries.size() >= limit) {
                break;
            }
            summaries.add(new DetectorModuleSummary(detector.name(), "module", detector.pixelTypeName(),
                    detector.pixelCount(), first(detector.idList()), last(detector.idList()),
                    toArray(detector.location())));
        }
        for (ResolvedGridDetector grid : instrument.gridDetectors()) {
            if (summaries.size() >= limit) {
                break;
            }
            summaries.add(new DetectorModuleSummary(grid.name(), "grid", grid.typeName(),
                    grid.pixelCentres().size(), first(grid.idList()), last(grid.idList()),
                    toArray(grid.location())));
        }

        return new InstrumentDescription(
                input.rootId(),
                input.displayPath(),
                instrument.name(),
                instrument.lengthUnits(),
                instrument.source() == null ? null : instrument.source().name(),
                instrument.source() == null ? null : toArray(instrument.source().location()),
                toArray(instrument.samplePosition()),
                instrument.monitors().size(),
                moduleCount,
                instrument.totalPixels(),
                summaries,
                moduleCount > summaries.size(),
                skipped(instrument.failures())
        );
    }

    public NexusConversionResult convertToNexus(String rootId, String idfPath, String outputPath) {
        WorkspacePathResolver.ResolvedPath input = pathResolver.resolveInput(rootId, idfPath);
        WorkspacePathResolver.ResolvedPath output = pathResolver.resolveOutput(input.rootId(), outputPath);

        ResolvedInstrument instrument = hierarchyResolver.resolveInstrument(loadIdf(input));
        NexusTree tree = geometryBuilder.build(instrument);
        long bytes;
        try {
            nexusStore.write(tree, output.absolutePath());
            bytes = Files.size(output.absolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("写出 NeXus 文件失败：" + output.displayPath(), e);
        }
        log.info("IDF 转换为 NeXus：{} -> {}（{} 字节）", input.displayPath(), output.displayPath(), bytes);

        NexusGroup nxInstrument = instrumentGroup(tree);
        return new NexusConversionResult(
                input.rootId(),
                input.displayPath(),
                output.displayPath(),
                instrument.name(),
                nxInstrument == null ? 0 : nxInstrument.groupsOfClass("NXdetector").size(),
                nxInstrument == null ? 0 : nxInstrument.groupsOfClass("NXmonitor").size(),
                instrument.totalPixels(),
                bytes,
                skipped(instrument.failures())
        );
    }

    public OffExportResult exportOff(String rootId, String nexusPath, String outputPath) {
        WorkspacePathResolver.ResolvedPath input = pathResolver.resolveInput(rootId, nexusPath);
        WorkspacePathResolver.ResolvedPath output = pathResolver.resolveOutput(input.rootId(), outputPath);
        NexusTree tree;
        try {
            tree = nexusStore.read(input.absolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("读取 NeXus 文件失败：" + input.displayPath(), e);
        }
        return writeOff(tree, input, output, List.of());
    }

    public OffExportResult convertToOff(String rootId, String idfPath, String outputPath) {
        WorkspacePathResolver.ResolvedPath input = pathResolver.resolveInput(rootId, idfPath);
        WorkspacePathResolver.ResolvedPath output = pathResolver.resolveOutput(input.rootId(), outputPath);
        ResolvedInstrument instrument = hierarchyResolver.resolveInstrument(loadIdf(input));
        NexusTree tree = geometryBuilder.build(instrument);
        return writeOff(tree, input, output, skipped(instrument.failures()));
    }

    private OffExportResult writeOff(NexusTree tree,
                                     WorkspacePathResolver.ResolvedPath input,
                                     WorkspacePathResolver.ResolvedPath output,
                                     List<SkippedComponent> skipped) {
        List<GeometryGroup> groups = flattener.findGeometryGroups(tree);
        Mesh mesh = flattener.flattenInstrument(tree, groups);
        try {
            OffFormat.write(mesh, output.absolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("写出 OFF 文件失败：" + output.displayPath(), e);
        }
        log.info("导出 OFF：{} -> {}（{} 个顶点，{} 个面）",
                input.displayPath(), output.displayPath(), mesh.vertexCount(), mesh.faceCount());
        return new OffExportResult(input.rootId(), input.displayPath(), output.displayPath(),
                groups.size(), mesh.vertexCount(), mesh.faceCount(), skipped);
    }

    private IdfDocument loadIdf(WorkspacePathResolver.ResolvedPath input) {
        Path file = input.absolutePath();
        long maxBytes = properties.getMaxIdfSize().toBytes();
        try {
            long size = Files.size(file);
            if (size > maxBytes) {
                throw new IllegalArgumentException("IDF 文件过大：" + size + " 字节，上限 " + maxBytes
                        + " 字节（app.idf.max-idf-size）");
            }
            try (InputStream in = Files.newInputStream(file)) {
                return IdfDocument.parse(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("读取 IDF 文件失败：" + input.displayPath(), e);
        }
    }

    private NexusGroup instrumentGroup(NexusTree tree) {
        return tree.group("/" + properties.getEntryName() + "/instrument");
    }

    private static List<SkippedComponent> skipped(List<ResolutionFailure> failures) {
        List<SkippedComponent> result = new ArrayList<>(failures.size());
        for (ResolutionFailure failure : failures) {
            result.add(new SkippedComponent(failure.componentName(), failure.errorType(), failure.reason()));
        }
        return result;
    }

    private static Integer first(List<Integer> ids) {
        return ids.isEmpty() ? null : ids.get(0);
    }

    private static Integer last(List<Integer> ids) {
        return ids.isEmpty() ? null : ids.get(ids.size() - 1);
    }

    private static double[] toArray(Vector3D v) {
        return new double[]{v.getX(), v.getY(), v.getZ()};
    }
}
