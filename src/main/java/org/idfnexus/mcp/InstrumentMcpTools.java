package org.idfnexus.mcp;

import org.idfnexus.geometry.IdfConversionService;
import org.idfnexus.geometry.WorkspacePathResolver;
import org.idfnexus.geometry.dto.AllowedRootsResult;
import org.idfnexus.geometry.dto.InstrumentDescription;
import org.idfnexus.geometry.dto.NexusConversionResult;
import org.idfnexus.geometry.dto.OffExportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * 仪器几何 MCP 工具集合（基于 Spring AI {@link Tool} 注解）。
 * <p>
 * 提供的能力：
 * <ul>
 *   <li>{@code idf_list_roots}：列出允许访问的根目录白名单。</li>
 *   <li>{@code idf_describe}：解析 IDF（Mantid 仪器描述 XML），返回仪器、探测器模块、监视器概要，不落盘。</li>
 *   <li>{@code idf_to_nexus}：把 IDF 转换为 NeXus 几何树并保存为 JSON。</li>
 *   <li>{@code nexus_to_off}：把 NeXus JSON 中所有几何展开成一个 OFF 网格。</li>
 *   <li>{@code idf_to_off}：IDF 直接导出 OFF（中间 NeXus 树只在内存中）。</li>
 * </ul>
 * <p>
 * 安全策略：
 * <ul>
 *   <li>输入输出路径都必须位于 {@code app.idf.roots} 白名单内，默认禁止符号链接。</li>
 *   <li>IDF 文件大小受 {@code app.idf.max-idf-size} 限制；XML 解析禁用外部实体。</li>
 *   <li>输出文件直接覆盖写入，输出目录不存在时自动创建。</li>
 * </ul>
 */
@Component
public class InstrumentMcpTools {

    private static final Logger log = LoggerFactory.getLogger(InstrumentMcpTools.class);

    private final WorkspacePathResolver pathResolver;
    private final IdfConversionService conversionService;

    public InstrumentMcpTools(WorkspacePathResolver pathResolver, IdfConversionService conversionService) {
        this.pathResolver = pathResolver;
        this.conversionService = conversionService;
    }

    @Tool(
            name = "idf_list_roots",
            description = "列出 MCP Server 允许访问的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "idf_describe",
            description = "解析 Mantid IDF 仪器描述 XML，返回仪器名、长度单位、中子源/样品位置、监视器数、探测器模块摘要（像素数、id 范围、位置）。不写任何文件。"
    )
    public InstrumentDescription describe(
            @ToolParam(required = false, description = "rootId（可从 idf_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IDF 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "最多列出的探测器模块数（默认及上限见 app.idf.describe-max-detectors）") Integer maxDetectors
    ) {
        log.debug("idf_describe rootId={} path={}", rootId, path);
        return conversionService.describe(rootId, path, maxDetectors);
    }

    @Tool(
            name = "idf_to_nexus",
            description = "把 IDF 转换为 NeXus 几何树（NXentry/NXinstrument/NXdetector/NXmonitor/NXsource/NXsample，depends_on 变换链）并保存为 JSON。"
    )
    public NexusConversionResult toNexus(
            @ToolParam(required = false, description = "rootId（可从 idf_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IDF 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "输出的 NeXus JSON 路径（相对同一 root；已存在会被覆盖）") String outputPath
    ) {
        log.debug("idf_to_nexus rootId={} path={} outputPath={}", rootId, path, outputPath);
        return conversionService.convertToNexus(rootId, path, outputPath);
    }

    @Tool(
            name = "nexus_to_off",
            description = "读取 idf_to_nexus 写出的 NeXus JSON，沿 depends_on 链展开所有 NXoff_geometry/NXcylindrical_geometry（pixel_shape 按像素偏移复制），合并为一个 OFF 网格文件。"
    )
    public OffExportResult nexusToOff(
            @ToolParam(required = false, description = "rootId（可从 idf_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "NeXus JSON 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "输出的 OFF 文件路径（相对同一 root；已存在会被覆盖）") String outputPath
    ) {
        log.debug("nexus_to_off rootId={} path={} outputPath={}", rootId, path, outputPath);
        return conversionService.exportOff(rootId, path, outputPath);
    }

    @Tool(
            name = "idf_to_off",
            description = "IDF 直接导出为 OFF 网格（等价于 idf_to_nexus + nexus_to_off，但不写中间 NeXus 文件）。"
    )
    public OffExportResult idfToOff(
            @ToolParam(required = false, description = "rootId（可从 idf_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IDF 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "输出的 OFF 文件路径（相对同一 root；已存在会被覆盖）") String outputPath
    ) {
        log.debug("idf_to_off rootId={} path={} outputPath={}", rootId, path, outputPath);
        return conversionService.convertToOff(rootId, path, outputPath);
    }
}
