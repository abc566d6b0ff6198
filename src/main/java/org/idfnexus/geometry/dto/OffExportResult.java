package org.idfnexus.geometry.dto;

import java.util.List;

/**
 * {@code nexus_to_off} / {@code idf_to_off} 的返回结果。
 *
 * @param rootId         命中的根目录
 * @param inputPath      输入文件（NeXus JSON 或 IDF，展示路径）
 * @param offPath        写出的 OFF 文件（展示路径）
 * @param geometryGroups 参与展开的几何组数
 * @param vertexCount    顶点数
 * @param faceCount      面数
 * @param skipped        SKIP 模式下被跳过的组件（从 NeXus 导出时为空）
 */
public record OffExportResult(
        String rootId,
        String inputPath,
        String offPath,
        int geometryGroups,
        int vertexCount,
        int faceCount,
        List<SkippedComponent> skipped
) {
}
