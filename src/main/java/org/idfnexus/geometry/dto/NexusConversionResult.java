package org.idfnexus.geometry.dto;

import java.util.List;

/**
 * {@code idf_to_nexus} 的返回结果。
 *
 * @param rootId         命中的根目录
 * @param idfPath        输入 IDF（展示路径）
 * @param nexusPath      写出的 NeXus JSON（展示路径）
 * @param instrumentName 仪器名
 * @param detectorGroups 写出的 NXdetector 组数
 * @param monitorCount   写出的 NXmonitor 组数
 * @param totalPixels    像素总数
 * @param bytesWritten   写出的字节数
 * @param skipped        SKIP 模式下被跳过的组件
 */
public record NexusConversionResult(
        String rootId,
        String idfPath,
        String nexusPath,
        String instrumentName,
        int detectorGroups,
        int monitorCount,
        long totalPixels,
        long bytesWritten,
        List<SkippedComponent> skipped
) {
}
