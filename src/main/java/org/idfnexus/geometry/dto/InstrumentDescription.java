package org.idfnexus.geometry.dto;

import java.util.List;

/**
 * {@code idf_describe} 的返回结果：解析后的仪器概要，不落盘。
 *
 * @param rootId              命中的根目录
 * @param path                IDF 文件（相对 root 的展示路径）
 * @param instrumentName      仪器名
 * @param lengthUnits         长度单位
 * @param sourceName          中子源名字；IDF 未声明时为 null
 * @param sourcePosition      中子源位置（NeXus 坐标，已减原点）；无中子源时为 null
 * @param samplePosition      样品位置（NeXus 坐标，未减原点）
 * @param monitorCount        监视器数
 * @param detectorModuleCount 探测器模块数（含网格探测器）
 * @param totalPixels         像素总数
 * @param detectors           探测器模块摘要（最多 {@code app.idf.describe-max-detectors} 条）
 * @param truncated           detectors 是否被截断
 * @param skipped             SKIP 模式下被跳过的组件
 */
public record InstrumentDescription(
        String rootId,
        String path,
        String instrumentName,
        String lengthUnits,
        String sourceName,
        double[] sourcePosition,
        double[] samplePosition,
        int monitorCount,
        int detectorModuleCount,
        long totalPixels,
        List<DetectorModuleSummary> detectors,
        boolean truncated,
        List<SkippedComponent> skipped
) {
}
