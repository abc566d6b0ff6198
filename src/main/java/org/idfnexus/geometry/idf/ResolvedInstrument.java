package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.List;

/**
 * 一次转换的完整解析结果。
 *
 * @param name           仪器名
 * @param lengthUnits    长度单位（已规范化，例如 {@code m}）
 * @param samplePosition 样品位置（NeXus 坐标，未减原点）
 * @param origin         本次转换使用的原点（NeXus 坐标）；其余位置都已减去它
 * @param source         中子源；IDF 未声明时为 null
 * @param monitors       监视器
 * @param detectors      一般探测器模块（含 RectangularDetector）
 * @param gridDetectors  StructuredDetector 网格探测器
 * @param failures       SKIP 模式下被跳过的组件
 */
public record ResolvedInstrument(
        String name,
        String lengthUnits,
        Vector3D samplePosition,
        Vector3D origin,
        ResolvedSource source,
        List<ResolvedMonitor> monitors,
        List<ResolvedDetector> detectors,
        List<ResolvedGridDetector> gridDetectors,
        List<ResolutionFailure> failures
) {

    public long totalPixels() {
        long total = 0;
        for (ResolvedDetector detector : detectors) {
            total += detector.pixelCount();
        }
        for (ResolvedGridDetector grid : gridDetectors) {
            total += grid.pixelCentres().size();
        }
        return total;
    }
}
