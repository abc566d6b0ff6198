package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.List;

/**
 * 解析完成的探测器模块（一个顶层组件）。
 * <p>
 * 约束：{@code offsets.size() == idList.size()}，按位置一一对应。
 *
 * @param name                  组件名称
 * @param subComponentTypeChain 从顶层类型到像素类型途经的类型名（用于识别可共享的像素几何）
 * @param pixelTypeName         像素类型名
 * @param pixel                 像素形状
 * @param offsets               每个像素相对模块位置的偏移（NeXus 坐标）
 * @param idList                像素 id，与 offsets 一一对应
 * @param location              模块位置（NeXus 坐标，已相对原点）
 * @param orientation           模块朝向；没有则为 null
 */
public record ResolvedDetector(
        String name,
        List<String> subComponentTypeChain,
        String pixelTypeName,
        PixelShape pixel,
        List<Vector3D> offsets,
        List<Integer> idList,
        Vector3D location,
        Orientation orientation
) {

    public ResolvedDetector {
        if (offsets.size() != idList.size()) {
            throw new IllegalArgumentException("像素偏移数量（" + offsets.size() + "）与 id 数量（"
                    + idList.size() + "）不一致：" + name);
        }
        subComponentTypeChain = List.copyOf(subComponentTypeChain);
        offsets = List.copyOf(offsets);
        idList = List.copyOf(idList);
    }

    public int pixelCount() {
        return offsets.size();
    }
}
