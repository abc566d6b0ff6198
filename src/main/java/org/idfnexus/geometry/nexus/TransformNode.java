package org.idfnexus.geometry.nexus;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * {@code NXtransformations} 中的一个变换（标量数据集 + 属性）。
 *
 * @param name      数据集名
 * @param kind      平移或旋转
 * @param magnitude 平移距离或旋转角
 * @param units     单位（旋转为 {@code degrees}/{@code radians}）
 * @param vector    单位方向（平移方向或旋转轴）
 * @param offset    变换前先施加的平移；没有则为 null
 * @param dependsOn 下一个变换的绝对路径，链尾为 {@link #TERMINAL}
 */
public record TransformNode(
        String name,
        Kind kind,
        double magnitude,
        String units,
        Vector3D vector,
        Vector3D offset,
        String dependsOn
) {

    /**
     * 变换链终止符。
     */
    public static final String TERMINAL = ".";

    public enum Kind {
        TRANSLATION("translation"),
        ROTATION("rotation");

        private final String attributeValue;

        Kind(String attributeValue) {
            this.attributeValue = attributeValue;
        }

        public String attributeValue() {
            return attributeValue;
        }

        public static Kind parse(String value) {
            for (Kind kind : values()) {
                if (kind.attributeValue.equals(value)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("transformation_type 必须是 translation 或 rotation：" + value);
        }
    }

    public boolean isTerminal() {
        return dependsOn == null || TERMINAL.equals(dependsOn);
    }

    public NexusDataset toDataset() {
        NexusDataset dataset = NexusDataset.scalar(name, magnitude);
        dataset.setAttribute("units", units);
        dataset.setAttribute("vector", vector.toArray());
        dataset.setAttribute("transformation_type", kind.attributeValue());
        dataset.setAttribute("depends_on", dependsOn == null ? TERMINAL : dependsOn);
        if (offset != null) {
            dataset.setAttribute("offset", offset.toArray());
        }
        return dataset;
    }

    /**
     * 从变换数据集读取；缺少 {@code depends_on} 属性视为链尾。
     */
    public static TransformNode fromDataset(NexusDataset dataset) {
        double[] vector = dataset.vectorAttribute("vector");
        if (vector == null || vector.length != 3) {
            throw new IllegalArgumentException("变换缺少三维 vector 属性：" + dataset.path());
        }
        double[] offset = dataset.vectorAttribute("offset");
        String dependsOn = dataset.stringAttribute("depends_on");
        return new TransformNode(
                dataset.name(),
                Kind.parse(dataset.stringAttribute("transformation_type")),
                dataset.scalarDouble(),
                dataset.stringAttribute("units"),
                new Vector3D(vector),
                offset == null ? null : new Vector3D(offset),
                dependsOn == null ? TERMINAL : dependsOn);
    }
}
