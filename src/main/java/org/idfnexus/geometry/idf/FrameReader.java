package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.coords.AngleUnit;
import org.idfnexus.geometry.coords.AxisConvention;
import org.idfnexus.geometry.coords.CoordinateNormalizer;
import org.idfnexus.geometry.coords.Handedness;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * 从 {@code <defaults>} 读取长度/角度单位与参考系，构造 {@link CoordinateNormalizer}（原点为零）。
 */
final class FrameReader {

    private FrameReader() {
    }

    static CoordinateNormalizer read(IdfDocument document) {
        Element defaults = document.defaults();
        String lengthUnits = IdfDocument.attribute(IdfDocument.firstChild(defaults, "length"), "unit");
        AngleUnit angleUnit = AngleUnit.parse(IdfDocument.attribute(IdfDocument.firstChild(defaults, "angle"), "unit"));

        Element frame = IdfDocument.firstChild(defaults, "reference-frame");
        String alongBeam = IdfDocument.attribute(IdfDocument.firstChild(frame, "along-beam"), "axis");
        String pointingUp = IdfDocument.attribute(IdfDocument.firstChild(frame, "pointing-up"), "axis");
        Handedness handedness = Handedness.parse(IdfDocument.attribute(IdfDocument.firstChild(frame, "handedness"), "val"));

        // 球坐标的极轴沿束流方向，只有文档里真的用了 r/t/p 才需要校验
        String polarAxis = usesSphericalCoordinates(document) && alongBeam != null ? alongBeam.replace("-", "") : null;
        AxisConvention convention = CoordinateNormalizer.deriveAxisConvention(alongBeam, pointingUp, handedness, polarAxis);
        return new CoordinateNormalizer(convention, angleUnit, lengthUnits, Vector3D.ZERO);
    }

    /**
     * instrument 级 {@code <components-are-facing>}；没有则为 null。
     */
    static Element defaultFacing(IdfDocument document) {
        return IdfDocument.firstChild(document.defaults(), "components-are-facing");
    }

    static boolean usesSphericalCoordinates(IdfDocument document) {
        NodeList all = document.root().getElementsByTagNameNS(IdfDocument.NAMESPACE, "*");
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            String name = element.getLocalName();
            if (("location".equals(name) || "locations".equals(name) || "facing".equals(name))
                    && LocationReader.isSpherical(element)) {
                return true;
            }
        }
        return false;
    }
}
