package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.GeometryMath;
import org.idfnexus.geometry.coords.CoordinateNormalizer;
import org.idfnexus.geometry.error.UnknownPixelShapeException;
import org.w3c.dom.Element;

import java.util.List;

/**
 * 从 detector/monitor 类型中读取几何图元（cuboid 或 cylinder）。
 */
final class PixelShapeReader {

    private static final List<String> SUPPORTED = List.of("cuboid", "cylinder");

    private PixelShapeReader() {
    }

    /**
     * 读取像素形状；类型上必须恰好有一个受支持的图元。
     *
     * @throws UnknownPixelShapeException 没有图元，或图元多于一个
     */
    static PixelShape read(Element type, CoordinateNormalizer normalizer) {
        String typeName = IdfDocument.attribute(type, "name");
        Element primitive = singlePrimitive(type, typeName);
        if (primitive == null) {
            throw new UnknownPixelShapeException("像素类型上没有可识别的几何图元（仅支持 cuboid/cylinder）", typeName);
        }
        return "cuboid".equals(primitive.getLocalName())
                ? readCuboid(primitive, normalizer, typeName)
                : readCylinder(primitive, normalizer, typeName);
    }

    /**
     * 监视器的形状是可选的：没有图元时返回 null。
     */
    static PixelShape readOptional(Element type, CoordinateNormalizer normalizer) {
        String typeName = IdfDocument.attribute(type, "name");
        if (singlePrimitive(type, typeName) == null) {
            return null;
        }
        return read(type, normalizer);
    }

    private static Element singlePrimitive(Element type, String typeName) {
        Element found = null;
        for (String kind : SUPPORTED) {
            for (Element element : IdfDocument.children(type, kind)) {
                if (found != null) {
                    throw new UnknownPixelShapeException("像素类型上声明了多个几何图元，无法确定像素形状", typeName);
                }
                found = element;
            }
        }
        return found;
    }

    private static PixelShape.Cuboid readCuboid(Element cuboid, CoordinateNormalizer normalizer, String typeName) {
        Element leftFrontBottom = IdfDocument.firstChild(cuboid, "left-front-bottom-point");
        if (leftFrontBottom != null) {
            Vector3D origin = point(cuboid, "left-front-bottom-point", normalizer, typeName);
            // x：左→右，y：前→后，厚度：下→上
            double xSize = point(cuboid, "right-front-bottom-point", normalizer, typeName).distance(origin);
            double ySize = point(cuboid, "left-back-bottom-point", normalizer, typeName).distance(origin);
            double thickness = point(cuboid, "left-front-top-point", normalizer, typeName).distance(origin);
            return new PixelShape.Cuboid(xSize, ySize, thickness);
        }
        Element width = IdfDocument.firstChild(cuboid, "width");
        Element height = IdfDocument.firstChild(cuboid, "height");
        Element depth = IdfDocument.firstChild(cuboid, "depth");
        if (width == null || height == null || depth == null) {
            throw new UnknownPixelShapeException("cuboid 既没有角点也没有 width/height/depth", typeName);
        }
        return new PixelShape.Cuboid(
                IdfDocument.doubleAttribute(width, "val", 0.0),
                IdfDocument.doubleAttribute(depth, "val", 0.0),
                IdfDocument.doubleAttribute(height, "val", 0.0));
    }

    private static PixelShape.Cylinder readCylinder(Element cylinder, CoordinateNormalizer normalizer, String typeName) {
        Element axisElement = required(cylinder, "axis", typeName);
        Element radius = required(cylinder, "radius", typeName);
        Element height = required(cylinder, "height", typeName);
        Vector3D base = normalizer.toNexusFrame(
                LocationReader.rawPoint(required(cylinder, "centre-of-bottom-base", typeName), normalizer.angleUnit()),
                false);
        Vector3D axis = normalizer.toNexusDirection(LocationReader.rawPoint(axisElement, normalizer.angleUnit()));
        GeometryMath.Normalised unitAxis = GeometryMath.normalise(axis);
        if (unitAxis.magnitude() == 0.0) {
            throw new UnknownPixelShapeException("cylinder 的 axis 不能为零向量", typeName);
        }
        return new PixelShape.Cylinder(
                unitAxis.unit(),
                IdfDocument.doubleAttribute(radius, "val", 0.0),
                IdfDocument.doubleAttribute(height, "val", 0.0),
                base);
    }

    private static Vector3D point(Element parent, String name, CoordinateNormalizer normalizer, String typeName) {
        return normalizer.toNexusFrame(LocationReader.rawPoint(required(parent, name, typeName), normalizer.angleUnit()), false);
    }

    private static Element required(Element parent, String name, String typeName) {
        Element element = IdfDocument.firstChild(parent, name);
        if (element == null) {
            throw new UnknownPixelShapeException(parent.getLocalName() + " 缺少 <" + name + ">", typeName);
        }
        return element;
    }
}
