package org.idfnexus.geometry.coords;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.error.UnsupportedReferenceFrameException;

import java.util.Locale;
import java.util.Map;

/**
 * IDF 坐标 → NeXus 规范坐标（束流 +z、向上 +y、右手系）的转换。
 * <p>
 * 提供：
 * <ul>
 *   <li>球坐标/笛卡尔坐标互转、角度单位换算；</li>
 *   <li>按 {@link AxisConvention} 对分量做置换和变号；顶层组件额外减去配置的原点（通常为样品位置）；</li>
 *   <li>由 along-beam / pointing-up / handedness 推导 {@link AxisConvention}。</li>
 * </ul>
 * <p>
 * 实例不可变：原点、轴约定、单位都在构造时确定，之后所有方法都是纯函数。
 */
public final class CoordinateNormalizer {

    /**
     * 右手系叉乘表：key 为 "up+beam" 两个轴字母，value 为 {@code up × beam} 得到的第三轴（带符号）。
     * <p>
     * NeXus 中 x = y × z，因此 IDF 中 {@code up × beam} 的方向就是 NeXus x 方向。
     */
    private static final Map<String, String> RIGHT_HAND_CROSS = Map.of(
            "yz", "+x",
            "zy", "-x",
            "zx", "+y",
            "xz", "-y",
            "xy", "+z",
            "yx", "-z"
    );

    private final AxisConvention convention;
    private final AngleUnit angleUnit;
    private final String lengthUnits;
    private final Vector3D origin;

    public CoordinateNormalizer(AxisConvention convention, AngleUnit angleUnit, String lengthUnits, Vector3D origin) {
        this.convention = convention == null ? AxisConvention.IDENTITY : convention;
        this.angleUnit = angleUnit == null ? AngleUnit.DEGREE : angleUnit;
        this.lengthUnits = normaliseLengthUnits(lengthUnits);
        this.origin = origin == null ? Vector3D.ZERO : origin;
    }

    public static CoordinateNormalizer defaults() {
        return new CoordinateNormalizer(AxisConvention.IDENTITY, AngleUnit.DEGREE, "m", Vector3D.ZERO);
    }

    /**
     * 返回一个仅原点不同的新实例（原点使用 NeXus 坐标）。
     */
    public CoordinateNormalizer withOrigin(Vector3D nexusOrigin) {
        return new CoordinateNormalizer(convention, angleUnit, lengthUnits, nexusOrigin);
    }

    public AxisConvention convention() {
        return convention;
    }

    public AngleUnit angleUnit() {
        return angleUnit;
    }

    public String lengthUnits() {
        return lengthUnits;
    }

    public Vector3D origin() {
        return origin;
    }

    /**
     * IDF 点 → NeXus 点。{@code isTopLevel=true} 时额外减去原点。
     */
    public Vector3D toNexusFrame(Vector3D raw, boolean isTopLevel) {
        Vector3D converted = convention.isIdentity() ? raw : convention.toNexus(raw);
        return isTopLevel ? converted.subtract(origin) : converted;
    }

    /**
     * 方向向量（旋转轴等）只做置换/变号，不涉及原点。
     */
    public Vector3D toNexusDirection(Vector3D raw) {
        return convention.isIdentity() ? raw : convention.toNexus(raw);
    }

    /**
     * {@link #toNexusFrame} 的逆变换。
     */
    public Vector3D fromNexusFrame(Vector3D nexus, boolean isTopLevel) {
        Vector3D shifted = isTopLevel ? nexus.add(origin) : nexus;
        return convention.isIdentity() ? shifted : convention.fromNexus(shifted);
    }

    public double toDegrees(double angle) {
        return angleUnit.toDegrees(angle);
    }

    public Vector3D sphericalToCartesian(double r, double theta, double phi) {
        return sphericalToCartesian(r, theta, phi, angleUnit);
    }

    public static Vector3D sphericalToCartesian(double r, double theta, double phi, AngleUnit unit) {
        double t = unit.toRadians(theta);
        double p = unit.toRadians(phi);
        return new Vector3D(
                r * Math.sin(t) * Math.cos(p),
                r * Math.sin(t) * Math.sin(p),
                r * Math.cos(t)
        );
    }

    public static SphericalCoordinates cartesianToSpherical(Vector3D point) {
        double r = point.getNorm();
        if (r == 0.0) {
            return new SphericalCoordinates(0.0, 0.0, 0.0);
        }
        double theta = Math.toDegrees(Math.acos(point.getZ() / r));
        double phi = Math.toDegrees(Math.atan2(point.getY(), point.getX()));
        return new SphericalCoordinates(r, theta, phi);
    }

    public static AxisConvention deriveAxisConvention(String alongBeam, String pointingUp, Handedness handedness) {
        return deriveAxisConvention(alongBeam, pointingUp, handedness, "z");
    }

    /**
     * 推导 IDF → NeXus 的轴约定。
     *
     * @param alongBeam          束流方向轴（如 {@code z}、{@code -x}）
     * @param pointingUp         向上轴（如 {@code y}）
     * @param handedness         手性
     * @param sphericalPolarAxis 球坐标极轴（只支持 z；为空视为 z）
     * @throws UnsupportedReferenceFrameException 极轴不是 z，或 beam/up 为同一轴
     */
    public static AxisConvention deriveAxisConvention(String alongBeam, String pointingUp, Handedness handedness,
                                                      String sphericalPolarAxis) {
        SignedAxis polar = SignedAxis.parse(sphericalPolarAxis == null ? "z" : sphericalPolarAxis);
        if (polar.letter() != 'z') {
            throw new UnsupportedReferenceFrameException("球坐标极轴不是 z 轴（" + sphericalPolarAxis + "），暂不支持该参考系");
        }
        SignedAxis beam = SignedAxis.parse(alongBeam == null ? "z" : alongBeam);
        SignedAxis up = SignedAxis.parse(pointingUp == null ? "y" : pointingUp);
        if (beam.letter() == up.letter()) {
            throw new UnsupportedReferenceFrameException("along-beam 与 pointing-up 不能是同一个轴：" + alongBeam);
        }

        SignedAxis derived = SignedAxis.parse(RIGHT_HAND_CROSS.get("" + up.letter() + beam.letter()));
        int signX = derived.sign();
        // beam/up 符号不一致时叉乘方向翻转
        if (beam.sign() != up.sign()) {
            signX = -signX;
        }
        // 左手系中叉乘方向再翻转一次
        Handedness resolved = handedness == null ? Handedness.RIGHT : handedness;
        if (resolved == Handedness.LEFT) {
            signX = -signX;
        }
        return new AxisConvention(derived.letter(), up.letter(), beam.letter(), signX, up.sign(), beam.sign(), resolved);
    }

    /**
     * 长度单位规范化（meter → m 等）；无法识别的单位原样返回。
     */
    public static String normaliseLengthUnits(String units) {
        if (units == null || units.isBlank()) {
            return "m";
        }
        return switch (units.trim().toLowerCase(Locale.ROOT)) {
            case "meter", "metre", "meters", "metres", "m" -> "m";
            case "millimeter", "millimetre", "millimeters", "millimetres", "mm" -> "mm";
            case "centimeter", "centimetre", "cm" -> "cm";
            default -> units.trim();
        };
    }

    private record SignedAxis(char letter, int sign) {

        static SignedAxis parse(String value) {
            String text = value.trim().toLowerCase(Locale.ROOT);
            int sign = 1;
            if (text.startsWith("-")) {
                sign = -1;
                text = text.substring(1);
            } else if (text.startsWith("+")) {
                text = text.substring(1);
            }
            if (text.length() != 1 || "xyz".indexOf(text.charAt(0)) < 0) {
                throw new UnsupportedReferenceFrameException("无法识别的坐标轴声明：" + value);
            }
            return new SignedAxis(text.charAt(0), sign);
        }
    }
}
