package org.idfnexus.geometry.coords;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.error.UnsupportedReferenceFrameException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CoordinateNormalizerTest {

    private static final String[][] BEAM_UP_PAIRS = {
            {"z", "y"}, {"z", "x"}, {"y", "z"}, {"y", "x"}, {"x", "y"}, {"x", "z"}
    };

    @Test
    void toNexusAndBack_roundTripsForEveryAxisPermutationAndHandedness() {
        Vector3D raw = new Vector3D(1.5, -2.25, 3.75);
        Vector3D origin = new Vector3D(0.1, 0.2, 0.3);
        for (String[] pair : BEAM_UP_PAIRS) {
            for (Handedness handedness : Handedness.values()) {
                AxisConvention convention = CoordinateNormalizer.deriveAxisConvention(pair[0], pair[1], handedness);
                CoordinateNormalizer normalizer = new CoordinateNormalizer(convention, AngleUnit.DEGREE, "metre", origin);

                Vector3D back = normalizer.fromNexusFrame(normalizer.toNexusFrame(raw, true), true);

                assertThat(back.distance(raw)).as("beam=%s up=%s %s", pair[0], pair[1], handedness).isLessThan(1e-12);
            }
        }
    }

    @Test
    void toNexusDirection_mapsUnitVectorsIntoRightHandedFrame() {
        String[][] pairs = {
                {"z", "y"}, {"z", "x"}, {"y", "z"}, {"y", "x"}, {"x", "y"}, {"x", "z"},
                {"-z", "y"}, {"z", "-y"}, {"-x", "-y"}, {"y", "-z"}
        };
        for (String[] pair : pairs) {
            Vector3D beam = unit(pair[0]);
            Vector3D up = unit(pair[1]);
            CoordinateNormalizer right = new CoordinateNormalizer(
                    CoordinateNormalizer.deriveAxisConvention(pair[0], pair[1], Handedness.RIGHT),
                    AngleUnit.DEGREE, "m", Vector3D.ZERO);
            CoordinateNormalizer left = new CoordinateNormalizer(
                    CoordinateNormalizer.deriveAxisConvention(pair[0], pair[1], Handedness.LEFT),
                    AngleUnit.DEGREE, "m", Vector3D.ZERO);

            assertThat(right.toNexusDirection(beam)).as("beam=%s up=%s", pair[0], pair[1]).isEqualTo(Vector3D.PLUS_K);
            assertThat(right.toNexusDirection(up)).as("beam=%s up=%s", pair[0], pair[1]).isEqualTo(Vector3D.PLUS_J);
            // NeXus x = y × z
            assertThat(right.toNexusDirection(up.crossProduct(beam))).as("beam=%s up=%s", pair[0], pair[1])
                    .isEqualTo(Vector3D.PLUS_I);
            Vector3D x = right.toNexusDirection(Vector3D.PLUS_I);
            Vector3D y = right.toNexusDirection(Vector3D.PLUS_J);
            Vector3D z = right.toNexusDirection(Vector3D.PLUS_K);
            assertThat(x.crossProduct(y)).as("beam=%s up=%s", pair[0], pair[1]).isEqualTo(z);
            assertThat(left.toNexusDirection(up.crossProduct(beam))).as("beam=%s up=%s", pair[0], pair[1])
                    .isEqualTo(Vector3D.MINUS_I);
        }
    }

    private static Vector3D unit(String axis) {
        double sign = axis.startsWith("-") ? -1.0 : 1.0;
        return switch (axis.charAt(axis.length() - 1)) {
            case 'x' -> new Vector3D(sign, 0, 0);
            case 'y' -> new Vector3D(0, sign, 0);
            default -> new Vector3D(0, 0, sign);
        };
    }

    @Test
    void deriveAxisConvention_defaultFrameIsIdentity() {
        AxisConvention convention = CoordinateNormalizer.deriveAxisConvention("z", "y", Handedness.RIGHT);

        assertThat(convention.isIdentity()).isTrue();
    }

    @Test
    void deriveAxisConvention_beamAlongXUpAlongZ() {
        AxisConvention convention = CoordinateNormalizer.deriveAxisConvention("x", "z", Handedness.RIGHT);
        CoordinateNormalizer normalizer = new CoordinateNormalizer(convention, AngleUnit.DEGREE, "m", Vector3D.ZERO);

        // 束流方向映射到 NeXus +z，向上映射到 +y
        assertThat(normalizer.toNexusDirection(Vector3D.PLUS_I)).isEqualTo(Vector3D.PLUS_K);
        assertThat(normalizer.toNexusDirection(Vector3D.PLUS_K)).isEqualTo(Vector3D.PLUS_J);
        assertThat(normalizer.toNexusDirection(Vector3D.PLUS_J)).isEqualTo(Vector3D.PLUS_I);
    }

    @Test
    void deriveAxisConvention_leftHandedFlipsX() {
        AxisConvention right = CoordinateNormalizer.deriveAxisConvention("z", "y", Handedness.RIGHT);
        AxisConvention left = CoordinateNormalizer.deriveAxisConvention("z", "y", Handedness.LEFT);

        assertThat(left.signX()).isEqualTo(-right.signX());
        assertThat(left.handedness()).isEqualTo(Handedness.LEFT);
    }

    @Test
    void deriveAxisConvention_negativeBeam() {
        AxisConvention convention = CoordinateNormalizer.deriveAxisConvention("-z", "y", Handedness.RIGHT);
        CoordinateNormalizer normalizer = new CoordinateNormalizer(convention, AngleUnit.DEGREE, "m", Vector3D.ZERO);

        assertThat(normalizer.toNexusDirection(Vector3D.MINUS_K)).isEqualTo(Vector3D.PLUS_K);
        assertThat(normalizer.toNexusDirection(Vector3D.PLUS_J)).isEqualTo(Vector3D.PLUS_J);
    }

    @Test
    void deriveAxisConvention_rejectsNonZPolarAxisAndSameAxis() {
        assertThatThrownBy(() -> CoordinateNormalizer.deriveAxisConvention("x", "y", Handedness.RIGHT, "x"))
                .isInstanceOf(UnsupportedReferenceFrameException.class);
        assertThatThrownBy(() -> CoordinateNormalizer.deriveAxisConvention("y", "y", Handedness.RIGHT))
                .isInstanceOf(UnsupportedReferenceFrameException.class);
        assertThatThrownBy(() -> CoordinateNormalizer.deriveAxisConvention("w", "y", Handedness.RIGHT))
                .isInstanceOf(UnsupportedReferenceFrameException.class);
    }

    @Test
    void toNexusFrame_subtractsOriginOnlyForTopLevel() {
        CoordinateNormalizer normalizer = CoordinateNormalizer.defaults().withOrigin(new Vector3D(0, 0, 1));
        Vector3D raw = new Vector3D(1, 2, 3);

        assertThat(normalizer.toNexusFrame(raw, true)).isEqualTo(new Vector3D(1, 2, 2));
        assertThat(normalizer.toNexusFrame(raw, false)).isEqualTo(raw);
    }

    @Test
    void sphericalToCartesian_andBack() {
        Vector3D p = CoordinateNormalizer.sphericalToCartesian(2.0, 90.0, 90.0, AngleUnit.DEGREE);

        assertThat(p.distance(new Vector3D(0, 2, 0))).isLessThan(1e-12);

        SphericalCoordinates s = CoordinateNormalizer.cartesianToSpherical(p);
        assertThat(s.r()).isCloseTo(2.0, within(1e-12));
        assertThat(s.thetaDegrees()).isCloseTo(90.0, within(1e-9));
        assertThat(s.phiDegrees()).isCloseTo(90.0, within(1e-9));
    }

    @Test
    void sphericalToCartesian_radians() {
        Vector3D p = CoordinateNormalizer.sphericalToCartesian(1.0, Math.PI / 2, 0.0, AngleUnit.RADIAN);

        assertThat(p.distance(Vector3D.PLUS_I)).isLessThan(1e-12);
    }

    @Test
    void normaliseLengthUnits_mapsCommonSpellings() {
        assertThat(CoordinateNormalizer.normaliseLengthUnits("metre")).isEqualTo("m");
        assertThat(CoordinateNormalizer.normaliseLengthUnits(null)).isEqualTo("m");
        assertThat(CoordinateNormalizer.normaliseLengthUnits("Millimetre")).isEqualTo("mm");
        assertThat(CoordinateNormalizer.normaliseLengthUnits("furlong")).isEqualTo("furlong");
    }

    @Test
    void angleUnit_parse() {
        assertThat(AngleUnit.parse("radian")).isEqualTo(AngleUnit.RADIAN);
        assertThat(AngleUnit.parse(null)).isEqualTo(AngleUnit.DEGREE);
        assertThat(AngleUnit.RADIAN.toDegrees(Math.PI)).isCloseTo(180.0, within(1e-12));
    }
}
