package org.idfnexus.geometry.idf;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.coords.AngleUnit;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocationReaderTest {

    private static Element component(String inner) {
        IdfDocument document = IdfDocument.parse(IdfFixtures.instrument("LOC",
                "<component type=\"t\">" + inner + "</component>"));
        return document.components().get(0);
    }

    @Test
    void read_locationsExpandRangedAxisWithNames() {
        List<LocatedPoint> points = LocationReader.read(
                component("<locations x=\"0.0\" x-end=\"1.0\" y=\"2.0\" n-elements=\"3\" name=\"tube\" name-count-start=\"1\"/>"),
                AngleUnit.DEGREE);

        assertThat(points).extracting(LocatedPoint::raw)
                .containsExactly(new Vector3D(0, 2, 0), new Vector3D(0.5, 2, 0), new Vector3D(1, 2, 0));
        assertThat(points).extracting(LocatedPoint::name).containsExactly("tube1", "tube2", "tube3");
        assertThat(points).allMatch(LocatedPoint::ranged);
    }

    @Test
    void read_locationsInterpolateEveryRangedAxis() {
        List<LocatedPoint> points = LocationReader.read(
                component("<locations x=\"0.0\" x-end=\"1.0\" z=\"2.0\" z-end=\"4.0\" n-elements=\"3\"/>"),
                AngleUnit.DEGREE);

        assertThat(points).extracting(LocatedPoint::raw)
                .containsExactly(new Vector3D(0, 0, 2), new Vector3D(0.5, 0, 3), new Vector3D(1, 0, 4));
    }

    @Test
    void read_keepsDocumentOrderWhenMixed() {
        List<LocatedPoint> points = LocationReader.read(
                component("<location x=\"9.0\"/><locations x=\"0.0\" x-end=\"1.0\" n-elements=\"2\"/><location x=\"7.0\"/>"),
                AngleUnit.DEGREE);

        assertThat(points).extracting(p -> p.raw().getX()).containsExactly(9.0, 0.0, 1.0, 7.0);
    }

    @Test
    void read_rejectsNonPositiveCount() {
        assertThatThrownBy(() -> LocationReader.read(component("<locations x=\"0.0\" n-elements=\"0\"/>"), AngleUnit.DEGREE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rawPoint_sphericalUsesAngleUnit() {
        Element location = component("<location r=\"2.0\" t=\"90.0\" p=\"0.0\"/>");

        Vector3D point = LocationReader.rawPoint(IdfDocument.firstChild(location, "location"), AngleUnit.DEGREE);

        assertThat(point.distance(new Vector3D(2, 0, 0))).isLessThan(1e-12);
    }

    @Test
    void hasNoOwnLocation() {
        assertThat(LocationReader.hasNoOwnLocation(component(""))).isTrue();
        assertThat(LocationReader.hasNoOwnLocation(component("<location/>"))).isTrue();
        assertThat(LocationReader.hasNoOwnLocation(component("<location z=\"1.0\"/>"))).isFalse();
        assertThat(LocationReader.hasNoOwnLocation(component("<location/><location/>"))).isFalse();
    }
}
