package org.idfnexus.geometry.nexus;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.idfnexus.geometry.idf.HierarchyResolver;
import org.idfnexus.geometry.idf.IdfDocument;
import org.idfnexus.geometry.idf.IdfFixtures;
import org.idfnexus.geometry.idf.Orientation;
import org.idfnexus.geometry.idf.PixelShape;
import org.idfnexus.geometry.idf.ResolvedDetector;
import org.idfnexus.geometry.idf.ResolvedGridDetector;
import org.idfnexus.geometry.idf.ResolvedInstrument;
import org.idfnexus.geometry.idf.ResolvedMonitor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeometryBuilderTest {

    private static final PixelShape.Cylinder TUBE_PIXEL =
            new PixelShape.Cylinder(Vector3D.PLUS_J, 0.01, 0.1, new Vector3D(0, -0.05, 0));

    private static ResolvedInstrument instrument(List<ResolvedDetector> detectors, List<ResolvedGridDetector> grids,
                                                 List<ResolvedMonitor> monitors) {
        return new ResolvedInstrument("TEST", "m", Vector3D.ZERO, Vector3D.ZERO, null, monitors, detectors, grids,
                List.of());
    }

    private static ResolvedDetector tubeDetector(String name, List<Vector3D> offsets, Vector3D location) {
        List<Integer> ids = new java.util.ArrayList<>();
        for (int i = 0; i < offsets.size(); i++) {
            ids.add(i + 1);
        }
        return new ResolvedDetector(name, List.of("bank", "pixel"), "pixel", TUBE_PIXEL, offsets, ids, location, null);
    }

    @Test
    void build_miniInstrumentLayout() {
        ResolvedInstrument resolved = new HierarchyResolver().resolveInstrument(IdfDocument.parse(IdfFixtures.MINI));

        NexusTree tree = new GeometryBuilder().build(resolved);

        assertThat(tree.group("/entry").nxClass()).isEqualTo("NXentry");
        NexusDataset name = tree.dataset("/entry/instrument/name");
        assertThat(name.text()).isEqualTo("MINI");
        assertThat(name.stringAttribute("short_name")).isEqualTo("MIN");

        NexusGroup detector = tree.group("/entry/instrument/detector_1");
        assertThat(detector.nxClass()).isEqualTo("NXdetector");
        assertThat(detector.dataset("local_name").text()).isEqualTo("bank");
        assertThat(detector.dataset("detector_number").ints()).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(detector.dataset("detector_number").dtype()).isEqualTo(NexusDType.INT32);
        assertThat(detector.dataset("x_pixel_offset").size()).isEqualTo(6);
        assertThat(detector.contains("z_pixel_offset")).isFalse();

        NexusGroup pixelShape = detector.group(GeometryBuilder.PIXEL_SHAPE);
        assertThat(pixelShape.nxClass()).isEqualTo("NXcylindrical_geometry");
        assertThat(pixelShape.dataset("vertices").shape()).containsExactly(3, 3);
        assertThat(pixelShape.dataset("cylinders").ints()).containsExactly(0, 1, 2);

        String dependsOn = detector.dataset(GeometryBuilder.DEPENDS_ON).text();
        assertThat(dependsOn).isEqualTo("/entry/instrument/detector_1/transformations/location");
        NexusDataset location = tree.dataset(dependsOn);
        assertThat(location.scalarDouble()).isCloseTo(Math.sqrt(5), within(1e-12));
        assertThat(location.stringAttribute("transformation_type")).isEqualTo("translation");
        assertThat(location.stringAttribute("depends_on")).isEqualTo(".");

        assertThat(tree.group("/entry/instrument/mon1").nxClass()).isEqualTo("NXmonitor");
        assertThat(tree.dataset("/entry/instrument/mon2/detector_id").ints()).containsExactly(-2);
        assertThat(tree.group("/entry/instrument/mon1/shape").nxClass()).isEqualTo("NXcylindrical_geometry");
        assertThat(tree.group("/entry/instrument/source").nxClass()).isEqualTo("NXsource");
        assertThat(tree.dataset("/entry/sample/depends_on").text()).isEqualTo("/entry/sample/transformations/location");
    }

    @Test
    void build_sharesPixelGeometryBetweenIdenticalModules() {
        List<Vector3D> offsets = List.of(new Vector3D(0, 0, 0), new Vector3D(0, 0.1, 0));
        ResolvedInstrument resolved = instrument(List.of(
                tubeDetector("left", offsets, new Vector3D(-1, 0, 0)),
                tubeDetector("right", offsets, new Vector3D(1, 0, 0)),
                tubeDetector("other", List.of(new Vector3D(0, 0, 0), new Vector3D(0, 0.2, 0)), Vector3D.PLUS_K)),
                List.of(), List.of());

        NexusTree tree = new GeometryBuilder().build(resolved);

        NexusGroup first = tree.group("/entry/instrument/detector_1");
        NexusGroup second = tree.group("/entry/instrument/detector_2");
        NexusGroup third = tree.group("/entry/instrument/detector_3");
        assertThat(second.isLink(GeometryBuilder.PIXEL_SHAPE)).isTrue();
        assertThat(second.isLink("x_pixel_offset")).isTrue();
        assertThat(second.child(GeometryBuilder.PIXEL_SHAPE)).isSameAs(first.child(GeometryBuilder.PIXEL_SHAPE));
        assertThat(third.isLink(GeometryBuilder.PIXEL_SHAPE)).isFalse();
        assertThat(third.dataset("y_pixel_offset").doubles()).containsExactly(0.0, 0.2);
    }

    @Test
    void build_laterModuleWithSameChainBecomesSharingSource() {
        List<Vector3D> narrow = List.of(new Vector3D(0, 0, 0), new Vector3D(0, 0.1, 0));
        List<Vector3D> wide = List.of(new Vector3D(0, 0, 0), new Vector3D(0, 0.2, 0));
        ResolvedInstrument resolved = instrument(List.of(
                tubeDetector("narrow", narrow, Vector3D.ZERO),
                tubeDetector("wide", wide, Vector3D.PLUS_I),
                tubeDetector("wide-again", wide, Vector3D.PLUS_J)),
                List.of(), List.of());

        NexusTree tree = new GeometryBuilder().build(resolved);

        NexusGroup wideGroup = tree.group("/entry/instrument/detector_2");
        NexusGroup again = tree.group("/entry/instrument/detector_3");
        assertThat(wideGroup.isLink(GeometryBuilder.PIXEL_SHAPE)).isFalse();
        assertThat(again.isLink(GeometryBuilder.PIXEL_SHAPE)).isTrue();
        assertThat(again.child("y_pixel_offset")).isSameAs(wideGroup.child("y_pixel_offset"));
    }

    @Test
    void build_duplicateMonitorNamesGetIdSuffix() {
        ResolvedInstrument resolved = instrument(List.of(), List.of(), List.of(
                new ResolvedMonitor("monitor", "m", 1, Vector3D.PLUS_K, null),
                new ResolvedMonitor("monitor", "m", 2, new Vector3D(0, 0, 2), null),
                new ResolvedMonitor("solo", "m", 3, new Vector3D(0, 0, 3), new PixelShape.Cuboid(0.1, 0.2, 0.3))));

        NexusTree tree = new GeometryBuilder().build(resolved);

        NexusGroup nxInstrument = tree.group("/entry/instrument");
        assertThat(nxInstrument.groupsOfClass("NXmonitor")).extracting(NexusNode::name)
                .containsExactly("monitor_1", "monitor_2", "solo");
        NexusGroup box = tree.group("/entry/instrument/solo/shape");
        assertThat(box.nxClass()).isEqualTo("NXoff_geometry");
        assertThat(box.dataset("vertices").shape()).containsExactly(8, 3);
        assertThat(box.dataset("faces").ints()).containsExactly(0, 4, 8, 12, 16, 20);
    }

    @Test
    void build_gridDetectorWritesQuadFacesAndFaceIds() {
        List<Vector3D> vertices = List.of(
                new Vector3D(0, 0, 0), new Vector3D(1, 0, 0), new Vector3D(2, 0, 0),
                new Vector3D(0, 1, 0), new Vector3D(1, 1, 0), new Vector3D(2, 1, 0));
        ResolvedGridDetector grid = new ResolvedGridDetector("grid", "grid", 2, 1, vertices,
                List.of(new Vector3D(0.5, 0.5, 0), new Vector3D(1.5, 0.5, 0)), List.of(7, 8), Vector3D.PLUS_K, null);

        NexusTree tree = new GeometryBuilder("raw").build(instrument(List.of(), List.of(grid), List.of()));

        NexusGroup shape = tree.group("/raw/instrument/detector_1/" + GeometryBuilder.DETECTOR_SHAPE);
        assertThat(shape.nxClass()).isEqualTo("NXoff_geometry");
        assertThat(shape.dataset("winding_order").ints()).containsExactly(0, 3, 4, 1, 1, 4, 5, 2);
        assertThat(shape.dataset("faces").ints()).containsExactly(0, 4);
        assertThat(shape.dataset("detector_faces").ints()).containsExactly(0, 7, 1, 8);
        assertThat(shape.dataset("detector_faces").shape()).containsExactly(2, 2);
    }

    @Test
    void emitTransformChain_rotationThenTranslation() {
        NexusTree tree = new NexusTree();
        NexusGroup component = tree.root().addGroup("component", "NXdetector");

        String path = GeometryBuilder.emitTransformChain(component, new Vector3D(0, 0, 2),
                new Orientation(Vector3D.PLUS_J, 30.0), "m");

        NexusDataset location = tree.dataset(path);
        assertThat(location.stringAttribute("depends_on")).isEqualTo("/component/transformations/orientation");
        assertThat(location.vectorAttribute("vector")).containsExactly(0.0, 0.0, 1.0);
        NexusDataset orientation = tree.dataset("/component/transformations/orientation");
        assertThat(orientation.stringAttribute("transformation_type")).isEqualTo("rotation");
        assertThat(orientation.stringAttribute("units")).isEqualTo("degrees");
        assertThat(orientation.scalarDouble()).isEqualTo(30.0);
        assertThat(orientation.stringAttribute("depends_on")).isEqualTo(".");
    }

    @Test
    void emitTransformChain_zeroTranslationKeepsUnitVector() {
        NexusTree tree = new NexusTree();
        NexusGroup component = tree.root().addGroup("component", "NXsample");

        String path = GeometryBuilder.emitTransformChain(component, Vector3D.ZERO, null, "m");

        NexusDataset location = tree.dataset(path);
        assertThat(location.scalarDouble()).isEqualTo(0.0);
        assertThat(location.vectorAttribute("vector")).containsExactly(0.0, 0.0, 1.0);
    }

    @Test
    void buildShape_cylinderAsThreePoints() {
        ShapeGeometry.Cylinders cylinders = (ShapeGeometry.Cylinders) GeometryBuilder.buildShape(TUBE_PIXEL);

        double[] v = cylinders.vertices();
        Vector3D bottom = new Vector3D(v[0], v[1], v[2]);
        Vector3D edge = new Vector3D(v[3], v[4], v[5]);
        Vector3D top = new Vector3D(v[6], v[7], v[8]);
        assertThat(bottom.distance(new Vector3D(0, -0.05, 0))).isLessThan(1e-12);
        assertThat(top.distance(new Vector3D(0, 0.05, 0))).isLessThan(1e-12);
        assertThat(edge.distance(bottom)).isCloseTo(0.01, within(1e-12));
        assertThat(edge.subtract(bottom).dotProduct(Vector3D.PLUS_J)).isCloseTo(0.0, within(1e-12));
        assertThat(cylinders.cylinders()).containsExactly(0, 1, 2);
    }
}
