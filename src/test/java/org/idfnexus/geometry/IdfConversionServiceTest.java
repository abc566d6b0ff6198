package org.idfnexus.geometry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.idfnexus.geometry.dto.DetectorModuleSummary;
import org.idfnexus.geometry.dto.InstrumentDescription;
import org.idfnexus.geometry.dto.NexusConversionResult;
import org.idfnexus.geometry.dto.OffExportResult;
import org.idfnexus.geometry.idf.FailureMode;
import org.idfnexus.geometry.idf.HierarchyResolver;
import org.idfnexus.geometry.idf.IdfFixtures;
import org.idfnexus.geometry.mesh.Mesh;
import org.idfnexus.geometry.mesh.OffFormat;
import org.idfnexus.geometry.mesh.TransformChainFlattener;
import org.idfnexus.geometry.nexus.GeometryBuilder;
import org.idfnexus.geometry.nexus.NexusJsonStore;
import org.idfnexus.geometry.nexus.NexusTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdfConversionServiceTest {

    private static final String TWO_MODULES = IdfFixtures.instrument("TWO", """
              <component type="good" idlist="good-ids"><location/></component>
              <component type="also-good" idlist="also-good-ids"><location x="1.0"/></component>
              <component type="bad" idlist="missing-ids"><location x="2.0"/></component>
              <type name="good"><component type="square"><location/></component></type>
              <type name="also-good"><component type="square"><location/></component></type>
              <type name="bad"><component type="square"><location/></component></type>
            """ + IdfFixtures.CUBOID_PIXEL + """
              <idlist idname="good-ids"><id val="1"/></idlist>
              <idlist idname="also-good-ids"><id val="2"/></idlist>
            """);

    @TempDir
    Path workspace;

    private IdfConverterProperties properties;
    private NexusJsonStore store;

    @BeforeEach
    void setUp() throws Exception {
        properties = new IdfConverterProperties();
        properties.setRoots(List.of(workspace.toString()));
        store = new NexusJsonStore(new ObjectMapper());
        Files.writeString(workspace.resolve("MINI_Definition.xml"), IdfFixtures.MINI);
        Files.writeString(workspace.resolve("TWO_Definition.xml"), TWO_MODULES);
    }

    private IdfConversionService service() {
        return new IdfConversionService(
                properties,
                new WorkspacePathResolver(properties),
                new HierarchyResolver(properties.getFailureMode(), properties.isOriginAtSample()),
                new GeometryBuilder(properties.getEntryName()),
                new TransformChainFlattener(properties.getTubePointsPerEnd(), properties.getParallelReplicationThreshold()),
                store);
    }

    @Test
    void describe_summarisesInstrument() {
        InstrumentDescription description = service().describe(null, "MINI_Definition.xml", null);

        assertThat(description.rootId()).isEqualTo("root0");
        assertThat(description.instrumentName()).isEqualTo("MINI");
        assertThat(description.sourceName()).isEqualTo("moderator");
        assertThat(description.sourcePosition()).containsExactly(0.0, 0.0, -10.0);
        assertThat(description.samplePosition()).containsExactly(0.0, 0.0, 0.0);
        assertThat(description.monitorCount()).isEqualTo(2);
        assertThat(description.detectorModuleCount()).isEqualTo(1);
        assertThat(description.totalPixels()).isEqualTo(6);
        assertThat(description.truncated()).isFalse();
        assertThat(description.skipped()).isEmpty();

        DetectorModuleSummary bank = description.detectors().get(0);
        assertThat(bank.kind()).isEqualTo("module");
        assertThat(bank.pixelTypeName()).isEqualTo("pixel");
        assertThat(bank.pixelCount()).isEqualTo(6);
        assertThat(bank.firstId()).isEqualTo(1);
        assertThat(bank.lastId()).isEqualTo(6);
        assertThat(bank.location()).containsExactly(1.0, 0.0, 2.0);
    }

    @Test
    void describe_truncatesAndReportsSkippedComponents() {
        properties.setFailureMode(FailureMode.SKIP);

        InstrumentDescription description = service().describe(null, "TWO_Definition.xml", 1);

        assertThat(description.detectorModuleCount()).isEqualTo(2);
        assertThat(description.detectors()).extracting(DetectorModuleSummary::name).containsExactly("good");
        assertThat(description.truncated()).isTrue();
        assertThat(description.skipped()).singleElement()
                .satisfies(s -> assertThat(s.componentName()).isEqualTo("bad"));
    }

    @Test
    void describe_abortModeFailsOnBadComponent() {
        assertThatThrownBy(() -> service().describe(null, "TWO_Definition.xml", null))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("bad");
    }

    @Test
    void convertToNexus_thenExportOff_matchesDirectConversion() throws Exception {
        IdfConversionService service = service();

        NexusConversionResult nexus = service.convertToNexus(null, "MINI_Definition.xml", "out/mini.nxs.json");
        OffExportResult fromNexus = service.exportOff(null, "out/mini.nxs.json", "out/from-nexus.off");
        OffExportResult direct = service.convertToOff(null, "MINI_Definition.xml", "out/direct.off");

        assertThat(nexus.detectorGroups()).isEqualTo(1);
        assertThat(nexus.monitorCount()).isEqualTo(2);
        assertThat(nexus.totalPixels()).isEqualTo(6);
        assertThat(nexus.bytesWritten()).isEqualTo(Files.size(workspace.resolve("out/mini.nxs.json")));
        NexusTree tree = store.read(workspace.resolve("out/mini.nxs.json"));
        assertThat(tree.group("/entry/instrument/detector_1")).isNotNull();

        assertThat(fromNexus.geometryGroups()).isEqualTo(3);
        assertThat(fromNexus.vertexCount()).isEqualTo(80);
        assertThat(fromNexus.faceCount()).isEqualTo(40);
        assertThat(direct.vertexCount()).isEqualTo(fromNexus.vertexCount());
        Mesh a = OffFormat.read(workspace.resolve("out/from-nexus.off"));
        Mesh b = OffFormat.read(workspace.resolve("out/direct.off"));
        assertThat(a.vertices()).containsExactly(b.vertices());
        assertThat(a.windingOrder()).containsExactly(b.windingOrder());
        // 导出的 OFF 与整台仪器展开的结果一致
        Mesh flattened = new TransformChainFlattener().flattenInstrument(tree);
        assertThat(a.vertices()).containsExactly(flattened.vertices());
        assertThat(a.faces()).containsExactly(flattened.faces());
    }

    @Test
    void convertToNexus_overwritesExistingOutput() throws Exception {
        Path output = Files.createDirectories(workspace.resolve("out")).resolve("mini.nxs.json");
        Files.writeString(output, "stale");

        service().convertToNexus(null, "MINI_Definition.xml", "out/mini.nxs.json");

        assertThat(Files.readString(output)).doesNotContain("stale").contains("NXentry");
    }

    @Test
    void convert_rejectsOversizedIdfAndEscapingOutput() {
        properties.setMaxIdfSize(DataSize.ofBytes(64));

        assertThatThrownBy(() -> service().describe(null, "MINI_Definition.xml", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("过大");

        properties.setMaxIdfSize(DataSize.ofMegabytes(1));
        assertThatThrownBy(() -> service().convertToOff(null, "MINI_Definition.xml", "../escape.off"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
