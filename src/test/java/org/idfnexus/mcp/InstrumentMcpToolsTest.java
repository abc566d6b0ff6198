package org.idfnexus.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.idfnexus.geometry.IdfConversionService;
import org.idfnexus.geometry.IdfConverterProperties;
import org.idfnexus.geometry.WorkspacePathResolver;
import org.idfnexus.geometry.dto.AllowedRootsResult;
import org.idfnexus.geometry.idf.HierarchyResolver;
import org.idfnexus.geometry.idf.IdfFixtures;
import org.idfnexus.geometry.mesh.TransformChainFlattener;
import org.idfnexus.geometry.nexus.GeometryBuilder;
import org.idfnexus.geometry.nexus.NexusJsonStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InstrumentMcpToolsTest {

    @TempDir
    Path workspace;

    private InstrumentMcpTools tools() {
        IdfConverterProperties properties = new IdfConverterProperties();
        properties.setRoots(List.of(workspace.toString()));
        WorkspacePathResolver resolver = new WorkspacePathResolver(properties);
        IdfConversionService service = new IdfConversionService(properties, resolver, new HierarchyResolver(),
                new GeometryBuilder(), new TransformChainFlattener(), new NexusJsonStore(new ObjectMapper()));
        return new InstrumentMcpTools(resolver, service);
    }

    @Test
    void toolCallbacks_exposeAllTools() {
        List<ToolCallback> callbacks = Arrays.asList(ToolCallbacks.from(tools()));

        assertThat(callbacks).extracting(c -> c.getToolDefinition().name())
                .containsExactlyInAnyOrder("idf_list_roots", "idf_describe", "idf_to_nexus", "nexus_to_off", "idf_to_off");
    }

    @Test
    void tools_runTheWholePipeline() throws Exception {
        Files.writeString(workspace.resolve("MINI_Definition.xml"), IdfFixtures.MINI);
        InstrumentMcpTools tools = tools();

        AllowedRootsResult roots = tools.listRoots();
        assertThat(roots.roots()).singleElement().satisfies(r -> assertThat(r.id()).isEqualTo("root0"));

        assertThat(tools.describe("root0", "MINI_Definition.xml", 10).totalPixels()).isEqualTo(6);
        assertThat(tools.toNexus("root0", "MINI_Definition.xml", "mini.nxs.json").detectorGroups()).isEqualTo(1);
        assertThat(tools.nexusToOff("root0", "mini.nxs.json", "mini.off").faceCount()).isEqualTo(40);
        assertThat(tools.idfToOff(null, "MINI_Definition.xml", "direct.off").faceCount()).isEqualTo(40);
        assertThat(workspace.resolve("mini.off")).exists();
    }
}
