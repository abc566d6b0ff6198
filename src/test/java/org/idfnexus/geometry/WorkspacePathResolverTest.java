package org.idfnexus.geometry;

import org.idfnexus.geometry.dto.AllowedRoot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkspacePathResolverTest {

    @TempDir
    Path workspace;

    @TempDir
    Path outside;

    private WorkspacePathResolver resolver(Path... roots) {
        IdfConverterProperties properties = new IdfConverterProperties();
        properties.setRoots(Arrays.stream(roots).map(Path::toString).toList());
        return new WorkspacePathResolver(properties);
    }

    @Test
    void listRoots_numbersRootsInOrder() {
        WorkspacePathResolver resolver = resolver(workspace, outside);

        assertThat(resolver.listRoots()).extracting(AllowedRoot::id).containsExactly("root0", "root1");
        assertThat(resolver.listRoots().get(0).path()).isEqualTo(workspace.toAbsolutePath().normalize().toString());
    }

    @Test
    void resolveInput_relativeAndAbsolutePaths() throws Exception {
        Path idf = Files.createDirectories(workspace.resolve("idf")).resolve("MINI_Definition.xml");
        Files.writeString(idf, "<instrument/>");
        WorkspacePathResolver resolver = resolver(outside, workspace);

        WorkspacePathResolver.ResolvedPath relative = resolver.resolveInput("root1", "idf/MINI_Definition.xml");
        WorkspacePathResolver.ResolvedPath absolute = resolver.resolveInput(null, idf.toString());

        assertThat(relative.absolutePath()).isEqualTo(idf.toAbsolutePath().normalize());
        assertThat(relative.displayPath()).isEqualTo(Path.of("idf", "MINI_Definition.xml").toString());
        // 绝对路径且未给 rootId 时按所在目录匹配 root
        assertThat(absolute.rootId()).isEqualTo("root1");
    }

    @Test
    void resolveInput_rejectsTraversalMissingAndDirectories() throws Exception {
        Files.writeString(outside.resolve("secret.xml"), "<instrument/>");
        Files.createDirectories(workspace.resolve("dir"));
        WorkspacePathResolver resolver = resolver(workspace);

        assertThatThrownBy(() -> resolver.resolveInput(null, "../" + outside.getFileName() + "/secret.xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("根目录范围");
        assertThatThrownBy(() -> resolver.resolveInput(null, outside.resolve("secret.xml").toString()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveInput(null, "nothing.xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不存在");
        assertThatThrownBy(() -> resolver.resolveInput(null, "dir"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不是普通文件");
        assertThatThrownBy(() -> resolver.resolveInput(null, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolve_unknownRootId() {
        WorkspacePathResolver resolver = resolver(workspace);

        assertThatThrownBy(() -> resolver.resolveInput("root7", "a.xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("root7");
    }

    @Test
    void resolveOutput_allowsNewFilesButNotDirectories() throws Exception {
        Files.createDirectories(workspace.resolve("out"));
        WorkspacePathResolver resolver = resolver(workspace);

        WorkspacePathResolver.ResolvedPath output = resolver.resolveOutput(null, "out/new/geometry.off");

        assertThat(output.absolutePath()).isEqualTo(workspace.resolve("out/new/geometry.off").toAbsolutePath().normalize());
        assertThatThrownBy(() -> resolver.resolveOutput(null, "out"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("目录");
        assertThatThrownBy(() -> resolver.resolveOutput(null, ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolve_rejectsSymlinksUnlessAllowed() throws Exception {
        Files.writeString(outside.resolve("target.xml"), "<instrument/>");
        Files.createSymbolicLink(workspace.resolve("link.xml"), outside.resolve("target.xml"));

        assertThatThrownBy(() -> resolver(workspace).resolveInput(null, "link.xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("符号链接");

        IdfConverterProperties permissive = new IdfConverterProperties();
        permissive.setRoots(List.of(workspace.toString()));
        permissive.setAllowSymlink(true);
        // 即使允许符号链接，指向根目录之外仍然被拒绝
        assertThatThrownBy(() -> new WorkspacePathResolver(permissive).resolve(null, "link.xml", true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("逃逸");
    }

    @Test
    void resolveInput_followsSymlinkInsideRootWhenAllowed() throws Exception {
        Path target = Files.createDirectories(workspace.resolve("real")).resolve("MINI_Definition.xml");
        Files.writeString(target, "<instrument/>");
        Files.createSymbolicLink(workspace.resolve("current.xml"), target);
        IdfConverterProperties permissive = new IdfConverterProperties();
        permissive.setRoots(List.of(workspace.toString()));
        permissive.setAllowSymlink(true);

        WorkspacePathResolver.ResolvedPath resolved = new WorkspacePathResolver(permissive).resolveInput(null, "current.xml");

        assertThat(resolved.displayPath()).isEqualTo("current.xml");
        assertThatThrownBy(() -> resolver(workspace).resolveInput(null, "current.xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("符号链接");
    }

    @Test
    void resolve_withoutRootsFails() {
        IdfConverterProperties properties = new IdfConverterProperties();
        properties.setRoots(List.of());

        assertThatThrownBy(() -> new WorkspacePathResolver(properties).resolveInput(null, "a.xml"))
                .isInstanceOf(IllegalStateException.class);
    }
}
