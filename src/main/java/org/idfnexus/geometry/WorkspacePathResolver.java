package org.idfnexus.geometry;

import org.idfnexus.geometry.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 工作区路径解析器：把工具调用传入的 IDF / NeXus / OFF 路径解析成受控的绝对路径，
 * 并确保它不会逃逸出 {@code app.idf.roots} 白名单。
 * <p>
 * 规则：
 * <ul>
 *   <li>绝对路径匹配层级最长的 root；相对路径从 rootId 指定的 root 解析，rootId 为空时用 root0。</li>
 *   <li>阻止 {@code ../} 穿越；默认禁止符号链接，并对逐级目录做 realPath 校验（junction 也会被挡住）。</li>
 *   <li>输出文件可能尚不存在，因此只对已存在的父目录链路做校验。</li>
 * </ul>
 */
public class WorkspacePathResolver {

    private final IdfConverterProperties properties;
    private final List<Root> roots;

    public WorkspacePathResolver(IdfConverterProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties);
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    /**
     * 解析一个必须已存在的输入文件。
     */
    public ResolvedPath resolveInput(String rootId, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("path 不能为空");
        }
        ResolvedPath resolved = resolve(rootId, inputPath, true);
        LinkOption[] options = properties.isAllowSymlink() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        if (!Files.isRegularFile(resolved.absolutePath(), options)) {
            throw new IllegalArgumentException("不是普通文件：" + inputPath);
        }
        return resolved;
    }

    /**
     * 解析一个输出文件（可以尚不存在，但不能是目录）。
     */
    public ResolvedPath resolveOutput(String rootId, String outputPath) {
        if (outputPath == null || outputPath.isBlank()) {
            throw new IllegalArgumentException("输出路径不能为空");
        }
        ResolvedPath resolved = resolve(rootId, outputPath, false);
        if (Files.isDirectory(resolved.absolutePath())) {
            throw new IllegalArgumentException("输出路径是目录：" + outputPath);
        }
        return resolved;
    }

    public ResolvedPath resolve(String rootId, String inputPath, boolean requireExists) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.idf.roots）");
        }

        Path rawPath = (inputPath == null || inputPath.isBlank()) ? null : Path.of(inputPath);
        Root selectedRoot;
        Path absolute;

        if (rawPath != null && rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = (rawPath == null) ? selectedRoot.rootPath() : selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        // 字符串层面先挡掉明显越界的路径
        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }

        validateWithinRoot(selectedRoot, absolute, requireExists);

        return new ResolvedPath(selectedRoot.id(), selectedRoot.rootPath(), absolute, displayPath(selectedRoot, absolute));
    }

    private void validateWithinRoot(Root root, Path absolute, boolean requireExists) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        if (requireExists && !Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + absolute);
        }

        // 逐级 realPath 校验，防止中间某一级是 junction/symlink
        Path current = root.rootPath();
        Path relative = root.rootPath().relativize(absolute);
        for (Path segment : relative) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (!properties.isAllowSymlink() && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            try {
                Path realCurrent = current.toRealPath();
                if (!realCurrent.startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(IdfConverterProperties properties) {
        List<String> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.idf.roots[" + i + "] 不能为空");
            Path path = Path.of(value).toAbsolutePath().normalize();
            result.add(new Root("root" + i, path));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        String relative = root.rootPath().relativize(absolute).toString();
        return relative.isEmpty() ? "." : relative;
    }

    private record Root(String id, Path rootPath) {
    }

    /**
     * @param rootId       命中的根目录标识
     * @param rootPath     根目录绝对路径
     * @param absolutePath 解析后的绝对路径
     * @param displayPath  相对根目录的展示路径
     */
    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
