package org.idfnexus.geometry;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.idfnexus.geometry.idf.FailureMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * IDF → NeXus 几何转换服务的业务配置（{@code app.idf.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读写的根目录白名单，IDF 输入与 NeXus/OFF 输出都只能落在这些目录内。</li>
 *   <li>通过 {@link #failureMode} 决定单个顶层组件解析失败时中止整次转换还是跳过并记录。</li>
 *   <li>通过 {@link #maxIdfSize} 限制单个 IDF 文件大小，避免一次性把超大 XML 读进 DOM。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.idf")
public class IdfConverterProperties {

    /**
     * 允许访问的根目录白名单。
     * <p>
     * 每个 root 会自动分配一个 {@code rootId}（root0、root1...）；工具调用时可传入 rootId + 相对路径，
     * 或直接传入绝对路径（会自动匹配到最合适的 root）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接（默认不允许，防止路径逃逸出根目录）。
     */
    private boolean allowSymlink = false;

    /**
     * 顶层组件解析失败时的处理方式：ABORT 直接失败，SKIP 跳过该组件并在结果中列出原因。
     */
    @NotNull
    private FailureMode failureMode = FailureMode.ABORT;

    /**
     * NeXus 树中 NXentry 组的名字。
     */
    @NotBlank
    private String entryName = "entry";

    /**
     * 是否以样品位置作为 NeXus 坐标原点。
     */
    private boolean originAtSample = true;

    /**
     * 圆柱像素展开成管状网格时每个端面的点数。
     */
    @Min(3)
    @Max(360)
    private int tubePointsPerEnd = 5;

    /**
     * 像素复制超过该数量时改为并行填充。
     */
    @Min(1)
    private int parallelReplicationThreshold = 4096;

    /**
     * 单个 IDF 文件的大小上限。
     */
    @NotNull
    private DataSize maxIdfSize = DataSize.ofMegabytes(64);

    /**
     * {@code idf_describe} 最多列出的探测器模块数（超出部分只计数）。
     */
    @Min(1)
    @Max(100_000)
    private int describeMaxDetectors = 200;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public FailureMode getFailureMode() {
        return failureMode;
    }

    public void setFailureMode(FailureMode failureMode) {
        this.failureMode = failureMode;
    }

    public String getEntryName() {
        return entryName;
    }

    public void setEntryName(String entryName) {
        this.entryName = entryName;
    }

    public boolean isOriginAtSample() {
        return originAtSample;
    }

    public void setOriginAtSample(boolean originAtSample) {
        this.originAtSample = originAtSample;
    }

    public int getTubePointsPerEnd() {
        return tubePointsPerEnd;
    }

    public void setTubePointsPerEnd(int tubePointsPerEnd) {
        this.tubePointsPerEnd = tubePointsPerEnd;
    }

    public int getParallelReplicationThreshold() {
        return parallelReplicationThreshold;
    }

    public void setParallelReplicationThreshold(int parallelReplicationThreshold) {
        this.parallelReplicationThreshold = parallelReplicationThreshold;
    }

    public DataSize getMaxIdfSize() {
        return maxIdfSize;
    }

    public void setMaxIdfSize(DataSize maxIdfSize) {
        this.maxIdfSize = maxIdfSize;
    }

    public int getDescribeMaxDetectors() {
        return describeMaxDetectors;
    }

    public void setDescribeMaxDetectors(int describeMaxDetectors) {
        this.describeMaxDetectors = describeMaxDetectors;
    }
}
