package org.idfnexus.geometry.error;

/**
 * IDF → NeXus 几何转换过程中的结构性错误（不可恢复、不重试）。
 * <p>
 * 说明：
 * <ul>
 *   <li>所有子类都是确定性的输入结构问题，而不是瞬时故障，因此调用方不应重试。</li>
 *   <li>{@link #getComponentName()} 记录出错的组件/类型名（若已知），便于批量转换时定位。</li>
 * </ul>
 */
public class IdfConversionException extends RuntimeException {

    private final String componentName;

    public IdfConversionException(String message) {
        this(message, null, null);
    }

    public IdfConversionException(String message, String componentName) {
        this(message, componentName, null);
    }

    public IdfConversionException(String message, String componentName, Throwable cause) {
        super(componentName == null ? message : message + "（组件/类型：" + componentName + "）", cause);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
