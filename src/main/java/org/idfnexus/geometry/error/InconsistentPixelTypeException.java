package org.idfnexus.geometry.error;

/**
 * 同一个探测器模块下的子组件解析出了不同的像素类型（不支持多像素类型模块）。
 */
public class InconsistentPixelTypeException extends IdfConversionException {

    public InconsistentPixelTypeException(String message, String typeName) {
        super(message, typeName);
    }
}
