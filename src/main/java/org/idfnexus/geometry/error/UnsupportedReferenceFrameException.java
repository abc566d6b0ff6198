package org.idfnexus.geometry.error;

/**
 * 不支持的参考坐标系声明，例如球坐标的极轴不是 z 轴。
 */
public class UnsupportedReferenceFrameException extends IdfConversionException {

    public UnsupportedReferenceFrameException(String message) {
        super(message);
    }
}
