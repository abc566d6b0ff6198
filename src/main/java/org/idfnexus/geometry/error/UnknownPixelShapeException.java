package org.idfnexus.geometry.error;

/**
 * detector/monitor 类型上没有（或有多于一个）可识别的几何图元。
 */
public class UnknownPixelShapeException extends IdfConversionException {

    public UnknownPixelShapeException(String message, String typeName) {
        super(message, typeName);
    }
}
