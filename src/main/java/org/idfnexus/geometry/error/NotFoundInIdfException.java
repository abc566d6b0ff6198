package org.idfnexus.geometry.error;

/**
 * IDF 中缺少必需元素（样品位置、像素形状、中子源等）。
 */
public class NotFoundInIdfException extends IdfConversionException {

    public NotFoundInIdfException(String message) {
        super(message);
    }

    public NotFoundInIdfException(String message, String componentName) {
        super(message, componentName);
    }
}
