package org.idfnexus.geometry.error;

/**
 * idlist 引用缺失，或 id 数量与像素偏移数量不一致。
 */
public class MalformedIdListException extends IdfConversionException {

    public MalformedIdListException(String message, String componentName) {
        super(message, componentName);
    }
}
