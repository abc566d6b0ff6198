package org.idfnexus.geometry.error;

/**
 * 两个向量反向平行，旋转轴没有唯一定义。
 * <p>
 * 这里不会随意挑选一个垂直轴，而是直接拒绝该输入。
 */
public class DegenerateRotationException extends IdfConversionException {

    public DegenerateRotationException(String message) {
        super(message);
    }
}
