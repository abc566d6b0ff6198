package org.idfnexus.geometry.idf;

/**
 * 顶层组件解析失败时的处理方式。
 */
public enum FailureMode {
    /**
     * 立即抛出，终止整个转换。
     */
    ABORT,
    /**
     * 记录失败原因并跳过该组件，继续处理其余组件（批量“试转所有 IDF”时使用）。
     */
    SKIP
}
