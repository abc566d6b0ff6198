package org.idfnexus.geometry.dto;

/**
 * SKIP 模式下被跳过的顶层组件。
 *
 * @param componentName 组件名（或类型名）
 * @param errorType     错误类型（异常类的简单名）
 * @param reason        失败原因
 */
public record SkippedComponent(String componentName, String errorType, String reason) {
}
