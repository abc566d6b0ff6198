package org.idfnexus.geometry.idf;

/**
 * SKIP 模式下被跳过的顶层组件及原因。
 *
 * @param componentName 组件（或类型）名
 * @param errorType     异常类型简单名
 * @param reason        异常信息
 */
public record ResolutionFailure(String componentName, String errorType, String reason) {

    static ResolutionFailure of(String componentName, RuntimeException e) {
        return new ResolutionFailure(componentName, e.getClass().getSimpleName(), e.getMessage());
    }
}
