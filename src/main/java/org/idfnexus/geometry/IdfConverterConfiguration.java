package org.idfnexus.geometry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.idfnexus.geometry.idf.HierarchyResolver;
import org.idfnexus.geometry.mesh.TransformChainFlattener;
import org.idfnexus.geometry.nexus.GeometryBuilder;
import org.idfnexus.geometry.nexus.NexusJsonStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 几何转换服务的 Bean 装配。
 * <p>
 * 把 {@link IdfConverterProperties} 中的失败策略、原点、细分与并行阈值注入到各个无状态组件中；
 * 不引入数据库或外部服务，输入输出全部是工作区内的本地文件。
 */
@Configuration(proxyBeanMethods = false)
public class IdfConverterConfiguration {

    @Bean
    public WorkspacePathResolver workspacePathResolver(IdfConverterProperties properties) {
        return new WorkspacePathResolver(properties);
    }

    @Bean
    public HierarchyResolver hierarchyResolver(IdfConverterProperties properties) {
        return new HierarchyResolver(properties.getFailureMode(), properties.isOriginAtSample());
    }

    @Bean
    public GeometryBuilder geometryBuilder(IdfConverterProperties properties) {
        return new GeometryBuilder(properties.getEntryName());
    }

    @Bean
    public TransformChainFlattener transformChainFlattener(IdfConverterProperties properties) {
        return new TransformChainFlattener(properties.getTubePointsPerEnd(), properties.getParallelReplicationThreshold());
    }

    @Bean
    public NexusJsonStore nexusJsonStore(ObjectProvider<ObjectMapper> objectMapper) {
        // 非 web 应用不一定有 Jackson 自动配置的 ObjectMapper
        return new NexusJsonStore(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public IdfConversionService idfConversionService(IdfConverterProperties properties,
                                                     WorkspacePathResolver pathResolver,
                                                     HierarchyResolver hierarchyResolver,
                                                     GeometryBuilder geometryBuilder,
                                                     TransformChainFlattener transformChainFlattener,
                                                     NexusJsonStore nexusJsonStore) {
        return new IdfConversionService(properties, pathResolver, hierarchyResolver, geometryBuilder,
                transformChainFlattener, nexusJsonStore);
    }
}
